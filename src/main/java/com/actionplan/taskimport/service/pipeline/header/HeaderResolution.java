package com.actionplan.taskimport.service.pipeline.header;

import java.util.List;

/**
 * Outcome of matching a header row.
 *
 * @param headerMap every field that resolved, required or optional
 * @param missingRequired canonical names of unresolved required fields, in canonical order
 * @param headers the non-blank header labels of the file, left to right
 */
public record HeaderResolution(
    HeaderMap headerMap, List<String> missingRequired, List<String> headers) {

  public HeaderResolution {
    missingRequired = List.copyOf(missingRequired);
    headers = List.copyOf(headers);
  }

  public boolean isComplete() {
    return missingRequired.isEmpty();
  }
}
