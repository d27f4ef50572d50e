package com.actionplan.taskimport.service.pipeline;

import java.util.List;

/**
 * Pre-flight verdict on a workbook's layout.
 *
 * @param missingHeaders canonical names of the required fields no header resolved to
 * @param headers non-blank header labels found in the first row
 */
public record StructureCheck(
    boolean valid, List<String> missingHeaders, List<String> headers, String message) {

  public StructureCheck {
    missingHeaders = List.copyOf(missingHeaders);
    headers = List.copyOf(headers);
  }

  public static StructureCheck valid(List<String> headers) {
    return new StructureCheck(true, List.of(), headers, "Workbook structure is valid");
  }

  public static StructureCheck invalid(
      List<String> missingHeaders, List<String> headers, String message) {
    return new StructureCheck(false, missingHeaders, headers, message);
  }
}
