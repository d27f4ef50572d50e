package com.actionplan.taskimport.diagnostics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;

/**
 * One entry of the per-row report.
 *
 * @param rowIndex 0-based grid index (header row = 0)
 * @param missingFields canonical names, only for {@link DiagnosticOutcome#SKIPPED_MISSING_REQUIRED_FIELD}
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ImportDiagnostic(
    int rowIndex, DiagnosticOutcome outcome, String detail, List<String> missingFields) {

  public ImportDiagnostic {
    missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
  }

  /** 1-based spreadsheet row number, as shown to operators. */
  @JsonProperty
  public int rowNumber() {
    return rowIndex + 1;
  }
}
