package com.actionplan.taskimport.diagnostics;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DiagnosticOutcome {
  ACCEPTED("Accepted", false),
  SKIPPED_EMPTY("SkippedEmpty", false),
  SKIPPED_MISSING_REQUIRED_FIELD("SkippedMissingRequiredField", false),
  WARNING_DATE_UNPARSED("WarningDateUnparsed", true),
  WARNING_UNRECOGNIZED_CATEGORY("WarningUnrecognizedCategory", true);

  private final String label;
  private final boolean warning;

  DiagnosticOutcome(String label, boolean warning) {
    this.label = label;
    this.warning = warning;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  public boolean isWarning() {
    return warning;
  }
}
