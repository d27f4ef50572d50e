package com.actionplan.taskimport.diagnostics;

/** A non-fatal anomaly found while normalizing one row. */
public record RowWarning(DiagnosticOutcome outcome, String field, String detail) {

  public RowWarning {
    if (!outcome.isWarning()) {
      throw new IllegalArgumentException(outcome + " is not a warning outcome");
    }
  }

  public static RowWarning dateUnparsed(String field, String cellReference, String rawValue) {
    return new RowWarning(
        DiagnosticOutcome.WARNING_DATE_UNPARSED,
        field,
        "%s (%s): '%s' is not a recognized date".formatted(field, cellReference, rawValue));
  }

  public static RowWarning unrecognizedCategory(
      String cellReference, String rawValue, String keptAs) {
    return new RowWarning(
        DiagnosticOutcome.WARNING_UNRECOGNIZED_CATEGORY,
        "category",
        "category (%s): '%s' is not in the vocabulary, kept as '%s'"
            .formatted(cellReference, rawValue, keptAs));
  }
}
