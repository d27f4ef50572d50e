package com.actionplan.taskimport.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered outcome log of one import. Each data row contributes its warnings followed by exactly
 * one terminal outcome (accepted or skipped). Not thread-safe; one instance per import call.
 */
public class ImportDiagnostics {

  private final List<ImportDiagnostic> entries = new ArrayList<>();

  public void accepted(int rowIndex) {
    entries.add(
        ImportDiagnostic.builder().rowIndex(rowIndex).outcome(DiagnosticOutcome.ACCEPTED).build());
  }

  public void skippedEmpty(int rowIndex) {
    entries.add(
        ImportDiagnostic.builder()
            .rowIndex(rowIndex)
            .outcome(DiagnosticOutcome.SKIPPED_EMPTY)
            .build());
  }

  public void missingRequiredFields(int rowIndex, List<String> missingFields) {
    entries.add(
        ImportDiagnostic.builder()
            .rowIndex(rowIndex)
            .outcome(DiagnosticOutcome.SKIPPED_MISSING_REQUIRED_FIELD)
            .detail("Missing required field(s): " + String.join(", ", missingFields))
            .missingFields(missingFields)
            .build());
  }

  public void warnings(int rowIndex, List<RowWarning> warnings) {
    for (RowWarning warning : warnings) {
      entries.add(
          ImportDiagnostic.builder()
              .rowIndex(rowIndex)
              .outcome(warning.outcome())
              .detail(warning.detail())
              .build());
    }
  }

  public List<ImportDiagnostic> getEntries() {
    return Collections.unmodifiableList(entries);
  }

  public List<ImportDiagnostic> forRow(int rowIndex) {
    return entries.stream().filter(d -> d.rowIndex() == rowIndex).toList();
  }

  public int count(DiagnosticOutcome outcome) {
    return (int) entries.stream().filter(d -> d.outcome() == outcome).count();
  }

  public ImportSummary summarize() {
    int accepted = count(DiagnosticOutcome.ACCEPTED);
    int skippedEmpty = count(DiagnosticOutcome.SKIPPED_EMPTY);
    int rejected = count(DiagnosticOutcome.SKIPPED_MISSING_REQUIRED_FIELD);
    int warnings = (int) entries.stream().filter(d -> d.outcome().isWarning()).count();
    return new ImportSummary(accepted + skippedEmpty + rejected, accepted, skippedEmpty, rejected,
        warnings);
  }
}
