package com.actionplan.taskimport.diagnostics;

import com.actionplan.taskimport.domain.TaskRecord;
import java.util.List;

/** Records built by a successful import together with the per-row diagnostics. */
public record ImportReport(
    List<TaskRecord> records, List<ImportDiagnostic> diagnostics, ImportSummary summary) {

  public ImportReport {
    records = List.copyOf(records);
    diagnostics = List.copyOf(diagnostics);
  }

  public static ImportReport of(List<TaskRecord> records, ImportDiagnostics diagnostics) {
    return new ImportReport(records, diagnostics.getEntries(), diagnostics.summarize());
  }
}
