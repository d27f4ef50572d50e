package com.actionplan.taskimport.diagnostics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ImportDiagnosticsTest {

  @Test
  void entries_keepInsertionOrder_andSummarize() {
    var diagnostics = new ImportDiagnostics();
    diagnostics.warnings(1, List.of(RowWarning.dateUnparsed("deadline", "I2", "soon")));
    diagnostics.accepted(1);
    diagnostics.skippedEmpty(2);
    diagnostics.warnings(3, List.of(RowWarning.unrecognizedCategory("C4", "misc", "Misc")));
    diagnostics.missingRequiredFields(3, List.of("customer", "responsible"));

    assertThat(diagnostics.getEntries())
        .extracting(ImportDiagnostic::outcome)
        .containsExactly(
            DiagnosticOutcome.WARNING_DATE_UNPARSED,
            DiagnosticOutcome.ACCEPTED,
            DiagnosticOutcome.SKIPPED_EMPTY,
            DiagnosticOutcome.WARNING_UNRECOGNIZED_CATEGORY,
            DiagnosticOutcome.SKIPPED_MISSING_REQUIRED_FIELD);
    assertThat(diagnostics.summarize()).isEqualTo(new ImportSummary(3, 1, 1, 1, 2));
    assertThat(diagnostics.forRow(3)).hasSize(2);
  }

  @Test
  void missingRequiredFields_carriesNamesAndDetail() {
    var diagnostics = new ImportDiagnostics();
    diagnostics.missingRequiredFields(4, List.of("responsible"));

    ImportDiagnostic entry = diagnostics.getEntries().get(0);
    assertThat(entry.rowIndex()).isEqualTo(4);
    assertThat(entry.rowNumber()).isEqualTo(5);
    assertThat(entry.missingFields()).containsExactly("responsible");
    assertThat(entry.detail()).isEqualTo("Missing required field(s): responsible");
  }

  @Test
  void rowWarning_rejectsTerminalOutcomes() {
    assertThatThrownBy(() -> new RowWarning(DiagnosticOutcome.ACCEPTED, "category", "x"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
