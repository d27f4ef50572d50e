package com.actionplan.taskimport.service.pipeline;

import com.actionplan.taskimport.service.pipeline.header.MissingRequiredColumnsException;
import java.util.List;

/**
 * Why a workbook could not be imported at all.
 *
 * @param missingColumns canonical names; only filled for {@link ImportFailureKind#MISSING_REQUIRED_COLUMNS}
 */
public record ImportFailure(ImportFailureKind kind, List<String> missingColumns, String message) {

  public ImportFailure {
    missingColumns = missingColumns == null ? List.of() : List.copyOf(missingColumns);
  }

  public static ImportFailure from(TaskImportException e) {
    List<String> missing =
        e instanceof MissingRequiredColumnsException missingColumns
            ? missingColumns.getMissingColumns()
            : List.of();
    return new ImportFailure(e.getKind(), missing, e.getMessage());
  }
}
