package com.actionplan.taskimport.service.pipeline;

import com.actionplan.taskimport.diagnostics.ImportReport;

/**
 * Result of {@link TaskImportService#importTasks}: either the file was processed (possibly with
 * row diagnostics) or it could not be processed at all.
 */
public sealed interface ImportOutcome permits ImportOutcome.Success, ImportOutcome.Failure {

  boolean isSuccess();

  record Success(ImportReport report) implements ImportOutcome {
    @Override
    public boolean isSuccess() {
      return true;
    }
  }

  record Failure(ImportFailure failure) implements ImportOutcome {
    @Override
    public boolean isSuccess() {
      return false;
    }
  }
}
