package com.actionplan.taskimport.service.pipeline.read;

import com.actionplan.taskimport.service.pipeline.ImportFailureKind;
import com.actionplan.taskimport.service.pipeline.TaskImportException;

public class CorruptWorkbookException extends TaskImportException {

  public CorruptWorkbookException(String message) {
    super(ImportFailureKind.CORRUPT_WORKBOOK, message);
  }

  public CorruptWorkbookException(String message, Throwable cause) {
    super(ImportFailureKind.CORRUPT_WORKBOOK, message, cause);
  }
}
