package com.actionplan.taskimport.service.pipeline.read;

import com.actionplan.taskimport.service.pipeline.ImportFailureKind;
import com.actionplan.taskimport.service.pipeline.TaskImportException;

public class EmptyWorkbookException extends TaskImportException {

  public EmptyWorkbookException() {
    super(ImportFailureKind.EMPTY_WORKBOOK, "Workbook contains no worksheet");
  }
}
