package com.actionplan.taskimport.service.pipeline;

/** Structural problems that abort a whole import. */
public enum ImportFailureKind {
  CORRUPT_WORKBOOK,
  EMPTY_WORKBOOK,
  MISSING_REQUIRED_COLUMNS
}
