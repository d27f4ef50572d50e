package com.actionplan.taskimport.service.pipeline;

import lombok.Getter;

/** Base type of the structural failures raised inside the import pipeline. */
@Getter
public abstract class TaskImportException extends RuntimeException {

  private final ImportFailureKind kind;

  protected TaskImportException(ImportFailureKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected TaskImportException(ImportFailureKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }
}
