package com.actionplan.taskimport.service.pipeline.header;

import com.actionplan.taskimport.service.pipeline.ImportFailureKind;
import com.actionplan.taskimport.service.pipeline.TaskImportException;
import java.util.List;
import lombok.Getter;

@Getter
public class MissingRequiredColumnsException extends TaskImportException {

  /** Canonical names of the unresolved required fields, in canonical order. */
  private final List<String> missingColumns;

  public MissingRequiredColumnsException(List<String> missingColumns) {
    super(
        ImportFailureKind.MISSING_REQUIRED_COLUMNS,
        "Missing required columns: %s".formatted(String.join(", ", missingColumns)));
    this.missingColumns = List.copyOf(missingColumns);
  }
}
