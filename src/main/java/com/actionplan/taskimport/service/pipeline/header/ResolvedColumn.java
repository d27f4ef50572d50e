package com.actionplan.taskimport.service.pipeline.header;

/** Where a canonical field was found in the header row. */
public record ResolvedColumn(int columnIndex, String columnLetter, String rawLabel) {

  /** Spreadsheet reference of this column's cell in a row, such as "I7" for grid row 6. */
  public String cellReference(int rowIndex) {
    return columnLetter + (rowIndex + 1);
  }
}
