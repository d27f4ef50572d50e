package com.actionplan.taskimport.domain;

import java.util.List;

/**
 * One data row of the worksheet, positionally aligned with the header labels of the file.
 *
 * @param rowIndex 0-based grid index; the header row is 0, so data rows start at 1
 * @param cells cell values; may be shorter than the header row when trailing cells are empty
 */
public record RawRow(int rowIndex, List<CellValue> cells) {

  public RawRow {
    cells = List.copyOf(cells);
  }

  public CellValue cell(int columnIndex) {
    if (columnIndex < 0 || columnIndex >= cells.size()) {
      return CellValue.BLANK;
    }
    return cells.get(columnIndex);
  }

  public boolean isBlank() {
    return cells.stream().allMatch(CellValue::isBlank);
  }
}
