package com.actionplan.taskimport.service.pipeline.read;

import com.actionplan.taskimport.domain.CellValue;
import com.actionplan.taskimport.domain.RawRow;
import java.util.List;
import java.util.stream.IntStream;

/** Cell values of the first worksheet, row 0 being the header row. Rows may be ragged. */
public record CellGrid(List<List<CellValue>> rows) {

  public CellGrid {
    rows = rows.stream().map(List::copyOf).toList();
  }

  public int rowCount() {
    return rows.size();
  }

  /**
   * Header labels as spelled in the file, stray whitespace included ("Action "). Empty when the
   * worksheet has no rows at all.
   */
  public List<String> headerRow() {
    if (rows.isEmpty()) {
      return List.of();
    }
    return rows.get(0).stream().map(CellGrid::rawLabel).toList();
  }

  private static String rawLabel(CellValue cell) {
    return cell instanceof CellValue.Text text ? text.value() : cell.asText();
  }

  public RawRow row(int rowIndex) {
    return new RawRow(rowIndex, rows.get(rowIndex));
  }

  /** Every row below the header, top to bottom. */
  public List<RawRow> dataRows() {
    return IntStream.range(1, rows.size()).mapToObj(this::row).toList();
  }
}
