package com.actionplan.taskimport.service.pipeline.read;

import com.actionplan.taskimport.domain.CellValue;
import com.actionplan.taskimport.util.SecureExcelUtils;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.springframework.stereotype.Component;

/**
 * Extracts the first worksheet of an in-memory .xlsx workbook as a grid of typed cell values.
 * Only the given bytes are read; nothing touches the disk.
 */
@Slf4j
@Component
public class WorkbookReader {

  public CellGrid read(byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      throw new CorruptWorkbookException("Workbook content is empty");
    }

    // SECURITY: SecureExcelUtils checks the zip signature and applies POI allocation limits
    try (Workbook workbook = SecureExcelUtils.openWorkbook(bytes)) {
      if (workbook.getNumberOfSheets() == 0) {
        throw new EmptyWorkbookException();
      }
      Sheet sheet = workbook.getSheetAt(0);
      CellGrid grid = toGrid(sheet);
      log.debug("Read sheet '{}' with {} row(s)", sheet.getSheetName(), grid.rowCount());
      return grid;
    } catch (IOException | SecurityException e) {
      throw new CorruptWorkbookException("Workbook cannot be read: " + e.getMessage(), e);
    }
  }

  private CellGrid toGrid(Sheet sheet) {
    List<CellRangeAddress> mergedRegions = sheet.getMergedRegions();
    List<List<CellValue>> rows = new ArrayList<>();

    for (int rowIdx = 0; rowIdx <= sheet.getLastRowNum(); rowIdx++) {
      Row row = sheet.getRow(rowIdx);
      List<CellValue> cells = new ArrayList<>();
      if (row != null) {
        for (int colIdx = 0; colIdx < row.getLastCellNum(); colIdx++) {
          Cell cell = row.getCell(colIdx);
          if (cell == null || cell.getCellType() == CellType.BLANK) {
            cell = resolveMergedCell(sheet, mergedRegions, rowIdx, colIdx);
          }
          cells.add(toCellValue(cell));
        }
      }
      rows.add(cells);
    }
    return new CellGrid(rows);
  }

  private CellValue toCellValue(Cell cell) {
    if (cell == null) {
      return CellValue.BLANK;
    }
    CellType type = cell.getCellType();
    if (type == CellType.FORMULA) {
      // no evaluation: the value Excel cached when the file was saved
      type = cell.getCachedFormulaResultType();
    }

    return switch (type) {
      case STRING -> CellValue.text(cell.getStringCellValue());
      case NUMERIC -> DateUtil.isCellDateFormatted(cell)
          ? new CellValue.DateTime(cell.getLocalDateTimeCellValue())
          : new CellValue.Numeric(cell.getNumericCellValue());
      case BOOLEAN -> new CellValue.Bool(cell.getBooleanCellValue());
      default -> CellValue.BLANK;
    };
  }

  private Cell resolveMergedCell(
      Sheet sheet, List<CellRangeAddress> mergedRegions, int rowIdx, int colIdx) {
    for (CellRangeAddress range : mergedRegions) {
      if (range.isInRange(rowIdx, colIdx)
          && (range.getFirstRow() != rowIdx || range.getFirstColumn() != colIdx)) {
        Row topRow = sheet.getRow(range.getFirstRow());
        if (topRow != null) {
          return topRow.getCell(range.getFirstColumn());
        }
      }
    }
    return sheet.getRow(rowIdx) == null ? null : sheet.getRow(rowIdx).getCell(colIdx);
  }
}
