package com.actionplan.taskimport.service.export;

import com.actionplan.taskimport.config.TaskImportProperties;
import com.actionplan.taskimport.domain.TaskCategory;
import com.actionplan.taskimport.domain.TaskRecord;
import com.actionplan.taskimport.util.SecureExcelUtils;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

/**
 * Writes task workbooks in the layout the importer reads back: a blank template with sample
 * rows, and exports of existing records.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskWorkbookWriter {

  static final String DATA_SHEET_NAME = "Actions";
  static final String INSTRUCTIONS_SHEET_NAME = "Instructions";

  static final List<String> HEADERS =
      List.of(
          "Date",
          "PO",
          "Catégorie",
          "Action",
          "Colonne1",
          "Customer",
          "Requester",
          "Techmac Resp",
          "Dead line",
          "Status",
          "Note",
          "Installation/F",
          "Réparation",
          "Développement",
          "Livraison");

  private static final List<List<String>> SAMPLE_ROWS =
      List.of(
          List.of(
              "01/01/2024", "202400001", "Installation", "Setup new equipment", "", "Client ABC",
              "Manager", "Amine", "15/01/2024", "En Cours", "Priority task", "X", "", "", ""),
          List.of(
              "02/01/2024", "202400002", "Réparation", "Fix TDR701 machine", "", "Client XYZ",
              "Technician", "Hassan", "10/01/2024", "Terminé", "Completed on time", "", "X", "",
              ""));

  private static final List<String> INSTRUCTIONS =
      List.of(
          "Instructions d'import / Import instructions",
          "",
          "Colonnes obligatoires / Required columns: Action, Customer, Requester, Techmac Resp",
          "Dates: JJ/MM/AAAA (ex. 15/01/2024) ou date Excel",
          "Status: En Attente, En Cours, Terminé, Annulé, En Pause (ou Pending, In progress, Done...)",
          "Catégorie: Installation, Réparation, Développement, Livraison, Commercial",
          "Colonnes Installation/F, Réparation, Développement, Livraison: X pour cocher",
          "Les lignes sans Action sont ignorées / Rows without an Action are skipped");

  private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

  private static final int STREAMING_WINDOW = 100;

  private final TaskImportProperties properties;

  public byte[] writeTemplate() throws IOException {
    try (XSSFWorkbook workbook = new XSSFWorkbook()) {
      Sheet sheet = workbook.createSheet(DATA_SHEET_NAME);
      writeHeaderRow(workbook, sheet);

      int rowIdx = 1;
      for (List<String> sample : SAMPLE_ROWS) {
        Row row = sheet.createRow(rowIdx++);
        for (int col = 0; col < sample.size(); col++) {
          row.createCell(col).setCellValue(sample.get(col));
        }
      }
      setColumnWidths(sheet);

      Sheet instructions = workbook.createSheet(INSTRUCTIONS_SHEET_NAME);
      for (int i = 0; i < INSTRUCTIONS.size(); i++) {
        instructions.createRow(i).createCell(0).setCellValue(INSTRUCTIONS.get(i));
      }
      instructions.setColumnWidth(0, 100 * 256);

      return toBytes(workbook);
    }
  }

  public byte[] export(List<TaskRecord> records) throws IOException {
    try (SXSSFWorkbook workbook = new SXSSFWorkbook(STREAMING_WINDOW)) {
      Sheet sheet = workbook.createSheet(DATA_SHEET_NAME);
      writeHeaderRow(workbook, sheet);
      setColumnWidths(sheet);

      CellStyle guardedText = formulaGuardStyle(workbook);
      int rowIdx = 1;
      for (TaskRecord record : records) {
        writeRecord(sheet.createRow(rowIdx++), record, guardedText);
      }

      byte[] bytes = toBytes(workbook);
      // SXSSF keeps flushed rows in temp files until disposed
      workbook.dispose();
      log.info("Exported {} task record(s)", records.size());
      return bytes;
    }
  }

  private void writeRecord(Row row, TaskRecord record, CellStyle guardedText) {
    setText(row, 0, guardedText, formatDate(record.dateCreated()));
    setText(row, 1, guardedText, record.poNumber());
    setText(row, 2, guardedText, TaskCategory.frenchLabelOf(record.category()));
    setText(row, 3, guardedText, record.actionDescription());
    setText(row, 4, guardedText, record.auxiliary());
    setText(row, 5, guardedText, record.customer());
    setText(row, 6, guardedText, record.requester());
    setText(row, 7, guardedText, record.responsible());
    setText(row, 8, guardedText, formatDate(record.deadline()));
    setText(row, 9, guardedText, record.status() == null ? null : record.status().getFrenchLabel());
    setText(row, 10, guardedText, record.notes());
    setText(row, 11, guardedText, flag(record.installationFlag()));
    setText(row, 12, guardedText, flag(record.repairFlag()));
    setText(row, 13, guardedText, flag(record.developmentFlag()));
    setText(row, 14, guardedText, flag(record.deliveryFlag()));
  }

  private void writeHeaderRow(Workbook workbook, Sheet sheet) {
    CellStyle headerStyle = workbook.createCellStyle();
    Font boldFont = workbook.createFont();
    boldFont.setBold(true);
    headerStyle.setFont(boldFont);
    headerStyle.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
    headerStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);

    Row header = sheet.createRow(0);
    for (int col = 0; col < HEADERS.size(); col++) {
      Cell cell = header.createCell(col);
      cell.setCellValue(HEADERS.get(col));
      cell.setCellStyle(headerStyle);
    }
  }

  // Action and Note get the wide columns
  private static void setColumnWidths(Sheet sheet) {
    for (int col = 0; col < HEADERS.size(); col++) {
      int chars = col == 3 || col == 10 ? 40 : 16;
      sheet.setColumnWidth(col, chars * 256);
    }
  }

  private static void setText(Row row, int col, CellStyle guardedText, String value) {
    if (value == null || value.isEmpty()) {
      return;
    }
    Cell cell = row.createCell(col);
    cell.setCellValue(value);
    if (SecureExcelUtils.needsFormulaGuard(value)) {
      cell.setCellStyle(guardedText);
    }
  }

  /** Quote-prefixed cells are shown as text by Excel while the stored value stays unchanged. */
  private static CellStyle formulaGuardStyle(Workbook workbook) {
    CellStyle style = workbook.createCellStyle();
    style.setQuotePrefixed(true);
    return style;
  }

  private String formatDate(Instant instant) {
    return instant == null ? null : DATE_FORMAT.format(instant.atZone(properties.getZone()));
  }

  private static String flag(boolean set) {
    return set ? "X" : null;
  }

  private static byte[] toBytes(Workbook workbook) throws IOException {
    var out = new ByteArrayOutputStream();
    workbook.write(out);
    return out.toByteArray();
  }
}
