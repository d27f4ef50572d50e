package com.actionplan.taskimport.service.pipeline;

import com.actionplan.taskimport.config.TaskImportProperties;
import com.actionplan.taskimport.diagnostics.ImportDiagnostics;
import com.actionplan.taskimport.diagnostics.ImportReport;
import com.actionplan.taskimport.domain.CanonicalField;
import com.actionplan.taskimport.domain.RawRow;
import com.actionplan.taskimport.domain.TaskRecord;
import com.actionplan.taskimport.service.pipeline.build.BuildResult;
import com.actionplan.taskimport.service.pipeline.build.TaskRecordBuilder;
import com.actionplan.taskimport.service.pipeline.header.HeaderMap;
import com.actionplan.taskimport.service.pipeline.header.HeaderResolution;
import com.actionplan.taskimport.service.pipeline.header.HeaderResolver;
import com.actionplan.taskimport.service.pipeline.normalize.ImportContext;
import com.actionplan.taskimport.service.pipeline.normalize.NormalizedRow;
import com.actionplan.taskimport.service.pipeline.normalize.RowNormalizer;
import com.actionplan.taskimport.service.pipeline.normalize.Vocabulary;
import com.actionplan.taskimport.service.pipeline.normalize.VocabularyExtension;
import com.actionplan.taskimport.service.pipeline.read.CellGrid;
import com.actionplan.taskimport.service.pipeline.read.CorruptWorkbookException;
import com.actionplan.taskimport.service.pipeline.read.EmptyWorkbookException;
import com.actionplan.taskimport.service.pipeline.read.WorkbookReader;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of the import engine: workbook bytes in, task records and per-row diagnostics
 * out. Structural problems fail the whole import; everything else degrades to diagnostics.
 *
 * <p>Stateless; concurrent calls share nothing but immutable tables.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskImportService {

  private final WorkbookReader workbookReader;
  private final HeaderResolver headerResolver;
  private final RowNormalizer rowNormalizer;
  private final TaskRecordBuilder recordBuilder;
  private final Vocabulary vocabulary;
  private final TaskImportProperties properties;
  private final Clock clock;

  /**
   * Checks the header row without processing data rows. Malformed content is reported, not
   * thrown.
   *
   * @throws CorruptWorkbookException if the bytes are not a readable workbook
   */
  public StructureCheck validateStructure(byte[] bytes) {
    CellGrid grid;
    try {
      grid = workbookReader.read(bytes);
    } catch (EmptyWorkbookException e) {
      return StructureCheck.invalid(requiredFieldNames(), List.of(), e.getMessage());
    }

    HeaderResolution resolution = headerResolver.resolve(grid.headerRow());
    if (resolution.isComplete()) {
      return StructureCheck.valid(resolution.headers());
    }
    return StructureCheck.invalid(
        resolution.missingRequired(),
        resolution.headers(),
        "Missing required columns: " + String.join(", ", resolution.missingRequired()));
  }

  public ImportOutcome importTasks(byte[] bytes) {
    return importTasks(bytes, VocabularyExtension.NONE);
  }

  public ImportOutcome importTasks(byte[] bytes, VocabularyExtension extension) {
    ImportContext context = ImportContext.of(clock.instant(), properties.getZone());

    try {
      // 1. read the first worksheet
      CellGrid grid = workbookReader.read(bytes);

      // 2. resolve headers once; no row is touched if a required column is missing
      HeaderMap headers = headerResolver.resolveOrThrow(grid.headerRow());
      log.debug("Resolved headers: {}", headers);

      // 3. normalize and build row by row, top to bottom
      ImportReport report =
          processRows(grid.dataRows(), headers, vocabulary.extendedWith(extension), context);

      log.info(
          "Task import finished: {} data row(s), {} accepted, {} skipped empty, {} rejected, {} warning(s)",
          report.summary().dataRows(),
          report.summary().accepted(),
          report.summary().skippedEmpty(),
          report.summary().rejected(),
          report.summary().warnings());
      return new ImportOutcome.Success(report);
    } catch (TaskImportException e) {
      log.warn("Task import rejected ({}): {}", e.getKind(), e.getMessage());
      return new ImportOutcome.Failure(ImportFailure.from(e));
    }
  }

  private ImportReport processRows(
      List<RawRow> rows, HeaderMap headers, Vocabulary rowVocabulary, ImportContext context) {
    List<TaskRecord> records = new ArrayList<>();
    ImportDiagnostics diagnostics = new ImportDiagnostics();

    for (RawRow row : rows) {
      NormalizedRow normalized = rowNormalizer.normalize(row, headers, rowVocabulary, context);
      BuildResult result = recordBuilder.build(normalized, context);

      if (result instanceof BuildResult.Built built) {
        diagnostics.warnings(row.rowIndex(), normalized.warnings());
        diagnostics.accepted(row.rowIndex());
        records.add(built.record());
      } else if (result instanceof BuildResult.Rejected rejected) {
        diagnostics.warnings(row.rowIndex(), normalized.warnings());
        diagnostics.missingRequiredFields(row.rowIndex(), rejected.missingFields());
        log.debug("Row {} rejected, missing {}", row.rowIndex() + 1, rejected.missingFields());
      } else {
        // blank row: its warnings would only be noise
        diagnostics.skippedEmpty(row.rowIndex());
      }
    }

    return ImportReport.of(records, diagnostics);
  }

  private static List<String> requiredFieldNames() {
    return CanonicalField.requiredFields().stream().map(CanonicalField::getFieldName).toList();
  }
}
