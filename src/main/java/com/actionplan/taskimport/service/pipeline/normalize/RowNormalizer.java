package com.actionplan.taskimport.service.pipeline.normalize;

import com.actionplan.taskimport.diagnostics.RowWarning;
import com.actionplan.taskimport.domain.CanonicalField;
import com.actionplan.taskimport.domain.CellValue;
import com.actionplan.taskimport.domain.RawRow;
import com.actionplan.taskimport.domain.TaskCategory;
import com.actionplan.taskimport.domain.TaskFlags;
import com.actionplan.taskimport.service.pipeline.header.HeaderMap;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Converts the raw cells of one data row into canonical field values. Never throws: anything
 * that cannot be interpreted becomes a default plus, where it matters, a {@link RowWarning}.
 */
@Component
@RequiredArgsConstructor
public class RowNormalizer {

  private final DateCellParser dateParser;
  private final FlagInterpreter flagInterpreter;

  public NormalizedRow normalize(
      RawRow row, HeaderMap headers, Vocabulary vocabulary, ImportContext context) {
    List<RowWarning> warnings = new ArrayList<>();

    TaskFlags flags =
        new TaskFlags(
            flagInterpreter.isSet(cell(row, headers, CanonicalField.INSTALLATION_FLAG)),
            flagInterpreter.isSet(cell(row, headers, CanonicalField.REPAIR_FLAG)),
            flagInterpreter.isSet(cell(row, headers, CanonicalField.DEVELOPMENT_FLAG)),
            flagInterpreter.isSet(cell(row, headers, CanonicalField.DELIVERY_FLAG)));

    String auxiliary = optionalText(row, headers, CanonicalField.AUXILIARY);

    // the creation date is always set; an unusable cell falls back to the processing time
    Instant dateCreated =
        parseDate(row, headers, CanonicalField.DATE_CREATED, context, warnings)
            .orElse(context.processedAt());
    Instant deadline =
        parseDate(row, headers, CanonicalField.DEADLINE, context, warnings).orElse(null);

    return NormalizedRow.builder()
        .rowIndex(row.rowIndex())
        .poNumber(optionalText(row, headers, CanonicalField.PO_NUMBER))
        .dateCreated(dateCreated)
        .category(resolveCategory(row, headers, vocabulary, flags, auxiliary, warnings))
        .actionDescription(text(row, headers, CanonicalField.ACTION_DESCRIPTION))
        .auxiliary(auxiliary)
        .customer(text(row, headers, CanonicalField.CUSTOMER))
        .requester(text(row, headers, CanonicalField.REQUESTER))
        .responsible(text(row, headers, CanonicalField.RESPONSIBLE))
        .deadline(deadline)
        .status(vocabulary.normalizeStatus(text(row, headers, CanonicalField.STATUS)))
        .notes(optionalText(row, headers, CanonicalField.NOTES))
        .flags(flags)
        .warnings(warnings)
        .build();
  }

  /**
   * Explicit category first (known spelling, else kept capitalized with a warning), then the
   * first set flag column, then a known spelling in the auxiliary column.
   */
  private String resolveCategory(
      RawRow row,
      HeaderMap headers,
      Vocabulary vocabulary,
      TaskFlags flags,
      String auxiliary,
      List<RowWarning> warnings) {
    String explicit = text(row, headers, CanonicalField.CATEGORY);
    if (!explicit.isEmpty()) {
      Optional<String> known = vocabulary.lookupCategory(explicit);
      if (known.isPresent()) {
        return known.get();
      }
      String keptAs = Vocabulary.capitalize(explicit);
      warnings.add(
          RowWarning.unrecognizedCategory(
              cellReference(row, headers, CanonicalField.CATEGORY), explicit, keptAs));
      return keptAs;
    }

    Optional<TaskCategory> implied = flags.impliedCategory();
    if (implied.isPresent()) {
      return implied.get().getLabel();
    }

    return vocabulary.lookupCategory(auxiliary).orElse(null);
  }

  private Optional<Instant> parseDate(
      RawRow row,
      HeaderMap headers,
      CanonicalField field,
      ImportContext context,
      List<RowWarning> warnings) {
    CellValue cell = cell(row, headers, field);
    if (cell.isBlank()) {
      return Optional.empty();
    }
    Optional<Instant> parsed = dateParser.parse(cell, context);
    if (parsed.isEmpty()) {
      warnings.add(
          RowWarning.dateUnparsed(
              field.getFieldName(), cellReference(row, headers, field), cell.asText()));
    }
    return parsed;
  }

  private static CellValue cell(RawRow row, HeaderMap headers, CanonicalField field) {
    return headers.find(field).map(column -> row.cell(column.columnIndex())).orElse(CellValue.BLANK);
  }

  private static String cellReference(RawRow row, HeaderMap headers, CanonicalField field) {
    return headers.find(field).map(column -> column.cellReference(row.rowIndex())).orElse("?");
  }

  /** Cleansed text; {@code ""} when the column is absent or the cell is empty. */
  private static String text(RawRow row, HeaderMap headers, CanonicalField field) {
    return cell(row, headers, field).asText();
  }

  private static String optionalText(RawRow row, HeaderMap headers, CanonicalField field) {
    String value = text(row, headers, field);
    return value.isEmpty() ? null : value;
  }
}
