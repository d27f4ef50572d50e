package com.actionplan.taskimport.service.pipeline.header;

import com.actionplan.taskimport.domain.CanonicalField;
import com.actionplan.taskimport.util.ExcelColumnUtil;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps the workbook's header labels onto canonical fields using a {@link HeaderSynonymTable}.
 * For each field the leftmost matching header wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HeaderResolver {

  private final HeaderSynonymTable synonymTable;

  public HeaderResolution resolve(List<String> headerRow) {
    var columns = new EnumMap<CanonicalField, ResolvedColumn>(CanonicalField.class);
    List<String> missingRequired = new ArrayList<>();

    for (CanonicalField field : CanonicalField.values()) {
      ResolvedColumn column = findLeftmost(field, headerRow);
      if (column != null) {
        columns.put(field, column);
      } else if (field.isRequired()) {
        missingRequired.add(field.getFieldName());
      } else {
        log.debug("Optional field '{}' has no matching header", field.getFieldName());
      }
    }

    List<String> headers = headerRow.stream().filter(h -> h != null && !h.isBlank()).toList();
    return new HeaderResolution(new HeaderMap(columns), missingRequired, headers);
  }

  /**
   * Resolves the header row or fails with every unresolved required field at once; no row is
   * processed against a partial mapping.
   */
  public HeaderMap resolveOrThrow(List<String> headerRow) {
    HeaderResolution resolution = resolve(headerRow);
    if (!resolution.isComplete()) {
      throw new MissingRequiredColumnsException(resolution.missingRequired());
    }
    return resolution.headerMap();
  }

  private ResolvedColumn findLeftmost(CanonicalField field, List<String> headerRow) {
    for (int i = 0; i < headerRow.size(); i++) {
      String label = headerRow.get(i);
      if (synonymTable.matches(field, label)) {
        return new ResolvedColumn(i, ExcelColumnUtil.indexToLetter(i), label);
      }
    }
    return null;
  }
}
