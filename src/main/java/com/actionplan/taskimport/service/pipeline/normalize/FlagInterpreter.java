package com.actionplan.taskimport.service.pipeline.normalize;

import com.actionplan.taskimport.domain.CellValue;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Reads a flag column cell. Known markers are listed explicitly; any other non-empty value also
 * counts as set, because manually kept workbooks use many ad-hoc markers.
 */
@Component
public class FlagInterpreter {

  private static final Set<String> TRUE_MARKERS =
      Set.of("true", "1", "yes", "oui", "x", "✓", "checked");

  private static final Set<String> FALSE_MARKERS = Set.of("", "0", "false", "no", "non");

  public boolean isSet(CellValue cell) {
    String value = cell.asText().toLowerCase(Locale.ROOT);
    if (TRUE_MARKERS.contains(value)) {
      return true;
    }
    if (FALSE_MARKERS.contains(value)) {
      return false;
    }
    // TODO: product owners to decide whether unknown markers should stay truthy
    return true;
  }
}
