package com.actionplan.taskimport.service.pipeline.header;

import com.actionplan.taskimport.domain.CanonicalField;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/** Canonical field to the header actually present in the file. Built once per import. */
public final class HeaderMap {

  private final Map<CanonicalField, ResolvedColumn> columns;

  public HeaderMap(Map<CanonicalField, ResolvedColumn> columns) {
    var copy = new EnumMap<CanonicalField, ResolvedColumn>(CanonicalField.class);
    copy.putAll(columns);
    this.columns = Collections.unmodifiableMap(copy);
  }

  public Optional<ResolvedColumn> find(CanonicalField field) {
    return Optional.ofNullable(columns.get(field));
  }

  public boolean contains(CanonicalField field) {
    return columns.containsKey(field);
  }

  /** Raw header label for {@code field}, as spelled in the file. */
  public Optional<String> labelOf(CanonicalField field) {
    return find(field).map(ResolvedColumn::rawLabel);
  }

  public Map<CanonicalField, ResolvedColumn> asMap() {
    return columns;
  }

  @Override
  public String toString() {
    return "HeaderMap" + columns;
  }
}
