package com.actionplan.taskimport.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A raw worksheet cell, typed the way the workbook stored it. Formula cells are represented by
 * their cached result.
 */
public sealed interface CellValue
    permits CellValue.Blank, CellValue.Text, CellValue.Numeric, CellValue.DateTime, CellValue.Bool {

  CellValue BLANK = new Blank();

  /** Cleansed text form of the cell: never null, always trimmed. */
  String asText();

  default boolean isBlank() {
    return asText().isEmpty();
  }

  static CellValue text(String value) {
    return value == null ? BLANK : new Text(value);
  }

  record Blank() implements CellValue {
    @Override
    public String asText() {
      return "";
    }
  }

  record Text(String value) implements CellValue {
    @Override
    public String asText() {
      return value.trim();
    }
  }

  record Numeric(double value) implements CellValue {
    @Override
    public String asText() {
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        return "";
      }
      // 1.0 -> "1" so that flag markers and codes typed as numbers read naturally
      if (value == Math.rint(value) && Math.abs(value) < 1e15) {
        return String.valueOf((long) value);
      }
      return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
  }

  record DateTime(LocalDateTime value) implements CellValue {
    @Override
    public String asText() {
      return value.toString();
    }
  }

  record Bool(boolean value) implements CellValue {
    @Override
    public String asText() {
      return String.valueOf(value);
    }
  }
}
