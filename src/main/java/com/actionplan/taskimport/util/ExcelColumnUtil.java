package com.actionplan.taskimport.util;

public final class ExcelColumnUtil {

  private ExcelColumnUtil() {}

  /** Converts a 0-based column index to its letter: 0=A, 25=Z, 26=AA, 27=AB, ... */
  public static String indexToLetter(int index) {
    if (index < 0) {
      throw new IllegalArgumentException("Column index must be non-negative: " + index);
    }

    StringBuilder sb = new StringBuilder();
    int col = index + 1;

    while (col > 0) {
      int remainder = (col - 1) % 26;
      sb.insert(0, (char) ('A' + remainder));
      col = (col - 1) / 26;
    }

    return sb.toString();
  }
}
