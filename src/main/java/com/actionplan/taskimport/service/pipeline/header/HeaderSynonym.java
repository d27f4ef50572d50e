package com.actionplan.taskimport.service.pipeline.header;

import com.actionplan.taskimport.annotation.HeaderMatchMode;
import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/** One accepted spelling of a canonical field's header. */
public record HeaderSynonym(String text, HeaderMatchMode matchMode) {

  private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

  public HeaderSynonym {
    text = normalize(text);
    if (text.isEmpty()) {
      throw new IllegalArgumentException("Header synonym must not be blank");
    }
  }

  public static HeaderSynonym exact(String text) {
    return new HeaderSynonym(text, HeaderMatchMode.EXACT);
  }

  public static HeaderSynonym contains(String text) {
    return new HeaderSynonym(text, HeaderMatchMode.CONTAINS);
  }

  public static HeaderSynonym startsWith(String text) {
    return new HeaderSynonym(text, HeaderMatchMode.STARTS_WITH);
  }

  public boolean matches(String rawHeader) {
    if (rawHeader == null || rawHeader.isBlank()) {
      return false;
    }
    String header = normalize(rawHeader);
    return switch (matchMode) {
      case EXACT -> header.equals(text);
      case CONTAINS -> header.contains(text);
      case STARTS_WITH -> header.startsWith(text);
    };
  }

  /**
   * Composes accents (NFC), lower-cases and strips every whitespace character, so "Dead line "
   * equals "deadline" and a header typed with combining accents equals its precomposed spelling.
   */
  static String normalize(String value) {
    if (value == null) {
      return "";
    }
    String composed = Normalizer.normalize(value, Normalizer.Form.NFC);
    return WHITESPACE.matcher(composed.toLowerCase(Locale.ROOT)).replaceAll("");
  }
}
