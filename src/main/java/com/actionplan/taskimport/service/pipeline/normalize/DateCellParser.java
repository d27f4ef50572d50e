package com.actionplan.taskimport.service.pipeline.normalize;

import com.actionplan.taskimport.domain.CellValue;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Turns a date cell into an instant. Sources are tried in order: a date-typed cell, a numeric
 * serial date, a {@code D/M/Y} string (European order), then common calendar formats.
 */
@Component
public class DateCellParser {

  /** Day zero of spreadsheet serial dates; serial 1 is 1899-12-31. */
  static final LocalDateTime SERIAL_EPOCH = LocalDateTime.of(1899, 12, 30, 0, 0);

  /** Serial of 9999-12-31, the last date a workbook can hold. */
  static final double MAX_SERIAL = 2_958_465d;

  private static final long MILLIS_PER_DAY = 86_400_000L;

  /** Two-digit years up to this value belong to the reference century. */
  private static final int TWO_DIGIT_YEAR_PIVOT = 30;

  private static final Pattern DAY_MONTH_YEAR =
      Pattern.compile("^(\\d{1,2})/(\\d{1,2})/(\\d{2,4})$");

  private static final List<DateTimeFormatter> LOCAL_DATE_FORMATS =
      List.of(
          DateTimeFormatter.ISO_LOCAL_DATE,
          strict("uuuu/M/d", Locale.ROOT),
          strict("d-M-uuuu", Locale.ROOT),
          strict("d.M.uuuu", Locale.ROOT),
          strict("d MMMM uuuu", Locale.ENGLISH),
          strict("d MMMM uuuu", Locale.FRENCH),
          strict("MMMM d, uuuu", Locale.ENGLISH));

  public Optional<Instant> parse(CellValue cell, ImportContext context) {
    if (cell instanceof CellValue.DateTime dateTime) {
      return Optional.of(dateTime.value().atZone(context.zone()).toInstant());
    }
    if (cell instanceof CellValue.Numeric numeric) {
      return fromSerial(numeric.value(), context.zone());
    }

    String text = cell.asText();
    if (text.isEmpty()) {
      return Optional.empty();
    }

    Matcher matcher = DAY_MONTH_YEAR.matcher(text);
    if (matcher.matches()) {
      Optional<Instant> parsed = fromDayMonthYear(matcher, context);
      if (parsed.isPresent()) {
        return parsed;
      }
    }
    return parseCalendarString(text, context.zone());
  }

  Optional<Instant> fromSerial(double serial, ZoneId zone) {
    if (Double.isNaN(serial) || serial < 0 || serial > MAX_SERIAL) {
      return Optional.empty();
    }
    long millis = Math.round(serial * MILLIS_PER_DAY);
    return Optional.of(SERIAL_EPOCH.plus(Duration.ofMillis(millis)).atZone(zone).toInstant());
  }

  private Optional<Instant> fromDayMonthYear(Matcher matcher, ImportContext context) {
    int day = Integer.parseInt(matcher.group(1));
    int month = Integer.parseInt(matcher.group(2));
    String yearText = matcher.group(3);
    int year = Integer.parseInt(yearText);
    if (yearText.length() == 2) {
      year = expandTwoDigitYear(year, context.referenceYear());
    }

    // 31/02/2024 and the like come back empty and fall through to the generic formats
    int resolvedYear = year;
    return attempt(
        () -> LocalDate.of(resolvedYear, month, day).atStartOfDay(context.zone()).toInstant());
  }

  /** 00-30 map into the reference year's century, 31-99 into the previous one. */
  static int expandTwoDigitYear(int twoDigitYear, int referenceYear) {
    int century = (referenceYear / 100) * 100;
    if (twoDigitYear <= TWO_DIGIT_YEAR_PIVOT) {
      return century + twoDigitYear;
    }
    return century - 100 + twoDigitYear;
  }

  private Optional<Instant> parseCalendarString(String text, ZoneId zone) {
    List<Supplier<Instant>> attempts = new ArrayList<>();
    attempts.add(() -> Instant.parse(text));
    attempts.add(() -> OffsetDateTime.parse(text).toInstant());
    attempts.add(() -> LocalDateTime.parse(text).atZone(zone).toInstant());
    for (DateTimeFormatter format : LOCAL_DATE_FORMATS) {
      attempts.add(() -> LocalDate.parse(text, format).atStartOfDay(zone).toInstant());
    }

    for (Supplier<Instant> attempt : attempts) {
      Optional<Instant> parsed = attempt(attempt);
      if (parsed.isPresent()) {
        return parsed;
      }
    }
    return Optional.empty();
  }

  private static Optional<Instant> attempt(Supplier<Instant> parser) {
    try {
      return Optional.of(parser.get());
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }

  private static DateTimeFormatter strict(String pattern, Locale locale) {
    return new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(pattern)
        .toFormatter(locale)
        .withResolverStyle(ResolverStyle.STRICT);
  }
}
