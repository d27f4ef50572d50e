package com.actionplan.taskimport.service.pipeline.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import com.actionplan.taskimport.domain.CellValue;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class DateCellParserTest {

  private static final ImportContext CONTEXT =
      ImportContext.of(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC);

  private DateCellParser parser;

  @BeforeEach
  void setUp() {
    parser = new DateCellParser();
  }

  @Test
  void dayMonthTwoDigitYear_inCurrentCentury() {
    assertThat(parser.parse(CellValue.text("15/03/24"), CONTEXT))
        .contains(Instant.parse("2024-03-15T00:00:00Z"));
  }

  @Test
  void dayMonthTwoDigitYear_inPreviousCentury() {
    assertThat(parser.parse(CellValue.text("01/02/75"), CONTEXT))
        .contains(Instant.parse("1975-02-01T00:00:00Z"));
  }

  @Test
  void dayMonthFourDigitYear_singleDigitParts() {
    assertThat(parser.parse(CellValue.text("5/3/2024"), CONTEXT))
        .contains(Instant.parse("2024-03-05T00:00:00Z"));
  }

  @ParameterizedTest
  @CsvSource({"0, 2000", "24, 2024", "30, 2030", "31, 1931", "99, 1999"})
  void expandTwoDigitYear_pivotsAtThirty(int twoDigitYear, int expected) {
    assertThat(DateCellParser.expandTwoDigitYear(twoDigitYear, 2025)).isEqualTo(expected);
  }

  @Test
  void expandTwoDigitYear_followsReferenceCentury() {
    assertThat(DateCellParser.expandTwoDigitYear(10, 2105)).isEqualTo(2110);
    assertThat(DateCellParser.expandTwoDigitYear(75, 2105)).isEqualTo(2075);
  }

  @Test
  void serialNumber_fromEpoch() {
    assertThat(parser.parse(new CellValue.Numeric(45000), CONTEXT))
        .contains(Instant.parse("2023-03-15T00:00:00Z"));
    assertThat(parser.parse(new CellValue.Numeric(1), CONTEXT))
        .contains(Instant.parse("1899-12-31T00:00:00Z"));
  }

  @Test
  void serialNumber_fractionIsTimeOfDay() {
    assertThat(parser.parse(new CellValue.Numeric(45000.5), CONTEXT))
        .contains(Instant.parse("2023-03-15T12:00:00Z"));
  }

  @Test
  void serialNumber_outOfRange_isUnparsed() {
    assertThat(parser.parse(new CellValue.Numeric(-1), CONTEXT)).isEmpty();
    assertThat(parser.parse(new CellValue.Numeric(DateCellParser.MAX_SERIAL + 1), CONTEXT))
        .isEmpty();
    assertThat(parser.parse(new CellValue.Numeric(DateCellParser.MAX_SERIAL), CONTEXT))
        .contains(Instant.parse("9999-12-31T00:00:00Z"));
  }

  @Test
  void dateTimeCell_isAnchoredInZone() {
    var paris = new ImportContext(CONTEXT.processedAt(), ZoneId.of("Europe/Paris"), 2025);

    assertThat(
            parser.parse(new CellValue.DateTime(LocalDateTime.of(2024, 3, 15, 0, 0)), paris))
        .contains(Instant.parse("2024-03-14T23:00:00Z"));
  }

  @Test
  void dayMonthYear_isAnchoredInZone() {
    var paris = new ImportContext(CONTEXT.processedAt(), ZoneId.of("Europe/Paris"), 2025);

    assertThat(parser.parse(CellValue.text("15/07/2024"), paris))
        .contains(Instant.parse("2024-07-14T22:00:00Z"));
  }

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        "2024-03-15|2024-03-15T00:00:00Z",
        "2024-03-15T08:30:00Z|2024-03-15T08:30:00Z",
        "2024-03-15T08:30:00+02:00|2024-03-15T06:30:00Z",
        "2024-03-15T08:30:00|2024-03-15T08:30:00Z",
        "2024/3/15|2024-03-15T00:00:00Z",
        "15-3-2024|2024-03-15T00:00:00Z",
        "15.03.2024|2024-03-15T00:00:00Z",
        "15 March 2024|2024-03-15T00:00:00Z",
        "15 mars 2024|2024-03-15T00:00:00Z",
        "March 15, 2024|2024-03-15T00:00:00Z"
      })
  void genericFormats(String text, String expected) {
    assertThat(parser.parse(CellValue.text(text), CONTEXT)).contains(Instant.parse(expected));
  }

  @ParameterizedTest
  @ValueSource(strings = {"31/02/2024", "tomorrow", "N/A", "15/13/2024", "2024-02-30"})
  void unrecognizedText_isUnparsed(String text) {
    assertThat(parser.parse(CellValue.text(text), CONTEXT)).isEmpty();
  }

  @Test
  void blankCell_isUnparsed() {
    assertThat(parser.parse(CellValue.BLANK, CONTEXT)).isEmpty();
    assertThat(parser.parse(CellValue.text("   "), CONTEXT)).isEmpty();
  }
}
