package com.actionplan.taskimport.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.actionplan.taskimport.support.WorkbookFixtures;
import java.io.IOException;
import java.util.List;
import org.apache.poi.ss.usermodel.Workbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

class SecureExcelUtilsTest {

  // ========== sanitizeFilename ==========

  @ParameterizedTest
  @NullSource
  @ValueSource(strings = {"", "   ", "\t", "\n"})
  void sanitizeFilename_nullOrBlank_throws(String input) {
    assertThatThrownBy(() -> SecureExcelUtils.sanitizeFilename(input))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void sanitizeFilename_pathTraversal_extractsFilenameOnly() {
    String result = SecureExcelUtils.sanitizeFilename("../../../etc/passwd.xlsx");
    assertThat(result).doesNotContain("..");
    assertThat(result).doesNotContain("/");
    assertThat(result).endsWith(".xlsx");
  }

  @Test
  void sanitizeFilename_windowsAbsolutePath_extractsFilenameOnly() {
    String result = SecureExcelUtils.sanitizeFilename("C:\\Users\\Admin\\Documents\\plan.xlsx");
    assertThat(result).isEqualTo("plan.xlsx");
  }

  @Test
  void sanitizeFilename_controlCharactersRemoved() {
    String result = SecureExcelUtils.sanitizeFilename("plan\u0000\u0001action.xlsx");
    assertThat(result).isEqualTo("planaction.xlsx");
  }

  @Test
  void sanitizeFilename_frenchAccents_preserved() {
    String result = SecureExcelUtils.sanitizeFilename("Plan d'action Réparé.xlsx");
    assertThat(result).isEqualTo("Plan d_action Réparé.xlsx");
  }

  @ParameterizedTest
  @ValueSource(strings = {"plan.xls", "plan.csv", "plan.txt", "plan", "plan.exe"})
  void sanitizeFilename_invalidExtension_throws(String filename) {
    assertThatThrownBy(() -> SecureExcelUtils.sanitizeFilename(filename))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("extension");
  }

  @Test
  void sanitizeFilename_specialCharactersReplaced() {
    String result = SecureExcelUtils.sanitizeFilename("plan<>:\"|?*.xlsx");
    assertThat(result).doesNotContain("<", ">", ":", "\"", "|", "?", "*");
  }

  // ========== validateContent ==========

  @Test
  void validateContent_realWorkbook_passes() {
    byte[] bytes = WorkbookFixtures.workbook(List.of("Action")).toBytes();
    assertThatCode(() -> SecureExcelUtils.validateContent(bytes)).doesNotThrowAnyException();
  }

  @Test
  void validateContent_pdfMagicBytes_throwsSecurityException() {
    byte[] pdf = {0x25, 0x50, 0x44, 0x46, 0x2D};

    assertThatThrownBy(() -> SecureExcelUtils.validateContent(pdf))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining("XLSX");
  }

  @Test
  void validateContent_legacyXlsMagicBytes_throwsSecurityException() {
    byte[] xls = {(byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0, 0x00, 0x00, 0x00, 0x00};

    assertThatThrownBy(() -> SecureExcelUtils.validateContent(xls))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining("XLSX");
  }

  @Test
  void validateContent_tooSmall_throwsSecurityException() {
    assertThatThrownBy(() -> SecureExcelUtils.validateContent(new byte[] {0x50, 0x4B}))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining("too small");
    assertThatThrownBy(() -> SecureExcelUtils.validateContent(null))
        .isInstanceOf(SecurityException.class);
  }

  // ========== openWorkbook ==========

  @Test
  void openWorkbook_validBytes_returnsWorkbook() throws IOException {
    byte[] bytes = WorkbookFixtures.workbook(List.of("Action", "Customer")).toBytes();

    try (Workbook workbook = SecureExcelUtils.openWorkbook(bytes)) {
      assertThat(workbook.getNumberOfSheets()).isEqualTo(1);
      assertThat(workbook.getSheetAt(0).getRow(0).getCell(1).getStringCellValue())
          .isEqualTo("Customer");
    }
  }

  @Test
  void openWorkbook_zipWithoutWorkbookParts_throwsIOException() {
    byte[] truncated = {0x50, 0x4B, 0x03, 0x04, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00};

    assertThatThrownBy(() -> SecureExcelUtils.openWorkbook(truncated))
        .isInstanceOf(IOException.class);
  }

  @Test
  void openWorkbook_plainText_throwsSecurityException() {
    assertThatThrownBy(() -> SecureExcelUtils.openWorkbook("Not a workbook".getBytes()))
        .isInstanceOf(SecurityException.class);
  }

  // ========== needsFormulaGuard ==========

  @Test
  void needsFormulaGuard_nullAndEmpty_false() {
    assertThat(SecureExcelUtils.needsFormulaGuard(null)).isFalse();
    assertThat(SecureExcelUtils.needsFormulaGuard("")).isFalse();
  }

  @Test
  void needsFormulaGuard_normalText_false() {
    assertThat(SecureExcelUtils.needsFormulaGuard("Fix TDR701 machine")).isFalse();
  }

  @ParameterizedTest
  @ValueSource(strings = {"=SUM(A1:A10)", "+33612345678", "-cmd|'/C calc'!A0", "@SUM(A1)", "\t=x()"})
  void needsFormulaGuard_formulaTriggers_true(String input) {
    assertThat(SecureExcelUtils.needsFormulaGuard(input)).isTrue();
  }
}
