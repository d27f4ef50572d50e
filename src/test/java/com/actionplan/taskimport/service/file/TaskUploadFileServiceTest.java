package com.actionplan.taskimport.service.file;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.actionplan.taskimport.config.TaskImportProperties;
import com.actionplan.taskimport.support.WorkbookFixtures;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

class TaskUploadFileServiceTest {

  private static final String XLSX_TYPE =
      "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

  private TaskImportProperties properties;
  private TaskUploadFileService uploadFileService;

  @BeforeEach
  void setUp() {
    properties = new TaskImportProperties();
    uploadFileService = new TaskUploadFileService(properties);
  }

  @Test
  void xlsxFile_returnsContentUnchanged() throws IOException {
    byte[] xlsxBytes = WorkbookFixtures.workbook(List.of("Action")).toBytes();
    var file = new MockMultipartFile("file", "plan.xlsx", XLSX_TYPE, xlsxBytes);

    assertThat(uploadFileService.readValidatedXlsx(file)).isEqualTo(xlsxBytes);
  }

  @Test
  void pathInFilename_isAccepted() throws IOException {
    byte[] xlsxBytes = WorkbookFixtures.workbook(List.of("Action")).toBytes();
    var file = new MockMultipartFile("file", "../../exports/plan.xlsx", XLSX_TYPE, xlsxBytes);

    assertThat(uploadFileService.readValidatedXlsx(file)).isEqualTo(xlsxBytes);
  }

  @Test
  void emptyFile_rejected() {
    var file = new MockMultipartFile("file", "plan.xlsx", XLSX_TYPE, new byte[0]);

    assertThatThrownBy(() -> uploadFileService.readValidatedXlsx(file))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("empty");
  }

  @Test
  void xlsFile_rejected() {
    byte[] xlsxBytes = WorkbookFixtures.workbook(List.of("Action")).toBytes();
    var file = new MockMultipartFile("file", "plan.xls", "application/vnd.ms-excel", xlsxBytes);

    assertThatThrownBy(() -> uploadFileService.readValidatedXlsx(file))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining(".xlsx");
  }

  @Test
  void csvFile_rejected() {
    var file = new MockMultipartFile("file", "plan.csv", "text/csv", "Action;Customer".getBytes());

    assertThatThrownBy(() -> uploadFileService.readValidatedXlsx(file))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("extension");
  }

  @Test
  void oversizedFile_rejected() {
    properties.setMaxFileSizeMb(0);
    byte[] xlsxBytes = WorkbookFixtures.workbook(List.of("Action")).toBytes();
    var file = new MockMultipartFile("file", "plan.xlsx", XLSX_TYPE, xlsxBytes);

    assertThatThrownBy(() -> uploadFileService.readValidatedXlsx(file))
        .isInstanceOf(MaxUploadSizeExceededException.class);
  }

  @Test
  void disguisedFile_rejected() {
    var file = new MockMultipartFile("file", "plan.xlsx", XLSX_TYPE, "%PDF-1.7 not a sheet".getBytes());

    assertThatThrownBy(() -> uploadFileService.readValidatedXlsx(file))
        .isInstanceOf(SecurityException.class);
  }
}
