package com.actionplan.taskimport.controller;

import com.actionplan.taskimport.domain.TaskRecord;
import com.actionplan.taskimport.service.TaskImportRequestService;
import com.actionplan.taskimport.service.export.TaskWorkbookWriter;
import com.actionplan.taskimport.service.pipeline.ImportOutcome;
import com.actionplan.taskimport.service.pipeline.StructureCheck;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskImportApiController {

  static final MediaType XLSX =
      MediaType.parseMediaType(
          "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

  private final TaskImportRequestService importRequestService;
  private final TaskWorkbookWriter workbookWriter;

  @PostMapping("/import")
  public ResponseEntity<Map<String, Object>> importTasks(@RequestPart("file") MultipartFile file)
      throws IOException {
    ImportOutcome outcome = importRequestService.importUpload(file);
    Map<String, Object> response = importRequestService.toApiResponse(outcome);
    if (outcome.isSuccess()) {
      return ResponseEntity.ok(response);
    }
    return ResponseEntity.badRequest().body(response);
  }

  @PostMapping("/import/validate")
  public ResponseEntity<StructureCheck> validate(@RequestPart("file") MultipartFile file)
      throws IOException {
    return ResponseEntity.ok(importRequestService.validateUpload(file));
  }

  @GetMapping("/import/template")
  public ResponseEntity<byte[]> downloadTemplate() throws IOException {
    return xlsxDownload(workbookWriter.writeTemplate(), "plan_action_template.xlsx");
  }

  @PostMapping("/export")
  public ResponseEntity<byte[]> export(@RequestBody List<TaskRecord> records) throws IOException {
    return xlsxDownload(workbookWriter.export(records), "plan_action_export.xlsx");
  }

  private ResponseEntity<byte[]> xlsxDownload(byte[] content, String filename) {
    return ResponseEntity.ok()
        .contentType(XLSX)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(filename).build().toString())
        .body(content);
  }
}
