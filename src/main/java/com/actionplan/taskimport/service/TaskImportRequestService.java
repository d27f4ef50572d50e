package com.actionplan.taskimport.service;

import com.actionplan.taskimport.diagnostics.ImportReport;
import com.actionplan.taskimport.service.file.TaskUploadFileService;
import com.actionplan.taskimport.service.pipeline.ImportFailure;
import com.actionplan.taskimport.service.pipeline.ImportOutcome;
import com.actionplan.taskimport.service.pipeline.StructureCheck;
import com.actionplan.taskimport.service.pipeline.TaskImportService;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Glue between multipart uploads and the import engine; shapes the JSON responses. */
@Service
@RequiredArgsConstructor
public class TaskImportRequestService {

  private final TaskUploadFileService uploadFileService;
  private final TaskImportService importService;

  public ImportOutcome importUpload(MultipartFile file) throws IOException {
    return importService.importTasks(uploadFileService.readValidatedXlsx(file));
  }

  public StructureCheck validateUpload(MultipartFile file) throws IOException {
    return importService.validateStructure(uploadFileService.readValidatedXlsx(file));
  }

  public Map<String, Object> toApiResponse(ImportOutcome outcome) {
    Map<String, Object> response = new LinkedHashMap<>();
    response.put("success", outcome.isSuccess());

    if (outcome instanceof ImportOutcome.Success success) {
      ImportReport report = success.report();
      response.put("records", report.records());
      response.put("diagnostics", report.diagnostics());
      response.put("summary", report.summary());
      return response;
    }

    ImportFailure failure = ((ImportOutcome.Failure) outcome).failure();
    response.put("failure", failure.kind());
    response.put("missingColumns", failure.missingColumns());
    response.put("message", failure.message());
    return response;
  }
}
