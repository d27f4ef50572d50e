package com.actionplan.taskimport.controller;

import com.actionplan.taskimport.service.pipeline.read.CorruptWorkbookException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@Slf4j
@RestControllerAdvice(basePackageClasses = TaskImportApiController.class)
public class TaskImportApiExceptionHandler {

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
    log.warn("Invalid upload request: {}", e.getMessage());
    return ResponseEntity.badRequest().body(errorBody(e.getMessage()));
  }

  @ExceptionHandler(SecurityException.class)
  public ResponseEntity<Map<String, Object>> handleSecurity(SecurityException e) {
    log.warn("Upload failed content check: {}", e.getMessage());
    return ResponseEntity.badRequest().body(errorBody("File failed the security check"));
  }

  @ExceptionHandler(CorruptWorkbookException.class)
  public ResponseEntity<Map<String, Object>> handleCorruptWorkbook(CorruptWorkbookException e) {
    log.warn("Unreadable workbook: {}", e.getMessage());
    return ResponseEntity.badRequest().body(errorBody("The file is not a readable .xlsx workbook"));
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<Map<String, Object>> handleMaxUploadSize(MaxUploadSizeExceededException e) {
    log.warn("Upload too large: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
        .body(errorBody("The uploaded file exceeds the size limit"));
  }

  @ExceptionHandler({MultipartException.class, MissingServletRequestPartException.class})
  public ResponseEntity<Map<String, Object>> handleMultipartException(Exception e) {
    log.warn("Multipart request error: {}", e.getMessage());
    return ResponseEntity.badRequest().body(errorBody("The multipart request could not be processed"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
    log.error("Task import request failed", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(errorBody("The file could not be processed. Please contact an administrator."));
  }

  private Map<String, Object> errorBody(String message) {
    return Map.of("success", false, "message", message);
  }
}
