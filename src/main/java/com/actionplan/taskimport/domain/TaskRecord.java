package com.actionplan.taskimport.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.UUID;
import lombok.Builder;

/**
 * Canonical task produced by an import. Immutable; persistence is the caller's concern.
 *
 * <p>{@code id}, {@code createdAt} and {@code updatedAt} are assigned by the importer and never
 * read from the workbook.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskRecord(
    UUID id,
    String poNumber,
    Instant dateCreated,
    String category,
    String actionDescription,
    String auxiliary,
    String customer,
    String requester,
    String responsible,
    Instant deadline,
    TaskStatus status,
    String notes,
    boolean installationFlag,
    boolean repairFlag,
    boolean developmentFlag,
    boolean deliveryFlag,
    Instant createdAt,
    Instant updatedAt) {

  public TaskFlags flags() {
    return new TaskFlags(installationFlag, repairFlag, developmentFlag, deliveryFlag);
  }
}
