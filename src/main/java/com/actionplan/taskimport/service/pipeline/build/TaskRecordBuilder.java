package com.actionplan.taskimport.service.pipeline.build;

import com.actionplan.taskimport.domain.CanonicalField;
import com.actionplan.taskimport.domain.TaskRecord;
import com.actionplan.taskimport.service.pipeline.normalize.ImportContext;
import com.actionplan.taskimport.service.pipeline.normalize.NormalizedRow;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns a normalized row into a {@link TaskRecord}, or explains why it cannot. System fields
 * ({@code id}, {@code createdAt}, {@code updatedAt}) are assigned here.
 */
@Component
@RequiredArgsConstructor
public class TaskRecordBuilder {

  private final Validator validator;

  public BuildResult build(NormalizedRow row, ImportContext context) {
    if (row.actionDescription() == null || row.actionDescription().isBlank()) {
      return new BuildResult.SkippedEmpty();
    }

    TaskDraft draft =
        new TaskDraft(row.actionDescription(), row.customer(), row.requester(), row.responsible());
    Set<ConstraintViolation<TaskDraft>> violations = validator.validate(draft);
    if (!violations.isEmpty()) {
      return new BuildResult.Rejected(missingFieldsOf(violations));
    }

    TaskRecord record =
        TaskRecord.builder()
            .id(UUID.randomUUID())
            .poNumber(row.poNumber())
            .dateCreated(row.dateCreated())
            .category(row.category())
            .actionDescription(row.actionDescription())
            .auxiliary(row.auxiliary())
            .customer(row.customer())
            .requester(row.requester())
            .responsible(row.responsible())
            .deadline(row.deadline())
            .status(row.status())
            .notes(row.notes())
            .installationFlag(row.flags().installation())
            .repairFlag(row.flags().repair())
            .developmentFlag(row.flags().development())
            .deliveryFlag(row.flags().delivery())
            .createdAt(context.processedAt())
            .updatedAt(context.processedAt())
            .build();
    return new BuildResult.Built(record);
  }

  private List<String> missingFieldsOf(Set<ConstraintViolation<TaskDraft>> violations) {
    return violations.stream()
        .map(violation -> CanonicalField.fromFieldName(violation.getPropertyPath().toString()))
        .distinct()
        .sorted(Comparator.naturalOrder())
        .map(CanonicalField::getFieldName)
        .toList();
  }
}
