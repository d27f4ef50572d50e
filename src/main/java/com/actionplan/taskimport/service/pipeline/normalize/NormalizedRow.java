package com.actionplan.taskimport.service.pipeline.normalize;

import com.actionplan.taskimport.diagnostics.RowWarning;
import com.actionplan.taskimport.domain.TaskFlags;
import com.actionplan.taskimport.domain.TaskStatus;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 * Canonical field values of one row, not yet validated. Required strings are {@code ""} when
 * absent; optional ones are {@code null}.
 */
@Builder
public record NormalizedRow(
    int rowIndex,
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
    TaskFlags flags,
    List<RowWarning> warnings) {

  public NormalizedRow {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
    flags = flags == null ? TaskFlags.NONE : flags;
  }
}
