package com.actionplan.taskimport.service.pipeline.build;

import com.actionplan.taskimport.domain.TaskRecord;
import java.util.List;

/** What became of one normalized row. */
public sealed interface BuildResult
    permits BuildResult.Built, BuildResult.SkippedEmpty, BuildResult.Rejected {

  record Built(TaskRecord record) implements BuildResult {}

  /** Empty action description: a trailing blank row, not an error. */
  record SkippedEmpty() implements BuildResult {}

  record Rejected(List<String> missingFields) implements BuildResult {
    public Rejected {
      missingFields = List.copyOf(missingFields);
    }
  }
}
