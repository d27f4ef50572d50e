package com.actionplan.taskimport.service.pipeline.build;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Required text fields of a row, checked with Bean Validation before a record is built. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskDraft {

  @NotBlank(message = "Action description is required")
  private String actionDescription;

  @NotBlank(message = "Customer is required")
  private String customer;

  @NotBlank(message = "Requester is required")
  private String requester;

  @NotBlank(message = "Responsible is required")
  private String responsible;
}
