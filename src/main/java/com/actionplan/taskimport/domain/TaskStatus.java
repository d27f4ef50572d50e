package com.actionplan.taskimport.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Workflow state of a task. Serialized by its English label ("Pending", "InProgress", ...). */
public enum TaskStatus {
  PENDING("Pending", "En Attente"),
  IN_PROGRESS("InProgress", "En Cours"),
  DONE("Done", "Terminé"),
  CANCELLED("Cancelled", "Annulé"),
  ON_HOLD("OnHold", "En Pause");

  private final String label;
  private final String frenchLabel;

  TaskStatus(String label, String frenchLabel) {
    this.label = label;
    this.frenchLabel = frenchLabel;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  public String getFrenchLabel() {
    return frenchLabel;
  }

  @JsonCreator
  public static TaskStatus fromLabel(String label) {
    for (TaskStatus status : values()) {
      if (status.label.equalsIgnoreCase(label) || status.name().equalsIgnoreCase(label)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown task status: " + label);
  }
}
