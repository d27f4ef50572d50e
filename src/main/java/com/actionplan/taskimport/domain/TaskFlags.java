package com.actionplan.taskimport.domain;

import java.util.Optional;

/** The four marker columns of the workbook, in their original column order. */
public record TaskFlags(boolean installation, boolean repair, boolean development, boolean delivery) {

  public static final TaskFlags NONE = new TaskFlags(false, false, false, false);

  /**
   * Category implied by the flags. When several flags are set the first one in column order
   * wins: Installation, Repair, Development, Delivery.
   */
  public Optional<TaskCategory> impliedCategory() {
    if (installation) {
      return Optional.of(TaskCategory.INSTALLATION);
    }
    if (repair) {
      return Optional.of(TaskCategory.REPAIR);
    }
    if (development) {
      return Optional.of(TaskCategory.DEVELOPMENT);
    }
    if (delivery) {
      return Optional.of(TaskCategory.DELIVERY);
    }
    return Optional.empty();
  }
}
