package com.actionplan.taskimport.domain;

/**
 * Fixed category vocabulary. Records carry the category as a plain string because unknown
 * values from the workbook are kept verbatim; {@link #getLabel()} is the canonical spelling.
 */
public enum TaskCategory {
  INSTALLATION("Installation", "Installation"),
  REPAIR("Repair", "Réparation"),
  DEVELOPMENT("Development", "Développement"),
  DELIVERY("Delivery", "Livraison"),
  COMMERCIAL("Commercial", "Commercial");

  private final String label;
  private final String frenchLabel;

  TaskCategory(String label, String frenchLabel) {
    this.label = label;
    this.frenchLabel = frenchLabel;
  }

  public String getLabel() {
    return label;
  }

  public String getFrenchLabel() {
    return frenchLabel;
  }

  /** Returns the French label for a canonical label, or the label itself for custom categories. */
  public static String frenchLabelOf(String label) {
    for (TaskCategory category : values()) {
      if (category.label.equals(label)) {
        return category.frenchLabel;
      }
    }
    return label;
  }
}
