package com.actionplan.taskimport.domain;

import java.util.Arrays;
import java.util.List;

/** Named slots of {@link TaskRecord} that can be fed from a workbook column. */
public enum CanonicalField {
  PO_NUMBER("poNumber", false),
  DATE_CREATED("dateCreated", false),
  CATEGORY("category", false),
  ACTION_DESCRIPTION("actionDescription", true),
  AUXILIARY("auxiliary", false),
  CUSTOMER("customer", true),
  REQUESTER("requester", true),
  RESPONSIBLE("responsible", true),
  DEADLINE("deadline", false),
  STATUS("status", false),
  NOTES("notes", false),
  INSTALLATION_FLAG("installationFlag", false),
  REPAIR_FLAG("repairFlag", false),
  DEVELOPMENT_FLAG("developmentFlag", false),
  DELIVERY_FLAG("deliveryFlag", false);

  private final String fieldName;
  private final boolean required;

  CanonicalField(String fieldName, boolean required) {
    this.fieldName = fieldName;
    this.required = required;
  }

  public String getFieldName() {
    return fieldName;
  }

  public boolean isRequired() {
    return required;
  }

  public static List<CanonicalField> requiredFields() {
    return Arrays.stream(values()).filter(CanonicalField::isRequired).toList();
  }

  public static CanonicalField fromFieldName(String fieldName) {
    for (CanonicalField field : values()) {
      if (field.fieldName.equals(fieldName)) {
        return field;
      }
    }
    throw new IllegalArgumentException("Unknown canonical field: " + fieldName);
  }
}
