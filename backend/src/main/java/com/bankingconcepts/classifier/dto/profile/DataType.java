package com.bankingconcepts.classifier.dto.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Structural data type assigned to a column by the profiler. */
public enum DataType {
  NUMERIC("numeric"),
  DECIMAL("decimal"),
  DATE("date"),
  TEXT("text"),
  ALPHANUMERIC("alphanumeric");

  private final String code;

  DataType(String code) {
    this.code = code;
  }

  @JsonValue
  public String getCode() {
    return code;
  }

  /** Numeric and decimal are interchangeable for partial type credit. */
  public boolean isCompatibleWith(DataType other) {
    return (this == NUMERIC && other == DECIMAL) || (this == DECIMAL && other == NUMERIC);
  }

  public boolean isNumber() {
    return this == NUMERIC || this == DECIMAL;
  }

  public boolean isTextLike() {
    return this == TEXT || this == ALPHANUMERIC;
  }

  @JsonCreator
  public static DataType fromCode(String code) {
    if (code == null) {
      return null;
    }
    String normalized = code.trim().toLowerCase();
    // registry entries may still say "datetime"
    if ("datetime".equals(normalized)) {
      return DATE;
    }
    for (DataType type : values()) {
      if (type.code.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown data type: " + code);
  }
}
