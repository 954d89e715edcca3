package com.bankingconcepts.classifier.dto.concept;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Expected uniqueness of a concept's values. */
public enum UniquenessClass {
  @JsonProperty("very_high")
  VERY_HIGH,
  @JsonProperty("high")
  HIGH,
  @JsonProperty("medium")
  MEDIUM,
  @JsonProperty("low")
  LOW,
  @JsonProperty("very_low")
  VERY_LOW
}
