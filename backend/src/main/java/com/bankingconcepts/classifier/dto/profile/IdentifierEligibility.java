package com.bankingconcepts.classifier.dto.profile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

/** Whether a column is structurally allowed to act as a unique identifier. */
@Value
@Builder
public class IdentifierEligibility {

  @JsonProperty("is_eligible")
  boolean eligible;

  @JsonProperty("reason")
  String reason;

  @JsonProperty("uniqueness_pct")
  double uniquenessPct;

  @JsonProperty("has_fixed_length")
  boolean fixedLength;

  @JsonProperty("has_strict_pattern")
  boolean strictPattern;

  @JsonProperty("is_descriptive")
  boolean descriptive;

  @JsonProperty("is_contact")
  boolean contact;

  /** Contact and descriptive columns can never carry an identifier concept. */
  @JsonIgnore
  public boolean isBarredFromIdentifiers() {
    return contact || descriptive;
  }
}
