package com.bankingconcepts.classifier.dto.concept;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Either an exact length or a min/max range. */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LengthConstraint {

  @JsonProperty("exact")
  Integer exact;

  @JsonProperty("min")
  Integer min;

  @JsonProperty("max")
  Integer max;

  public boolean hasExactLength() {
    return exact != null;
  }

  public boolean hasLengthRange() {
    return exact == null && min != null && max != null;
  }
}
