package com.bankingconcepts.classifier.dto.concept;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CardinalityConstraint {

  @JsonProperty("max")
  int max;
}
