package com.bankingconcepts.classifier.dto.concept;

import java.util.Set;

import com.bankingconcepts.classifier.dto.profile.DataType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Data behaviour a column must show to look like the concept. */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DataPatterns {

  @JsonProperty("type")
  Set<DataType> types;

  @JsonProperty("uniqueness")
  UniquenessClass uniqueness;

  @JsonProperty("length")
  LengthConstraint length;

  @JsonProperty("cardinality")
  CardinalityConstraint cardinality;

  @JsonProperty("nullable")
  boolean nullable;
}
