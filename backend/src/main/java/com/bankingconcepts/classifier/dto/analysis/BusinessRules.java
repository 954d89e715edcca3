package com.bankingconcepts.classifier.dto.analysis;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

/**
 * Rule set derived for a column. {@code unique} and {@code mandatory} are null when the column
 * could not be identified.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BusinessRules {

  @JsonProperty("unique")
  Boolean unique;

  @JsonProperty("mandatory")
  Boolean mandatory;

  @JsonProperty("primary_key")
  boolean primaryKey;

  @JsonProperty("foreign_key")
  boolean foreignKey;

  @JsonProperty("format")
  String format;

  @JsonProperty("allowed_values")
  List<String> allowedValues;
}
