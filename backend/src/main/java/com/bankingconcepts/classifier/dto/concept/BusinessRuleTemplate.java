package com.bankingconcepts.classifier.dto.concept;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Business rules a column inherits once it is matched to the concept. */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BusinessRuleTemplate {

  @JsonProperty("unique")
  boolean unique;

  @JsonProperty("mandatory")
  boolean mandatory;

  @JsonProperty("primary_key")
  boolean primaryKey;

  @JsonProperty("foreign_key")
  boolean foreignKey;

  @JsonProperty("format")
  String format;

  @JsonProperty("allowed_values")
  List<String> allowedValues;

  @JsonProperty("reason")
  String reason;

  @JsonProperty("violation_impact")
  String violationImpact;
}
