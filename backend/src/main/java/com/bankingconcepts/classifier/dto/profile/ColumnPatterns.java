package com.bankingconcepts.classifier.dto.profile;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

/**
 * Pattern facts detected for a column. Every field is optional: length facts only exist for
 * text-like columns, numeric facts only for numeric ones, and nothing is set for a column without
 * observed values.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnPatterns {

  public static final ColumnPatterns EMPTY = ColumnPatterns.builder().build();

  @JsonProperty("min_length")
  Integer minLength;

  @JsonProperty("max_length")
  Integer maxLength;

  @JsonProperty("avg_length")
  Double avgLength;

  @JsonProperty("length_std_dev")
  Double lengthStdDev;

  @JsonProperty("only_digits")
  Boolean onlyDigits;

  @JsonProperty("alphanumeric")
  Boolean alphanumeric;

  @JsonProperty("fixed_length")
  Boolean fixedLength;

  @JsonProperty("fixed_length_value")
  Integer fixedLengthValue;

  @JsonProperty("near_fixed_length")
  Boolean nearFixedLength;

  @JsonProperty("typical_length")
  Integer typicalLength;

  @JsonProperty("low_cardinality")
  Boolean lowCardinality;

  @JsonProperty("distinct_values")
  List<String> distinctValues;

  @JsonProperty("date_format")
  String dateFormat;

  @JsonProperty("min_value")
  Double minValue;

  @JsonProperty("max_value")
  Double maxValue;

  @JsonProperty("mean_value")
  Double meanValue;

  @JsonProperty("median_value")
  Double medianValue;

  @JsonProperty("has_negative")
  Boolean hasNegative;

  @JsonProperty("has_zero")
  Boolean hasZero;

  @JsonProperty("has_positive")
  Boolean hasPositive;

  @JsonIgnore
  public boolean isFixed() {
    return Boolean.TRUE.equals(fixedLength);
  }

  @JsonIgnore
  public boolean isNearFixed() {
    return Boolean.TRUE.equals(nearFixedLength);
  }

  @JsonIgnore
  public boolean isDigitsOnly() {
    return Boolean.TRUE.equals(onlyDigits);
  }

  @JsonIgnore
  public boolean isStrictAlphanumeric() {
    return Boolean.TRUE.equals(alphanumeric);
  }
}
