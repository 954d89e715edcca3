package com.bankingconcepts.classifier.dto.description;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

/** Human-authored documentation for a column name. */
@Value
@Builder
public class ColumnDescription {

  @JsonProperty("column_name")
  String columnName;

  @JsonProperty("description")
  String description;

  @JsonProperty("section")
  String section;
}
