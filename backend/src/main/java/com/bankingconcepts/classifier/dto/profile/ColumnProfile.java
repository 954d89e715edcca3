package com.bankingconcepts.classifier.dto.profile;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

/** Structural and statistical facts about one column, produced once per analysis call. */
@Value
@Builder
public class ColumnProfile {

  @JsonProperty("column_name")
  String columnName;

  @JsonProperty("keywords")
  List<String> keywords;

  @JsonProperty("data_type")
  DataType dataType;

  @JsonProperty("total_records")
  int totalRecords;

  @JsonProperty("non_null_count")
  int nonNullCount;

  @JsonProperty("null_count")
  int nullCount;

  @JsonProperty("null_percentage")
  double nullPercentage;

  @JsonProperty("empty_count")
  int emptyCount;

  @JsonProperty("empty_percentage")
  double emptyPercentage;

  @JsonProperty("unique_count")
  int uniqueCount;

  @JsonProperty("uniqueness_percentage")
  double uniquenessPercentage;

  @JsonProperty("patterns")
  ColumnPatterns patterns;

  /** True when at least one cell carried a non-blank value. */
  public boolean hasObservedValues() {
    return uniqueCount > 0;
  }
}
