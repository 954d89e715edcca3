package com.bankingconcepts.classifier.service;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

/**
 * Scratch context of one {@code analyzeDataset} call. A new instance is created for every call and
 * handed through the pipeline explicitly, so concurrent analyses never share it.
 */
@Value
@Builder
public class AnalysisContext {

  @JsonProperty("dataset_name")
  String datasetName;

  @JsonProperty("total_columns")
  int totalColumns;

  @JsonProperty("total_rows")
  int totalRows;

  @JsonProperty("registry_version")
  String registryVersion;
}
