package com.bankingconcepts.classifier.dto.analysis;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DatasetSummary {

  @JsonProperty("total_columns")
  int totalColumns;

  @JsonProperty("identified_columns")
  int identifiedColumns;

  @JsonProperty("unidentified_columns")
  int unidentifiedColumns;

  @JsonProperty("identification_rate")
  double identificationRate;

  @JsonProperty("average_confidence")
  double averageConfidence;

  @JsonProperty("domain_distribution")
  Map<String, Integer> domainDistribution;

  @JsonProperty("identifier_count")
  int identifierCount;
}
