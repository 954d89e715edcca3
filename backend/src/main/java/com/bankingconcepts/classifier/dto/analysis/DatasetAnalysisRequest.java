package com.bankingconcepts.classifier.dto.analysis;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetAnalysisRequest {

  @JsonProperty("dataset_name")
  private String datasetName;

  // emptiness is reported by the service as an empty dataset, not as a validation failure
  @NotNull
  @JsonProperty("columns")
  private List<String> columns;

  @NotNull
  @JsonProperty("data")
  private List<Map<String, Object>> data;

  @Positive
  @JsonProperty("max_rows")
  private Integer maxRows;
}
