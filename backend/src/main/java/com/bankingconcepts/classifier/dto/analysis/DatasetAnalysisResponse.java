package com.bankingconcepts.classifier.dto.analysis;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DatasetAnalysisResponse {

  @JsonProperty("dataset_name")
  private String datasetName;

  @JsonProperty("columns_analysis")
  private List<ColumnAnalysisResult> columnsAnalysis;

  @JsonProperty("summary")
  private DatasetSummary summary;

  @JsonProperty("processing_metadata")
  private ProcessingMetadata processingMetadata;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ProcessingMetadata {

    @JsonProperty("total_columns")
    private Integer totalColumns;

    @JsonProperty("total_rows_processed")
    private Integer totalRowsProcessed;

    @JsonProperty("processing_time_ms")
    private Long processingTimeMs;

    @JsonProperty("registry_version")
    private String registryVersion;
  }
}
