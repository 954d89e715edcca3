package com.bankingconcepts.classifier.controller;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.bankingconcepts.classifier.config.ApplicationProperties;
import com.bankingconcepts.classifier.dto.analysis.DatasetAnalysisRequest;
import com.bankingconcepts.classifier.dto.analysis.DatasetAnalysisResponse;
import com.bankingconcepts.classifier.dto.analysis.DatasetAnalysisResponse.ProcessingMetadata;
import com.bankingconcepts.classifier.service.DatasetAnalysis;
import com.bankingconcepts.classifier.service.DatasetAnalysisService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Dataset Analysis", description = "Banking concept classification of dataset columns")
public class DatasetAnalysisController {

  private final DatasetAnalysisService analysisService;
  private final ApplicationProperties applicationProperties;

  @PostMapping(
      value = "/analyze/dataset",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Analyze dataset columns",
      description =
          "Profiles every column, matches it to a banking concept, scores the confidence and"
              + " derives the business rules")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Successful analysis",
            content = @Content(schema = @Schema(implementation = DatasetAnalysisResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request or empty dataset",
            content = @Content),
        @ApiResponse(responseCode = "500", description = "Internal server error", content = @Content)
      })
  public ResponseEntity<DatasetAnalysisResponse> analyzeDataset(
      @Valid @RequestBody DatasetAnalysisRequest request) {
    long startTime = System.currentTimeMillis();
    int maxRows =
        request.getMaxRows() != null
            ? request.getMaxRows()
            : applicationProperties.getDefaultMaxRows();
    log.info(
        "[DATASET-ANALYSIS-CONTROLLER] Received dataset '{}' with {} columns and {} rows (max rows {})",
        request.getDatasetName(),
        request.getColumns().size(),
        request.getData().size(),
        maxRows);

    Map<String, List<Object>> columns = toColumns(request, maxRows);
    DatasetAnalysis analysis = analysisService.analyzeDataset(request.getDatasetName(), columns);

    DatasetAnalysisResponse response =
        DatasetAnalysisResponse.builder()
            .datasetName(analysis.getContext().getDatasetName())
            .columnsAnalysis(analysis.getColumnsAnalysis())
            .summary(analysis.getSummary())
            .processingMetadata(
                ProcessingMetadata.builder()
                    .totalColumns(analysis.getContext().getTotalColumns())
                    .totalRowsProcessed(analysis.getContext().getTotalRows())
                    .processingTimeMs(System.currentTimeMillis() - startTime)
                    .registryVersion(analysis.getContext().getRegistryVersion())
                    .build())
            .build();
    return ResponseEntity.ok(response);
  }

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Check if the analysis service is healthy")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Service is healthy")})
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of("status", "UP", "timestamp", System.currentTimeMillis()));
  }

  /** Pivots row maps into an ordered column map, truncated to {@code maxRows}. */
  static Map<String, List<Object>> toColumns(DatasetAnalysisRequest request, int maxRows) {
    List<Map<String, Object>> rows = request.getData();
    int rowCount = Math.min(rows.size(), maxRows);
    Map<String, List<Object>> columns = new LinkedHashMap<>();
    for (String column : request.getColumns()) {
      List<Object> values = new ArrayList<>(rowCount);
      for (int i = 0; i < rowCount; i++) {
        Map<String, Object> row = rows.get(i);
        values.add(row != null ? row.get(column) : null);
      }
      columns.put(column, values);
    }
    return columns;
  }
}
