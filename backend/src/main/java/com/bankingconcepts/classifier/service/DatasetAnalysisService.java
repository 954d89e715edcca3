package com.bankingconcepts.classifier.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.bankingconcepts.classifier.config.ApplicationProperties;
import com.bankingconcepts.classifier.dto.analysis.ColumnAnalysisResult;
import com.bankingconcepts.classifier.dto.analysis.DatasetSummary;
import com.bankingconcepts.classifier.dto.concept.ConceptMatch;
import com.bankingconcepts.classifier.dto.description.ColumnDescription;
import com.bankingconcepts.classifier.dto.profile.ColumnPatterns;
import com.bankingconcepts.classifier.dto.profile.ColumnProfile;
import com.bankingconcepts.classifier.dto.profile.DataType;
import com.bankingconcepts.classifier.dto.profile.IdentifierEligibility;
import com.bankingconcepts.classifier.exception.EmptyDatasetException;
import com.bankingconcepts.classifier.service.concept.ConceptMatcherService;
import com.bankingconcepts.classifier.service.concept.ConceptRegistryService;
import com.bankingconcepts.classifier.service.concept.ConfidenceScorerService;
import com.bankingconcepts.classifier.service.concept.IdentifierEligibilityService;
import com.bankingconcepts.classifier.service.description.ColumnDescriptionService;
import com.bankingconcepts.classifier.service.profiling.ColumnProfilerService;
import com.bankingconcepts.classifier.service.rules.BusinessRuleDeriverService;
import com.bankingconcepts.classifier.service.rules.BusinessRuleDeriverService.Derivation;
import com.bankingconcepts.classifier.service.summary.DatasetSummarizerService;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs the column analysis pipeline (profile, eligibility, concept match, confidence, business
 * rules) over every column of a dataset and summarizes the results. Columns are independent, so
 * they may be analysed in parallel; results always come back in input order.
 */
@Slf4j
@Service
public class DatasetAnalysisService {

  static final String DEFAULT_DATASET_NAME = "dataset";
  static final String DATASET_MDC_KEY = "datasetName";

  private final ColumnProfilerService profiler;
  private final IdentifierEligibilityService eligibilityChecker;
  private final ConceptMatcherService conceptMatcher;
  private final ConfidenceScorerService confidenceScorer;
  private final BusinessRuleDeriverService ruleDeriver;
  private final DatasetSummarizerService summarizer;
  private final ColumnDescriptionService descriptionService;
  private final ConceptRegistryService conceptRegistry;
  private final ApplicationProperties applicationProperties;
  private final Executor taskExecutor;

  public DatasetAnalysisService(
      ColumnProfilerService profiler,
      IdentifierEligibilityService eligibilityChecker,
      ConceptMatcherService conceptMatcher,
      ConfidenceScorerService confidenceScorer,
      BusinessRuleDeriverService ruleDeriver,
      DatasetSummarizerService summarizer,
      ColumnDescriptionService descriptionService,
      ConceptRegistryService conceptRegistry,
      ApplicationProperties applicationProperties,
      @Qualifier("taskExecutor") Executor taskExecutor) {
    this.profiler = profiler;
    this.eligibilityChecker = eligibilityChecker;
    this.conceptMatcher = conceptMatcher;
    this.confidenceScorer = confidenceScorer;
    this.ruleDeriver = ruleDeriver;
    this.summarizer = summarizer;
    this.descriptionService = descriptionService;
    this.conceptRegistry = conceptRegistry;
    this.applicationProperties = applicationProperties;
    this.taskExecutor = taskExecutor;
  }

  public DatasetAnalysis analyzeDataset(Map<String, ? extends List<?>> columns) {
    return analyzeDataset(DEFAULT_DATASET_NAME, columns);
  }

  /**
   * Analyses every column of a dataset.
   *
   * @param datasetName name used in logs and in the returned context
   * @param columns column name to cell values, in column order
   * @return per-column results in input order plus the dataset summary
   * @throws EmptyDatasetException when there are no columns or no rows
   */
  public DatasetAnalysis analyzeDataset(
      String datasetName, Map<String, ? extends List<?>> columns) {
    if (columns == null || columns.isEmpty()) {
      throw new EmptyDatasetException("Dataset has no columns to analyse");
    }
    int totalRows =
        columns.values().stream().mapToInt(values -> values != null ? values.size() : 0).max()
            .orElse(0);
    if (totalRows == 0) {
      throw new EmptyDatasetException("Dataset has no rows to analyse");
    }

    AnalysisContext context =
        AnalysisContext.builder()
            .datasetName(datasetName != null ? datasetName : DEFAULT_DATASET_NAME)
            .totalColumns(columns.size())
            .totalRows(totalRows)
            .registryVersion(conceptRegistry.getVersion())
            .build();
    MDC.put(DATASET_MDC_KEY, context.getDatasetName());
    try {
      log.info(
          "Starting analysis of dataset '{}' with {} columns and {} rows",
          context.getDatasetName(),
          context.getTotalColumns(),
          context.getTotalRows());

      List<ColumnAnalysisResult> results =
          applicationProperties.getParallel().isEnabled() && columns.size() > 1
              ? analyzeInParallel(context, columns)
              : analyzeSequentially(context, columns);

      DatasetSummary summary = summarizer.summarize(results);
      log.info(
          "Finished dataset '{}': {}/{} columns identified, average confidence {}",
          context.getDatasetName(),
          summary.getIdentifiedColumns(),
          summary.getTotalColumns(),
          summary.getAverageConfidence());
      return new DatasetAnalysis(context, results, summary);
    } finally {
      MDC.remove(DATASET_MDC_KEY);
    }
  }

  private List<ColumnAnalysisResult> analyzeSequentially(
      AnalysisContext context, Map<String, ? extends List<?>> columns) {
    List<ColumnAnalysisResult> results = new ArrayList<>(columns.size());
    columns.forEach((name, values) -> results.add(analyzeColumnSafely(context, name, values)));
    return results;
  }

  private List<ColumnAnalysisResult> analyzeInParallel(
      AnalysisContext context, Map<String, ? extends List<?>> columns) {
    List<CompletableFuture<ColumnAnalysisResult>> futures = new ArrayList<>(columns.size());
    columns.forEach((name, values) -> futures.add(submitColumn(context, name, values)));
    List<ColumnAnalysisResult> results = new ArrayList<>(futures.size());
    for (CompletableFuture<ColumnAnalysisResult> future : futures) {
      results.add(future.join());
    }
    return results;
  }

  /** Runs the column on the calling thread when the pool refuses the task. */
  private CompletableFuture<ColumnAnalysisResult> submitColumn(
      AnalysisContext context, String columnName, List<?> values) {
    try {
      return CompletableFuture.supplyAsync(
          () -> analyzeColumnSafely(context, columnName, values), taskExecutor);
    } catch (RejectedExecutionException e) {
      log.warn(
          "Column pool saturated; analysing column '{}' of dataset '{}' inline",
          columnName,
          context.getDatasetName());
      return CompletableFuture.completedFuture(analyzeColumnSafely(context, columnName, values));
    }
  }

  /** One column's failure is reported as an unknown column instead of failing the dataset. */
  private ColumnAnalysisResult analyzeColumnSafely(
      AnalysisContext context, String columnName, List<?> values) {
    try {
      return analyzeColumn(columnName, values);
    } catch (RuntimeException e) {
      log.error(
          "Analysis of column '{}' in dataset '{}' failed; reporting it as unknown",
          columnName,
          context.getDatasetName(),
          e);
      return degradedResult(columnName, values);
    }
  }

  /**
   * Runs the full pipeline for one column.
   *
   * @param columnName the column name
   * @param values the column's cells
   * @return the column result
   */
  public ColumnAnalysisResult analyzeColumn(String columnName, List<?> values) {
    ColumnProfile profile = profiler.profile(columnName, values);
    IdentifierEligibility eligibility = eligibilityChecker.check(columnName, profile);
    ConceptMatch match = conceptMatcher.match(columnName, profile, eligibility);
    double confidence = confidenceScorer.score(match, profile, eligibility);
    Optional<ColumnDescription> description = descriptionService.describe(columnName);
    Derivation derivation = ruleDeriver.derive(match, profile, eligibility, description);

    log.debug(
        "Column '{}' -> {} (confidence {}, eligible={})",
        columnName,
        match.getConceptKey(),
        confidence,
        eligibility.isEligible());

    return ColumnAnalysisResult.builder()
        .columnName(columnName)
        .profile(profile)
        .eligibility(eligibility)
        .match(match)
        .confidence(confidence)
        .businessMeaning(derivation.getBusinessMeaning())
        .rules(derivation.getRules())
        .rulesDisplay(derivation.getRulesDisplay())
        .whyRuleExists(derivation.getWhyRuleExists())
        .violationImpact(derivation.getViolationImpact())
        .workflowRole(derivation.getWorkflowRole())
        .descriptionSection(derivation.getDescriptionSection())
        .build();
  }

  private ColumnAnalysisResult degradedResult(String columnName, List<?> values) {
    int total = values != null ? values.size() : 0;
    ColumnProfile profile =
        ColumnProfile.builder()
            .columnName(columnName)
            .keywords(List.of())
            .dataType(DataType.TEXT)
            .totalRecords(total)
            .patterns(ColumnPatterns.EMPTY)
            .build();
    IdentifierEligibility eligibility =
        IdentifierEligibility.builder()
            .eligible(false)
            .reason("column could not be profiled")
            .build();
    Derivation derivation =
        ruleDeriver.derive(ConceptMatch.unknown(), profile, eligibility, Optional.empty());
    return ColumnAnalysisResult.builder()
        .columnName(columnName)
        .profile(profile)
        .eligibility(eligibility)
        .match(ConceptMatch.unknown())
        .confidence(0.0)
        .businessMeaning(derivation.getBusinessMeaning())
        .rules(derivation.getRules())
        .rulesDisplay(derivation.getRulesDisplay())
        .whyRuleExists(derivation.getWhyRuleExists())
        .violationImpact(derivation.getViolationImpact())
        .workflowRole(derivation.getWorkflowRole())
        .build();
  }
}
