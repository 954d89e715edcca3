package com.bankingconcepts.classifier.service.summary;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.bankingconcepts.classifier.dto.analysis.ColumnAnalysisResult;
import com.bankingconcepts.classifier.dto.analysis.DatasetSummary;
import com.bankingconcepts.classifier.service.Rounding;

@Service
public class DatasetSummarizerService {

  /**
   * Aggregates per-column results in a single pass.
   *
   * @param results the column results in input order
   * @return the dataset summary
   */
  public DatasetSummary summarize(List<ColumnAnalysisResult> results) {
    int total = results.size();
    int identified = 0;
    int identifiers = 0;
    int confidentColumns = 0;
    double confidenceSum = 0;
    Map<String, Integer> domains = new LinkedHashMap<>();

    for (ColumnAnalysisResult result : results) {
      if (result.getConfidence() > 0) {
        confidentColumns++;
        confidenceSum += result.getConfidence();
      }
      if (result.getMatch().isUnknown()) {
        continue;
      }
      identified++;
      domains.merge(result.getMatch().getDomain().getDisplayName(), 1, Integer::sum);
      if (result.getMatch().isIdentifierConcept() && result.getEligibility().isEligible()) {
        identifiers++;
      }
    }

    return DatasetSummary.builder()
        .totalColumns(total)
        .identifiedColumns(identified)
        .unidentifiedColumns(total - identified)
        .identificationRate(total > 0 ? Rounding.round(identified * 100.0 / total, 1) : 0.0)
        .averageConfidence(
            confidentColumns > 0 ? Rounding.round(confidenceSum / confidentColumns, 1) : 0.0)
        .domainDistribution(domains)
        .identifierCount(identifiers)
        .build();
  }
}
