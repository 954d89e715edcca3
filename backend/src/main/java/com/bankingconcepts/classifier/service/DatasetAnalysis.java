package com.bankingconcepts.classifier.service;

import java.util.List;

import com.bankingconcepts.classifier.dto.analysis.ColumnAnalysisResult;
import com.bankingconcepts.classifier.dto.analysis.DatasetSummary;

import lombok.Value;

/** Result of analysing one dataset, returned together with the context that produced it. */
@Value
public class DatasetAnalysis {
  AnalysisContext context;
  List<ColumnAnalysisResult> columnsAnalysis;
  DatasetSummary summary;
}
