package com.bankingconcepts.classifier.dto.concept;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

/** Best registry entry for a column, or the unknown outcome. */
@Value
@Builder
public class ConceptMatch {

  public static final String UNKNOWN_KEY = "unknown";
  public static final String UNKNOWN_LABEL = "Unknown Banking Concept";

  @JsonProperty("concept_key")
  String conceptKey;

  @JsonProperty("display_label")
  String displayLabel;

  @JsonProperty("domain")
  BankingDomain domain;

  @JsonProperty("match_score")
  double matchScore;

  @JsonIgnore ConceptDefinition definition;

  public static ConceptMatch unknown() {
    return ConceptMatch.builder()
        .conceptKey(UNKNOWN_KEY)
        .displayLabel(UNKNOWN_LABEL)
        .domain(BankingDomain.GENERAL)
        .matchScore(0)
        .build();
  }

  public static ConceptMatch of(ConceptDefinition definition, double score) {
    return ConceptMatch.builder()
        .conceptKey(definition.getConceptKey())
        .displayLabel(definition.getDisplayLabel())
        .domain(definition.getDomain())
        .matchScore(score)
        .definition(definition)
        .build();
  }

  @JsonIgnore
  public boolean isUnknown() {
    return definition == null || UNKNOWN_KEY.equals(conceptKey);
  }

  @JsonIgnore
  public boolean isIdentifierConcept() {
    return definition != null && definition.isIdentifier();
  }
}
