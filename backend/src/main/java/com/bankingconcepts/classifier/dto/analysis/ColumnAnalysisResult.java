package com.bankingconcepts.classifier.dto.analysis;

import com.bankingconcepts.classifier.dto.concept.ConceptMatch;
import com.bankingconcepts.classifier.dto.profile.ColumnProfile;
import com.bankingconcepts.classifier.dto.profile.IdentifierEligibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnAnalysisResult {

  @JsonProperty("column_name")
  String columnName;

  @JsonProperty("profile")
  ColumnProfile profile;

  @JsonProperty("identifier_eligibility")
  IdentifierEligibility eligibility;

  @JsonProperty("concept_match")
  ConceptMatch match;

  @JsonProperty("confidence")
  double confidence;

  @JsonProperty("business_meaning")
  String businessMeaning;

  @JsonProperty("rules")
  BusinessRules rules;

  @JsonProperty("rules_display")
  String rulesDisplay;

  @JsonProperty("why_rule_exists")
  String whyRuleExists;

  @JsonProperty("violation_impact")
  String violationImpact;

  @JsonProperty("workflow_role")
  String workflowRole;

  @JsonProperty("description_section")
  String descriptionSection;
}
