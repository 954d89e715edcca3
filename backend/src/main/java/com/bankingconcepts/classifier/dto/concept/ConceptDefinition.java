package com.bankingconcepts.classifier.dto.concept;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** One row of the concept registry. */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConceptDefinition {

  @JsonProperty("concept_key")
  String conceptKey;

  @JsonProperty("domain")
  BankingDomain domain;

  @JsonProperty("name_patterns")
  List<String> namePatterns;

  @JsonProperty("data_patterns")
  DataPatterns dataPatterns;

  @JsonProperty("is_identifier")
  boolean identifier;

  @JsonProperty("business_rules")
  BusinessRuleTemplate businessRules;

  /** Bespoke workflow role. Concepts without one fall back to their domain's role. */
  @JsonProperty("workflow_role")
  String workflowRole;

  @JsonIgnore
  public String getDisplayLabel() {
    StringBuilder label = new StringBuilder(domain.getDisplayName()).append(" - ");
    String[] words = conceptKey.split("_");
    for (int i = 0; i < words.length; i++) {
      if (words[i].isEmpty()) {
        continue;
      }
      if (i > 0) {
        label.append(' ');
      }
      label.append(Character.toUpperCase(words[i].charAt(0))).append(words[i].substring(1));
    }
    return label.toString();
  }

  @JsonIgnore
  public String resolveWorkflowRole() {
    return workflowRole != null && !workflowRole.isBlank()
        ? workflowRole
        : domain.getGenericWorkflowRole();
  }
}
