package com.bankingconcepts.classifier.service.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.bankingconcepts.classifier.dto.analysis.BusinessRules;
import com.bankingconcepts.classifier.dto.concept.BankingDomain;
import com.bankingconcepts.classifier.dto.concept.BusinessRuleTemplate;
import com.bankingconcepts.classifier.dto.concept.ConceptDefinition;
import com.bankingconcepts.classifier.dto.concept.ConceptMatch;
import com.bankingconcepts.classifier.dto.description.ColumnDescription;
import com.bankingconcepts.classifier.dto.profile.ColumnProfile;
import com.bankingconcepts.classifier.dto.profile.IdentifierEligibility;

import lombok.Builder;
import lombok.Value;

/** Derives the business rules and their explanation from a column's matched concept. */
@Service
public class BusinessRuleDeriverService {

  static final int MAX_DISPLAYED_ALLOWED_VALUES = 5;

  static final String UNKNOWN_MEANING =
      "The column contains data relevant to banking operations. Exact business meaning requires"
          + " domain expert review.";
  static final String UNKNOWN_RULES_DISPLAY =
      "Business rules require domain expert review for this column.";
  static final String UNKNOWN_WHY =
      "Column purpose not clearly identified. Manual review by a domain expert is recommended.";
  static final String UNKNOWN_IMPACT =
      "Impact cannot be determined without proper identification.";
  static final String DEFAULT_WHY = "Standard banking business rule.";
  static final String DEFAULT_IMPACT = "Business, financial, and compliance risks.";

  /** Everything the deriver adds to a column result. */
  @Value
  @Builder
  public static class Derivation {
    String businessMeaning;
    BusinessRules rules;
    String rulesDisplay;
    String whyRuleExists;
    String violationImpact;
    String workflowRole;
    String descriptionSection;
  }

  /**
   * Derives rules for a column.
   *
   * @param match the column's concept match
   * @param profile the column's profile
   * @param eligibility the column's identifier eligibility; gates the primary key flag
   * @param description the documented description, if the lookup found one
   * @return the derived rules and explanation text
   */
  public Derivation derive(
      ConceptMatch match,
      ColumnProfile profile,
      IdentifierEligibility eligibility,
      Optional<ColumnDescription> description) {
    if (match.isUnknown()) {
      return deriveUnknown(profile, description);
    }

    ConceptDefinition definition = match.getDefinition();
    BusinessRuleTemplate template = definition.getBusinessRules();
    BusinessRules rules =
        BusinessRules.builder()
            .unique(template.isUnique())
            .mandatory(template.isMandatory())
            .primaryKey(template.isPrimaryKey() && eligibility.isEligible())
            .foreignKey(template.isForeignKey())
            .format(template.getFormat())
            .allowedValues(template.getAllowedValues())
            .build();

    String reason = notBlank(template.getReason()) ? template.getReason() : DEFAULT_WHY;
    StringBuilder meaning =
        new StringBuilder("This column represents ")
            .append(match.getDisplayLabel())
            .append(" in the banking system. ")
            .append(reason);
    description.ifPresent(d -> meaning.append(" Documented as: ").append(d.getDescription()));

    return Derivation.builder()
        .businessMeaning(meaning.toString())
        .rules(rules)
        .rulesDisplay(renderRules(rules))
        .whyRuleExists(reason)
        .violationImpact(
            notBlank(template.getViolationImpact())
                ? template.getViolationImpact()
                : DEFAULT_IMPACT)
        .workflowRole(definition.resolveWorkflowRole())
        .descriptionSection(description.map(ColumnDescription::getSection).orElse(null))
        .build();
  }

  private Derivation deriveUnknown(ColumnProfile profile, Optional<ColumnDescription> description) {
    String dataType = profile.getDataType() != null ? profile.getDataType().getCode() : "unknown";
    BusinessRules rules =
        BusinessRules.builder()
            .primaryKey(false)
            .foreignKey(false)
            .format("Based on data type: " + dataType)
            .build();
    return Derivation.builder()
        .businessMeaning(description.map(ColumnDescription::getDescription).orElse(UNKNOWN_MEANING))
        .rules(rules)
        .rulesDisplay(UNKNOWN_RULES_DISPLAY)
        .whyRuleExists(UNKNOWN_WHY)
        .violationImpact(UNKNOWN_IMPACT)
        .workflowRole(BankingDomain.GENERAL.getGenericWorkflowRole())
        .descriptionSection(description.map(ColumnDescription::getSection).orElse(null))
        .build();
  }

  String renderRules(BusinessRules rules) {
    List<String> lines = new ArrayList<>();
    if (Boolean.TRUE.equals(rules.getUnique())) {
      lines.add("- Must be UNIQUE");
    }
    if (Boolean.TRUE.equals(rules.getMandatory())) {
      lines.add("- MANDATORY (cannot be null)");
    }
    if (rules.isPrimaryKey()) {
      lines.add("- PRIMARY KEY");
    }
    if (rules.isForeignKey()) {
      lines.add("- FOREIGN KEY (references another table's identifier)");
    }
    if (notBlank(rules.getFormat())) {
      lines.add("- Format: " + rules.getFormat());
    }
    if (rules.getAllowedValues() != null && !rules.getAllowedValues().isEmpty()) {
      List<String> shown =
          rules
              .getAllowedValues()
              .subList(0, Math.min(MAX_DISPLAYED_ALLOWED_VALUES, rules.getAllowedValues().size()));
      lines.add("- Allowed values: " + String.join(", ", shown));
    }
    return lines.isEmpty() ? "Standard banking rules apply." : String.join("\n", lines);
  }

  private static boolean notBlank(String value) {
    return value != null && !value.isBlank();
  }
}
