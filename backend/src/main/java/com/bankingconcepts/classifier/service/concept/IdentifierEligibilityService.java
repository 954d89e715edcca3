package com.bankingconcepts.classifier.service.concept;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

import org.springframework.stereotype.Service;

import com.bankingconcepts.classifier.dto.profile.ColumnPatterns;
import com.bankingconcepts.classifier.dto.profile.ColumnProfile;
import com.bankingconcepts.classifier.dto.profile.IdentifierEligibility;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether a column is structurally allowed to be a unique identifier. The checks form an
 * ordered rule table; the first rule that fails determines the reported reason.
 */
@Slf4j
@Service
public class IdentifierEligibilityService {

  static final double MIN_IDENTIFIER_UNIQUENESS = 95.0;
  static final String ELIGIBLE_REASON = "meets all identifier criteria";

  static final List<String> DESCRIPTIVE_KEYWORDS =
      List.of("name", "city", "description", "remarks", "note", "comment", "address", "street");
  static final List<String> CONTACT_KEYWORDS = List.of("phone", "mobile", "email", "contact");

  /** Facts a rule can inspect: the normalized column name and its profile. */
  @Value
  static class Candidate {
    String normalizedName;
    ColumnProfile profile;

    ColumnPatterns patterns() {
      return profile.getPatterns() != null ? profile.getPatterns() : ColumnPatterns.EMPTY;
    }
  }

  /** One eligibility check: the column passes when {@code passes} holds. */
  @Value
  static class EligibilityRule {
    String name;
    Predicate<Candidate> passes;
    Function<Candidate, String> reason;
  }

  private final List<EligibilityRule> rules =
      List.of(
          new EligibilityRule(
              "non-descriptive name",
              c -> findKeyword(c.getNormalizedName(), DESCRIPTIVE_KEYWORDS).isEmpty(),
              c ->
                  "descriptive name (contains '"
                      + findKeyword(c.getNormalizedName(), DESCRIPTIVE_KEYWORDS).orElse("")
                      + "')"),
          new EligibilityRule(
              "non-contact name",
              c -> findKeyword(c.getNormalizedName(), CONTACT_KEYWORDS).isEmpty(),
              c -> "contact field, never primary key"),
          new EligibilityRule(
              "high uniqueness",
              c -> c.getProfile().getUniquenessPercentage() >= MIN_IDENTIFIER_UNIQUENESS,
              c ->
                  String.format(
                      Locale.ROOT,
                      "uniqueness %.2f%% is below the %.0f%% identifier threshold",
                      c.getProfile().getUniquenessPercentage(),
                      MIN_IDENTIFIER_UNIQUENESS)),
          new EligibilityRule(
              "fixed length or strict pattern",
              c -> hasFixedLength(c.patterns()) || hasStrictPattern(c.patterns()),
              c -> "no fixed length or strict pattern"));

  /**
   * Evaluates identifier eligibility.
   *
   * @param columnName the raw column name
   * @param profile the column's profile
   * @return the eligibility verdict with the first failing reason
   */
  public IdentifierEligibility check(String columnName, ColumnProfile profile) {
    Candidate candidate = new Candidate(normalizeName(columnName), profile);
    ColumnPatterns patterns = candidate.patterns();

    String failure = null;
    for (EligibilityRule rule : rules) {
      if (!rule.getPasses().test(candidate)) {
        failure = rule.getReason().apply(candidate);
        log.debug(
            "Column '{}' fails identifier rule '{}': {}", columnName, rule.getName(), failure);
        break;
      }
    }

    return IdentifierEligibility.builder()
        .eligible(failure == null)
        .reason(failure == null ? ELIGIBLE_REASON : failure)
        .uniquenessPct(profile.getUniquenessPercentage())
        .fixedLength(hasFixedLength(patterns))
        .strictPattern(hasStrictPattern(patterns))
        .descriptive(findKeyword(candidate.getNormalizedName(), DESCRIPTIVE_KEYWORDS).isPresent())
        .contact(findKeyword(candidate.getNormalizedName(), CONTACT_KEYWORDS).isPresent())
        .build();
  }

  List<EligibilityRule> getRules() {
    return rules;
  }

  /** Lower case, trimmed, with spaces and hyphens folded into underscores. */
  public static String normalizeName(String columnName) {
    if (columnName == null) {
      return "";
    }
    return columnName.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
  }

  static Optional<String> findKeyword(String normalizedName, List<String> keywords) {
    return keywords.stream().filter(normalizedName::contains).findFirst();
  }

  private static boolean hasFixedLength(ColumnPatterns patterns) {
    return patterns.isFixed() || patterns.isNearFixed();
  }

  private static boolean hasStrictPattern(ColumnPatterns patterns) {
    return patterns.isDigitsOnly() || patterns.isStrictAlphanumeric();
  }
}
