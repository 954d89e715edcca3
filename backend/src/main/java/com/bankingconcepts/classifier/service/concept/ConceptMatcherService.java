package com.bankingconcepts.classifier.service.concept;

import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.bankingconcepts.classifier.dto.concept.CardinalityConstraint;
import com.bankingconcepts.classifier.dto.concept.ConceptDefinition;
import com.bankingconcepts.classifier.dto.concept.ConceptMatch;
import com.bankingconcepts.classifier.dto.concept.DataPatterns;
import com.bankingconcepts.classifier.dto.concept.LengthConstraint;
import com.bankingconcepts.classifier.dto.profile.ColumnPatterns;
import com.bankingconcepts.classifier.dto.profile.ColumnProfile;
import com.bankingconcepts.classifier.dto.profile.DataType;
import com.bankingconcepts.classifier.dto.profile.IdentifierEligibility;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Scores every registry concept against a column and keeps the best one. Raw scores are left
 * unclamped here; only the confidence scorer clamps.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConceptMatcherService {

  static final double MIN_MATCH_SCORE = 25.0;
  static final double INELIGIBLE_IDENTIFIER_FACTOR = 0.3;

  static final double EXACT_NAME_SCORE = 50;
  static final double PARTIAL_NAME_SCORE = 40;
  static final double TYPE_SCORE = 20;
  static final double COMPATIBLE_TYPE_SCORE = 15;

  private final ConceptRegistryService conceptRegistry;

  /**
   * Finds the best concept for a column.
   *
   * @param columnName the raw column name
   * @param profile the column's profile
   * @param eligibility the column's identifier eligibility
   * @return the best match, or {@link ConceptMatch#unknown()} when nothing reaches the threshold
   */
  public ConceptMatch match(
      String columnName, ColumnProfile profile, IdentifierEligibility eligibility) {
    if (!profile.hasObservedValues()) {
      log.debug("Column '{}' has no observed values; classified as unknown", columnName);
      return ConceptMatch.unknown();
    }

    String normalized = IdentifierEligibilityService.normalizeName(columnName);
    ConceptDefinition best = null;
    double bestScore = 0;
    for (ConceptDefinition definition : conceptRegistry.getDefinitions()) {
      double score = score(definition, normalized, profile, eligibility);
      if (score > bestScore) {
        best = definition;
        bestScore = score;
      }
    }

    if (best == null || bestScore < MIN_MATCH_SCORE) {
      log.debug(
          "Column '{}' best score {} is below {}; classified as unknown",
          columnName,
          bestScore,
          MIN_MATCH_SCORE);
      return ConceptMatch.unknown();
    }
    log.debug(
        "Column '{}' matched '{}' with score {}", columnName, best.getConceptKey(), bestScore);
    return ConceptMatch.of(best, bestScore);
  }

  /** Raw score of one definition for one column, after the identifier gate. */
  double score(
      ConceptDefinition definition,
      String normalizedName,
      ColumnProfile profile,
      IdentifierEligibility eligibility) {
    DataPatterns expected = definition.getDataPatterns();
    ColumnPatterns patterns =
        profile.getPatterns() != null ? profile.getPatterns() : ColumnPatterns.EMPTY;

    double score = nameScore(definition.getNamePatterns(), normalizedName);
    score += typeScore(expected.getTypes(), profile.getDataType());
    score += uniquenessScore(expected, profile.getUniquenessPercentage());
    score += lengthScore(expected.getLength(), patterns);
    score += cardinalityScore(expected.getCardinality(), profile.getUniqueCount());
    score += nullabilityScore(expected.isNullable(), profile.getNullPercentage());
    if (definition.isIdentifier() && (patterns.isFixed() || patterns.isNearFixed())) {
      score += 5;
    }

    if (definition.isIdentifier()) {
      if (eligibility.isBarredFromIdentifiers()) {
        return 0;
      }
      if (!eligibility.isEligible()) {
        score *= INELIGIBLE_IDENTIFIER_FACTOR;
      }
    }
    return score;
  }

  /**
   * Exact equality with any pattern beats containment; containment keeps pattern order. This is
   * deliberate: a column named {@code status} scores the exact 50 against a concept listing
   * {@code account_status} before {@code status}, instead of the partial 40.
   */
  double nameScore(List<String> namePatterns, String normalizedName) {
    if (namePatterns == null || normalizedName.isEmpty()) {
      return 0;
    }
    for (String pattern : namePatterns) {
      if (normalizedName.equals(pattern)) {
        return EXACT_NAME_SCORE;
      }
    }
    for (String pattern : namePatterns) {
      if (normalizedName.contains(pattern) || pattern.contains(normalizedName)) {
        return PARTIAL_NAME_SCORE;
      }
    }
    return 0;
  }

  double typeScore(Set<DataType> expectedTypes, DataType actual) {
    if (expectedTypes == null || actual == null) {
      return 0;
    }
    if (expectedTypes.contains(actual)) {
      return TYPE_SCORE;
    }
    for (DataType expected : expectedTypes) {
      if (expected.isCompatibleWith(actual)) {
        return COMPATIBLE_TYPE_SCORE;
      }
    }
    return 0;
  }

  double uniquenessScore(DataPatterns expected, double uniquenessPct) {
    if (expected.getUniqueness() == null) {
      return 0;
    }
    switch (expected.getUniqueness()) {
      case VERY_HIGH:
        if (uniquenessPct >= 99.5) {
          return 25;
        }
        return uniquenessPct >= 99 ? 20 : 0;
      case HIGH:
        return uniquenessPct >= 95 ? 15 : 0;
      case LOW:
        return uniquenessPct < 50 ? 15 : 0;
      case VERY_LOW:
        return uniquenessPct < 20 ? 15 : 0;
      default:
        return 0;
    }
  }

  double lengthScore(LengthConstraint length, ColumnPatterns patterns) {
    if (length == null) {
      return 0;
    }
    if (length.hasExactLength()) {
      int exact = length.getExact();
      if (patterns.isFixed() && patterns.getFixedLengthValue() != null
          && patterns.getFixedLengthValue() == exact) {
        return 15;
      }
      if (patterns.getAvgLength() != null && Math.abs(patterns.getAvgLength() - exact) <= 2) {
        return 10;
      }
      return 0;
    }
    if (length.hasLengthRange() && patterns.getAvgLength() != null) {
      double avg = patterns.getAvgLength();
      if (avg < length.getMin() || avg > length.getMax()) {
        return 0;
      }
      double score = 10;
      if (patterns.getMinLength() != null
          && patterns.getMaxLength() != null
          && patterns.getMinLength() >= length.getMin()
          && patterns.getMaxLength() <= length.getMax()) {
        score += 5;
      }
      return score;
    }
    return 0;
  }

  double cardinalityScore(CardinalityConstraint cardinality, int distinctCount) {
    if (cardinality == null) {
      return 0;
    }
    if (distinctCount <= cardinality.getMax()) {
      return 10;
    }
    return distinctCount <= cardinality.getMax() * 1.5 ? 5 : 0;
  }

  double nullabilityScore(boolean nullable, double nullPercentage) {
    if (nullable) {
      return nullPercentage > 0 ? 5 : 0;
    }
    if (nullPercentage == 0) {
      return 10;
    }
    return nullPercentage < 5 ? 3 : 0;
  }
}
