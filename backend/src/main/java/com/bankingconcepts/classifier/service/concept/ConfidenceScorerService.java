package com.bankingconcepts.classifier.service.concept;

import org.springframework.stereotype.Service;

import com.bankingconcepts.classifier.dto.concept.ConceptMatch;
import com.bankingconcepts.classifier.dto.profile.ColumnPatterns;
import com.bankingconcepts.classifier.dto.profile.ColumnProfile;
import com.bankingconcepts.classifier.dto.profile.DataType;
import com.bankingconcepts.classifier.dto.profile.IdentifierEligibility;
import com.bankingconcepts.classifier.service.Rounding;

import lombok.extern.slf4j.Slf4j;

/** Turns a raw match score into a 0-100 confidence. */
@Slf4j
@Service
public class ConfidenceScorerService {

  static final double BORDERLINE_CONFIDENCE = 60;
  static final double BORDERLINE_FACTOR = 0.8;

  public double score(
      ConceptMatch match, ColumnProfile profile, IdentifierEligibility eligibility) {
    if (match.isUnknown()) {
      return 0.0;
    }
    ColumnPatterns patterns =
        profile.getPatterns() != null ? profile.getPatterns() : ColumnPatterns.EMPTY;

    double confidence = match.getMatchScore();
    if (profile.getNullPercentage() == 0) {
      confidence += 5;
    }
    if (profile.getUniquenessPercentage() > 99.5) {
      confidence += 8;
    } else if (profile.getUniquenessPercentage() > 99) {
      confidence += 5;
    }
    if (patterns.isFixed()) {
      confidence += 5;
    } else if (patterns.isNearFixed()) {
      confidence += 3;
    }
    if (patterns.isDigitsOnly()
        && (profile.getDataType() == DataType.NUMERIC
            || profile.getDataType() == DataType.ALPHANUMERIC)) {
      confidence += 3;
    }
    if (eligibility.isEligible() && match.isIdentifierConcept()) {
      confidence += 10;
    }

    if (match.isIdentifierConcept() && eligibility.isBarredFromIdentifiers()) {
      log.debug(
          "Identifier concept '{}' rejected for contact/descriptive column '{}'",
          match.getConceptKey(),
          profile.getColumnName());
      confidence = 0;
    }
    if (confidence < BORDERLINE_CONFIDENCE && eligibility.isEligible()) {
      confidence *= BORDERLINE_FACTOR;
    }
    return Rounding.round(Math.max(0, Math.min(100, confidence)), 1);
  }
}
