package com.bankingconcepts.classifier.service.profiling;

import java.util.Locale;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.cobber.fta.dates.DateTimeParser;
import com.cobber.fta.dates.DateTimeParser.DateResolutionMode;

import lombok.extern.slf4j.Slf4j;

/**
 * Recognises date and date-time values with FTA's {@link DateTimeParser}. Plain numbers are never
 * treated as dates so that numeric identifiers such as account numbers stay numeric.
 */
@Slf4j
@Component
public class DateFormatDetector {

  private static final Pattern PLAIN_NUMBER = Pattern.compile("^[+-]?\\d+(\\.\\d+)?$");

  /**
   * Determines the date format of a single value.
   *
   * @param value the raw cell text
   * @return the java.time style format string, or null when the value is not a date
   */
  public String detectFormat(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    if (trimmed.length() < 6 || PLAIN_NUMBER.matcher(trimmed).matches()) {
      return null;
    }
    try {
      DateTimeParser parser =
          new DateTimeParser()
              .withDateResolutionMode(DateResolutionMode.Auto)
              .withLocale(Locale.US);
      return parser.determineFormatString(trimmed);
    } catch (RuntimeException e) {
      log.trace("Value '{}' could not be parsed as a date: {}", trimmed, e.getMessage());
      return null;
    }
  }

  public boolean isDate(String value) {
    return detectFormat(value) != null;
  }
}
