package com.bankingconcepts.classifier.service.profiling;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.bankingconcepts.classifier.dto.profile.ColumnPatterns;
import com.bankingconcepts.classifier.dto.profile.ColumnProfile;
import com.bankingconcepts.classifier.dto.profile.DataType;
import com.bankingconcepts.classifier.service.Rounding;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Computes the structural and statistical profile of one column. Cells that cannot be parsed for
 * a given sub-pattern only lower that pattern's ratio; profiling itself never fails on bad data.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ColumnProfilerService {

  static final int SAMPLE_SIZE = 100;
  static final double PATTERN_RATIO = 0.9;
  static final double LOW_CARDINALITY_PCT = 20.0;
  static final int MAX_DISTINCT_EXAMPLES = 10;
  static final double NEAR_FIXED_MAX_STD_DEV = 1.0;

  private static final Pattern ALPHANUMERIC = Pattern.compile("^[A-Za-z0-9]+$");
  private static final Pattern DIGITS = Pattern.compile("^[0-9]+$");
  private static final Pattern KEYWORD_SEPARATOR =
      Pattern.compile("[_\\-\\s]+|(?<=[a-z0-9])(?=[A-Z])");

  private final DateFormatDetector dateFormatDetector;

  /**
   * Profiles a column.
   *
   * @param columnName the column header as supplied by the caller
   * @param values the column's cells in row order; nulls, numbers and text are accepted
   * @return the immutable profile
   */
  public ColumnProfile profile(String columnName, List<?> values) {
    List<?> cells = values != null ? values : Collections.emptyList();
    int total = cells.size();

    int nullCount = 0;
    int emptyCount = 0;
    List<String> present = new ArrayList<>();
    for (Object cell : cells) {
      String text = render(cell);
      if (text == null) {
        nullCount++;
      } else if (text.isBlank()) {
        emptyCount++;
      } else {
        present.add(text.trim());
      }
    }

    Set<String> distinct = new LinkedHashSet<>(present);
    double uniquenessPct = Rounding.percentage(distinct.size(), total);
    List<String> sample = present.subList(0, Math.min(SAMPLE_SIZE, present.size()));
    List<BigDecimal> numbers = parseNumbers(present);
    DataType dataType = detectDataType(sample, numbers);

    ColumnPatterns patterns =
        present.isEmpty()
            ? ColumnPatterns.EMPTY
            : detectPatterns(present, sample, distinct, numbers, dataType, uniquenessPct);

    ColumnProfile profile =
        ColumnProfile.builder()
            .columnName(columnName)
            .keywords(extractKeywords(columnName))
            .dataType(dataType)
            .totalRecords(total)
            .nonNullCount(total - nullCount)
            .nullCount(nullCount)
            .nullPercentage(Rounding.percentage(nullCount, total))
            .emptyCount(emptyCount)
            .emptyPercentage(Rounding.percentage(emptyCount, total))
            .uniqueCount(distinct.size())
            .uniquenessPercentage(uniquenessPct)
            .patterns(patterns)
            .build();

    log.debug(
        "Profiled column '{}': type={}, rows={}, null%={}, unique%={}",
        columnName,
        dataType,
        total,
        profile.getNullPercentage(),
        uniquenessPct);
    return profile;
  }

  /** Splits a column name on separators and camelCase boundaries. */
  public List<String> extractKeywords(String columnName) {
    if (columnName == null || columnName.isBlank()) {
      return List.of();
    }
    return Arrays.stream(KEYWORD_SEPARATOR.split(columnName.trim()))
        .filter(part -> !part.isEmpty())
        .map(part -> part.toLowerCase(Locale.ROOT))
        .collect(Collectors.toList());
  }

  private DataType detectDataType(List<String> sample, List<BigDecimal> numbers) {
    if (sample.isEmpty()) {
      return DataType.TEXT;
    }
    long dates = sample.stream().filter(dateFormatDetector::isDate).count();
    if (meetsRatio(dates, sample.size())) {
      return DataType.DATE;
    }
    long parseable = sample.stream().filter(value -> parseNumber(value) != null).count();
    if (meetsRatio(parseable, sample.size())) {
      boolean integral = numbers.stream().allMatch(ColumnProfilerService::isIntegral);
      return integral ? DataType.NUMERIC : DataType.DECIMAL;
    }
    long alphanumeric = sample.stream().filter(v -> ALPHANUMERIC.matcher(v).matches()).count();
    if (meetsRatio(alphanumeric, sample.size())) {
      return DataType.ALPHANUMERIC;
    }
    return DataType.TEXT;
  }

  private ColumnPatterns detectPatterns(
      List<String> present,
      List<String> sample,
      Set<String> distinct,
      List<BigDecimal> numbers,
      DataType dataType,
      double uniquenessPct) {
    ColumnPatterns.ColumnPatternsBuilder builder = ColumnPatterns.builder();

    long digits = sample.stream().filter(v -> DIGITS.matcher(v).matches()).count();
    long alphanumeric = sample.stream().filter(v -> ALPHANUMERIC.matcher(v).matches()).count();
    builder.onlyDigits(meetsRatio(digits, sample.size()));
    builder.alphanumeric(meetsRatio(alphanumeric, sample.size()));

    if (dataType.isTextLike()) {
      applyLengthPatterns(builder, present, sample);
    }

    if (uniquenessPct < LOW_CARDINALITY_PCT) {
      builder.lowCardinality(true);
      builder.distinctValues(
          distinct.stream().limit(MAX_DISTINCT_EXAMPLES).collect(Collectors.toList()));
    } else {
      builder.lowCardinality(false);
    }

    if (dataType == DataType.DATE) {
      builder.dateFormat(
          sample.stream()
              .map(dateFormatDetector::detectFormat)
              .filter(format -> format != null)
              .findFirst()
              .orElse("Unknown"));
    }

    if (dataType.isNumber() && !numbers.isEmpty()) {
      applyNumericPatterns(builder, numbers);
    }
    return builder.build();
  }

  private void applyLengthPatterns(
      ColumnPatterns.ColumnPatternsBuilder builder, List<String> present, List<String> sample) {
    int[] lengths = present.stream().mapToInt(String::length).toArray();
    double mean = Arrays.stream(lengths).average().orElse(0);
    builder.minLength(Arrays.stream(lengths).min().orElse(0));
    builder.maxLength(Arrays.stream(lengths).max().orElse(0));
    builder.avgLength(Rounding.round(mean, 2));
    builder.lengthStdDev(Rounding.round(standardDeviation(lengths, mean), 2));

    int[] sampleLengths = sample.stream().mapToInt(String::length).toArray();
    long lengthCardinality = Arrays.stream(sampleLengths).distinct().count();
    if (lengthCardinality == 1) {
      builder.fixedLength(true).fixedLengthValue(sampleLengths[0]).nearFixedLength(false);
      return;
    }
    builder.fixedLength(false);
    double sampleMean = Arrays.stream(sampleLengths).average().orElse(0);
    if (standardDeviation(sampleLengths, sampleMean) < NEAR_FIXED_MAX_STD_DEV) {
      builder.nearFixedLength(true).typicalLength(mostFrequent(sampleLengths));
    } else {
      builder.nearFixedLength(false);
    }
  }

  private void applyNumericPatterns(
      ColumnPatterns.ColumnPatternsBuilder builder, List<BigDecimal> numbers) {
    List<BigDecimal> sorted = new ArrayList<>(numbers);
    Collections.sort(sorted);
    double sum = 0;
    for (BigDecimal number : sorted) {
      sum += number.doubleValue();
    }
    int size = sorted.size();
    double median =
        size % 2 == 1
            ? sorted.get(size / 2).doubleValue()
            : (sorted.get(size / 2 - 1).doubleValue() + sorted.get(size / 2).doubleValue()) / 2;

    builder
        .minValue(sorted.get(0).doubleValue())
        .maxValue(sorted.get(size - 1).doubleValue())
        .meanValue(Rounding.round(sum / size, 2))
        .medianValue(median)
        .hasNegative(sorted.get(0).signum() < 0)
        .hasZero(sorted.stream().anyMatch(n -> n.signum() == 0))
        .hasPositive(sorted.get(size - 1).signum() > 0);
  }

  private List<BigDecimal> parseNumbers(List<String> present) {
    List<BigDecimal> numbers = new ArrayList<>();
    for (String value : present) {
      BigDecimal number = parseNumber(value);
      if (number != null) {
        numbers.add(number);
      }
    }
    return numbers;
  }

  private static BigDecimal parseNumber(String value) {
    try {
      return new BigDecimal(value);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static boolean isIntegral(BigDecimal number) {
    return number.signum() == 0 || number.stripTrailingZeros().scale() <= 0;
  }

  private static boolean meetsRatio(long matching, int size) {
    return size > 0 && (double) matching / size >= PATTERN_RATIO;
  }

  private static double standardDeviation(int[] values, double mean) {
    if (values.length == 0) {
      return 0;
    }
    double squares = 0;
    for (int value : values) {
      squares += (value - mean) * (value - mean);
    }
    return Math.sqrt(squares / values.length);
  }

  private static int mostFrequent(int[] values) {
    Map<Integer, Integer> counts = new HashMap<>();
    int best = values[0];
    int bestCount = 0;
    for (int value : values) {
      int count = counts.merge(value, 1, Integer::sum);
      if (count > bestCount) {
        best = value;
        bestCount = count;
      }
    }
    return best;
  }

  /** Null and NaN cells are missing; numbers are rendered without exponent notation. */
  private static String render(Object cell) {
    if (cell == null) {
      return null;
    }
    if (cell instanceof Double || cell instanceof Float) {
      double d = ((Number) cell).doubleValue();
      if (Double.isNaN(d)) {
        return null;
      }
      if (Double.isInfinite(d)) {
        return String.valueOf(d);
      }
      return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
    if (cell instanceof BigDecimal) {
      return ((BigDecimal) cell).toPlainString();
    }
    return cell.toString();
  }
}
