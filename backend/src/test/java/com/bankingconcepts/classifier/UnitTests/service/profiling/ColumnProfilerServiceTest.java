package com.bankingconcepts.classifier.service.profiling;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.bankingconcepts.classifier.dto.profile.ColumnPatterns;
import com.bankingconcepts.classifier.dto.profile.ColumnProfile;
import com.bankingconcepts.classifier.dto.profile.DataType;
import com.bankingconcepts.classifier.fixtures.TestFixtures;

@DisplayName("ColumnProfilerService Tests")
class ColumnProfilerServiceTest {

  private ColumnProfilerService profiler;

  @BeforeEach
  void setUp() {
    profiler = new ColumnProfilerService(new DateFormatDetector());
  }

  @Nested
  @DisplayName("Counts and percentages")
  class Counts {

    @Test
    @DisplayName("Should separate null, blank and present cells")
    void shouldSeparateNullBlankAndPresentCells() {
      ColumnProfile profile = profiler.profile("code", Arrays.asList(null, "", "  ", "A1"));

      assertThat(profile.getTotalRecords()).isEqualTo(4);
      assertThat(profile.getNullCount()).isEqualTo(1);
      assertThat(profile.getEmptyCount()).isEqualTo(2);
      assertThat(profile.getNonNullCount()).isEqualTo(3);
      assertThat(profile.getNullPercentage()).isEqualTo(25.0);
      assertThat(profile.getEmptyPercentage()).isEqualTo(50.0);
      assertThat(profile.getUniqueCount()).isEqualTo(1);
      assertThat(profile.getUniquenessPercentage()).isEqualTo(25.0);
    }

    @Test
    @DisplayName("Should round percentages to two decimals")
    void shouldRoundPercentagesToTwoDecimals() {
      ColumnProfile profile = profiler.profile("flag", Arrays.asList("Y", null, null));

      assertThat(profile.getNullPercentage()).isEqualTo(66.67);
      assertThat(profile.getUniquenessPercentage()).isEqualTo(33.33);
    }

    @Test
    @DisplayName("Should report zeros for a column without rows")
    void shouldReportZerosForEmptyColumn() {
      ColumnProfile profile = profiler.profile("anything", List.of());

      assertThat(profile.getTotalRecords()).isZero();
      assertThat(profile.getNullPercentage()).isZero();
      assertThat(profile.getUniquenessPercentage()).isZero();
      assertThat(profile.getDataType()).isEqualTo(DataType.TEXT);
      assertThat(profile.hasObservedValues()).isFalse();
    }

    @Test
    @DisplayName("Should profile an all-null column as text without patterns")
    void shouldProfileAllNullColumn() {
      ColumnProfile profile = profiler.profile("legacy_flag", TestFixtures.nulls(100));

      assertThat(profile.getNullPercentage()).isEqualTo(100.0);
      assertThat(profile.getUniquenessPercentage()).isZero();
      assertThat(profile.getDataType()).isEqualTo(DataType.TEXT);
      assertThat(profile.getPatterns()).isSameAs(ColumnPatterns.EMPTY);
      assertThat(profile.hasObservedValues()).isFalse();
    }
  }

  @Nested
  @DisplayName("Data type detection")
  class DataTypeDetection {

    @Test
    @DisplayName("Should detect digit-only account numbers as numeric, never as dates")
    void shouldDetectAccountNumbersAsNumeric() {
      ColumnProfile profile = profiler.profile("account_number", TestFixtures.accountNumbers(100));

      assertThat(profile.getDataType()).isEqualTo(DataType.NUMERIC);
      assertThat(profile.getUniquenessPercentage()).isEqualTo(100.0);
      assertThat(profile.getPatterns().getOnlyDigits()).isTrue();
      assertThat(profile.getPatterns().getDateFormat()).isNull();
    }

    @Test
    @DisplayName("Should detect decimal amounts")
    void shouldDetectDecimalAmounts() {
      ColumnProfile profile =
          profiler.profile("amount", Arrays.asList("10.50", "20.25", "-3.75", "0.00"));

      assertThat(profile.getDataType()).isEqualTo(DataType.DECIMAL);
      ColumnPatterns patterns = profile.getPatterns();
      assertThat(patterns.getMinValue()).isEqualTo(-3.75);
      assertThat(patterns.getMaxValue()).isEqualTo(20.25);
      assertThat(patterns.getMeanValue()).isEqualTo(6.75);
      assertThat(patterns.getMedianValue()).isEqualTo(5.25);
      assertThat(patterns.getHasNegative()).isTrue();
      assertThat(patterns.getHasZero()).isTrue();
      assertThat(patterns.getHasPositive()).isTrue();
    }

    @Test
    @DisplayName("Should treat native whole doubles as integral numbers")
    void shouldTreatWholeDoublesAsNumeric() {
      ColumnProfile profile = profiler.profile("count", Arrays.asList(100.0, 250.0, 5, 7L));

      assertThat(profile.getDataType()).isEqualTo(DataType.NUMERIC);
      assertThat(profile.getPatterns().getOnlyDigits()).isTrue();
      assertThat(profile.getPatterns().getMaxValue()).isEqualTo(250.0);
    }

    @Test
    @DisplayName("Should treat NaN cells as missing")
    void shouldTreatNaNAsMissing() {
      ColumnProfile profile = profiler.profile("rate", Arrays.asList(Double.NaN, 7.5, 8.25));

      assertThat(profile.getNullCount()).isEqualTo(1);
      assertThat(profile.getDataType()).isEqualTo(DataType.DECIMAL);
    }

    @Test
    @DisplayName("Should detect ISO dates and record their format")
    void shouldDetectIsoDates() {
      List<Object> dates = new ArrayList<>();
      for (int day = 1; day <= 28; day++) {
        dates.add(String.format("2024-01-%02d", day));
      }

      ColumnProfile profile = profiler.profile("transaction_date", dates);

      assertThat(profile.getDataType()).isEqualTo(DataType.DATE);
      assertThat(profile.getPatterns().getDateFormat()).isEqualTo("yyyy-MM-dd");
      assertThat(profile.getPatterns().getMinLength()).isNull();
    }

    @Test
    @DisplayName("Should detect alphanumeric codes with a fixed length")
    void shouldDetectFixedLengthAlphanumericCodes() {
      ColumnProfile profile =
          profiler.profile(
              "pan", Arrays.asList("ABCDP1234F", "BQRPS5678K", "CZXPT9012L", "DKLPM3456Q"));

      assertThat(profile.getDataType()).isEqualTo(DataType.ALPHANUMERIC);
      ColumnPatterns patterns = profile.getPatterns();
      assertThat(patterns.getAlphanumeric()).isTrue();
      assertThat(patterns.getOnlyDigits()).isFalse();
      assertThat(patterns.isFixed()).isTrue();
      assertThat(patterns.getFixedLengthValue()).isEqualTo(10);
      assertThat(patterns.getAvgLength()).isEqualTo(10.0);
      assertThat(patterns.getLengthStdDev()).isZero();
    }

    @Test
    @DisplayName("Should fall back to text for free-form values")
    void shouldFallBackToText() {
      ColumnProfile profile = profiler.profile("customer_name", TestFixtures.customerNames(50, 40));

      assertThat(profile.getDataType()).isEqualTo(DataType.TEXT);
      assertThat(profile.getPatterns().getAlphanumeric()).isFalse();
      assertThat(profile.getPatterns().getMinLength()).isPositive();
    }
  }

  @Nested
  @DisplayName("Length and cardinality patterns")
  class LengthAndCardinality {

    @Test
    @DisplayName("Should flag near-fixed length with the most frequent length")
    void shouldFlagNearFixedLength() {
      List<Object> values = new ArrayList<>();
      for (int i = 0; i < 18; i++) {
        values.add("BR" + (char) ('A' + i) + "01");
      }
      values.add("BRX001");
      values.add("BRY001");

      ColumnPatterns patterns = profiler.profile("branch_code", values).getPatterns();

      assertThat(patterns.isFixed()).isFalse();
      assertThat(patterns.isNearFixed()).isTrue();
      assertThat(patterns.getTypicalLength()).isEqualTo(5);
      assertThat(patterns.getMinLength()).isEqualTo(5);
      assertThat(patterns.getMaxLength()).isEqualTo(6);
    }

    @Test
    @DisplayName("Should not flag widely varying lengths")
    void shouldNotFlagVaryingLengths() {
      ColumnPatterns patterns =
          profiler
              .profile("remarks", Arrays.asList("ok", "needs review", "x", "pending approval"))
              .getPatterns();

      assertThat(patterns.isFixed()).isFalse();
      assertThat(patterns.isNearFixed()).isFalse();
      assertThat(patterns.getTypicalLength()).isNull();
    }

    @Test
    @DisplayName("Should capture distinct values of a low-cardinality column in first-seen order")
    void shouldCaptureLowCardinalityValues() {
      ColumnPatterns patterns =
          profiler
              .profile(
                  "account_status", TestFixtures.repeating(100, "Active", "Dormant", "Closed"))
              .getPatterns();

      assertThat(patterns.getLowCardinality()).isTrue();
      assertThat(patterns.getDistinctValues()).containsExactly("Active", "Dormant", "Closed");
    }

    @Test
    @DisplayName("Should cap captured distinct values at ten")
    void shouldCapDistinctValues() {
      List<Object> values = new ArrayList<>();
      for (int i = 0; i < 200; i++) {
        values.add("S" + (char) ('A' + (i % 15)));
      }

      ColumnPatterns patterns = profiler.profile("segment", values).getPatterns();

      assertThat(patterns.getLowCardinality()).isTrue();
      assertThat(patterns.getDistinctValues()).hasSize(ColumnProfilerService.MAX_DISTINCT_EXAMPLES);
    }

    @Test
    @DisplayName("Should not compute length statistics for numeric columns")
    void shouldSkipLengthStatisticsForNumbers() {
      ColumnPatterns patterns =
          profiler.profile("account_number", TestFixtures.accountNumbers(20)).getPatterns();

      assertThat(patterns.getMinLength()).isNull();
      assertThat(patterns.getFixedLength()).isNull();
    }
  }

  @Nested
  @DisplayName("Keyword extraction")
  class Keywords {

    @Test
    @DisplayName("Should split on separators and camel case")
    void shouldSplitColumnNames() {
      assertThat(profiler.extractKeywords("customerAccountNumber"))
          .containsExactly("customer", "account", "number");
      assertThat(profiler.extractKeywords("Account-Type code"))
          .containsExactly("account", "type", "code");
      assertThat(profiler.extractKeywords("txn_id")).containsExactly("txn", "id");
    }

    @Test
    @DisplayName("Should return no keywords for a blank name")
    void shouldHandleBlankName() {
      assertThat(profiler.extractKeywords("  ")).isEmpty();
      assertThat(profiler.extractKeywords(null)).isEmpty();
    }
  }
}
