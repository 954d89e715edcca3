package com.bankingconcepts.classifier.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Rounding {

  private Rounding() {}

  public static double round(double value, int places) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return value;
    }
    return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
  }

  /** Percentage of {@code part} in {@code total}, two decimals, zero when total is zero. */
  public static double percentage(long part, long total) {
    if (total <= 0) {
      return 0.0;
    }
    return round(part * 100.0 / total, 2);
  }
}
