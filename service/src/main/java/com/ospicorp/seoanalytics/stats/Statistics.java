package com.ospicorp.seoanalytics.stats;

import java.util.Collection;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

public final class Statistics {
  private Statistics() {
  }

  public static double mean(double[] values) {
    if (values.length == 0) {
      throw new IllegalArgumentException("mean of an empty series");
    }
    return StatUtils.mean(values);
  }

  public static double mean(Collection<? extends Number> values) {
    return mean(values.stream().mapToDouble(Number::doubleValue).toArray());
  }

  /** Standard deviation with the n-1 denominator; 0 for fewer than two values. */
  public static double sampleStdDev(double[] values) {
    if (values.length < 2) {
      return 0d;
    }
    return new StandardDeviation(true).evaluate(values);
  }

  /** Standard deviation with the n denominator; 0 for an empty series. */
  public static double populationStdDev(double[] values) {
    if (values.length == 0) {
      return 0d;
    }
    return new StandardDeviation(false).evaluate(values);
  }

  /** Percent change from {@code base} to {@code value}, or 0 when the base is 0. */
  public static double percentChange(double value, double base) {
    return base == 0d ? 0d : (value - base) / base * 100d;
  }

  public static double round(double value, int places) {
    double scale = Math.pow(10, places);
    return Math.round(value * scale) / scale;
  }
}
