package com.ospicorp.seoanalytics.stats;

import com.ospicorp.seoanalytics.model.TrendDirection;
import com.ospicorp.seoanalytics.model.Volatility;

public final class TrendClassifier {

  private static final double SIGNIFICANCE = 0.01d;
  private static final double ZERO_MEAN_THRESHOLD = 0.01d;

  private TrendClassifier() {
  }

  /**
   * Sign of the fitted slope, counted only when |slope| exceeds 1% of |mean| (or 0.01 when the
   * mean is 0).
   */
  public static TrendDirection direction(double[] values) {
    if (values.length < 2) {
      return TrendDirection.INSUFFICIENT_DATA;
    }
    LinearFit fit = LinearFit.of(values);
    double mean = Statistics.mean(values);
    double threshold = mean != 0d ? SIGNIFICANCE * Math.abs(mean) : ZERO_MEAN_THRESHOLD;
    if (fit.slope() > threshold) {
      return TrendDirection.UP;
    }
    if (fit.slope() < -threshold) {
      return TrendDirection.DOWN;
    }
    return TrendDirection.FLAT;
  }

  public static Volatility volatility(double[] values) {
    if (values.length < 2) {
      return Volatility.UNKNOWN;
    }
    double mean = Statistics.mean(values);
    if (mean == 0d) {
      return Volatility.UNKNOWN;
    }
    double cv = Statistics.sampleStdDev(values) / Math.abs(mean) * 100d;
    return Volatility.fromCoefficientOfVariation(cv);
  }
}
