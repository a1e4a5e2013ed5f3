package com.ospicorp.seoanalytics.stats;

import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Ordinary least squares fit of a series against its index (x = 0..n-1).
 *
 * @param sxx sum of squared index deviations, the denominator of the slope
 * @param stdError square root of the residual mean square (ss_res / (n - 2)); 0 when n <= 2
 */
public record LinearFit(
    int n,
    double slope,
    double intercept,
    double xMean,
    double sxx,
    double rSquared,
    double stdError
) {

  private static final double Z_95 = 1.96d;

  public static LinearFit of(double[] values) {
    int n = values.length;
    if (n < 2) {
      throw new IllegalArgumentException("a linear fit needs at least 2 points, got " + n);
    }
    SimpleRegression regression = new SimpleRegression();
    for (int i = 0; i < n; i++) {
      regression.addData(i, values[i]);
    }
    // getRSquare is NaN for a constant series
    double rSquared = regression.getTotalSumSquares() == 0d ? 0d : regression.getRSquare();
    double mse = n > 2 ? regression.getMeanSquareError() : 0d;
    return new LinearFit(n, regression.getSlope(), regression.getIntercept(), (n - 1) / 2d,
        regression.getXSumSquares(), rSquared, Math.sqrt(mse));
  }

  public double predict(double x) {
    return slope * x + intercept;
  }

  /** Half-width of the 95% prediction interval at index {@code x}. */
  public double margin(double x) {
    double dx = x - xMean;
    return Z_95 * stdError * Math.sqrt(1d + 1d / n + (dx * dx) / sxx);
  }
}
