package com.ospicorp.seoanalytics.stats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class LinearFitTest {

  @Test
  void exactLineHasUnitRSquaredAndNoMargin() {
    double[] values = new double[10];
    for (int x = 0; x < values.length; x++) {
      values[x] = 2 * x + 5;
    }

    LinearFit fit = LinearFit.of(values);

    assertThat(fit.slope()).isCloseTo(2d, within(1e-9));
    assertThat(fit.intercept()).isCloseTo(5d, within(1e-9));
    assertThat(fit.rSquared()).isCloseTo(1d, within(1e-9));
    assertThat(fit.predict(12)).isCloseTo(29d, within(1e-9));
    assertThat(fit.margin(12)).isCloseTo(0d, within(1e-6));
  }

  @Test
  void noisySeriesMatchesClosedFormLeastSquares() {
    LinearFit fit = LinearFit.of(new double[] {1, 3, 2, 5});

    assertThat(fit.slope()).isCloseTo(1.1d, within(1e-9));
    assertThat(fit.intercept()).isCloseTo(1.1d, within(1e-9));
    assertThat(fit.xMean()).isEqualTo(1.5d);
    assertThat(fit.sxx()).isCloseTo(5d, within(1e-9));
    assertThat(fit.rSquared()).isCloseTo(1d - 2.7d / 8.75d, within(1e-9));
    assertThat(fit.stdError()).isCloseTo(Math.sqrt(1.35d), within(1e-9));
  }

  @Test
  void constantSeriesHasZeroRSquared() {
    LinearFit fit = LinearFit.of(new double[] {4, 4, 4, 4});

    assertThat(fit.slope()).isZero();
    assertThat(fit.rSquared()).isZero();
  }

  @Test
  void marginWidensAwayFromTheCentre() {
    LinearFit fit = LinearFit.of(new double[] {10, 12, 9, 14, 13, 15, 12, 18});

    assertThat(fit.stdError()).isPositive();
    assertThat(fit.margin(20)).isGreaterThan(fit.margin(8));
  }

  @Test
  void twoPointFitHasNoResidualError() {
    LinearFit fit = LinearFit.of(new double[] {1, 3});

    assertThat(fit.stdError()).isZero();
    assertThat(fit.predict(2)).isCloseTo(5d, within(1e-9));
  }

  @Test
  void singlePointIsRejected() {
    assertThatThrownBy(() -> LinearFit.of(new double[] {1}))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
