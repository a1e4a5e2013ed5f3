package com.ospicorp.seoanalytics.stats;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.seoanalytics.model.TrendDirection;
import com.ospicorp.seoanalytics.model.Volatility;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class TrendClassifierTest {

  @Test
  void constantSeriesIsFlat() {
    double[] values = new double[10];
    Arrays.fill(values, 42d);

    assertThat(TrendClassifier.direction(values)).isEqualTo(TrendDirection.FLAT);
  }

  @Test
  void risingFivePercentOfMeanPerStepIsUp() {
    // mean 100, step 5
    double[] values = new double[10];
    for (int i = 0; i < values.length; i++) {
      values[i] = 77.5 + 5 * i;
    }

    assertThat(TrendClassifier.direction(values)).isEqualTo(TrendDirection.UP);
  }

  @Test
  void fallingSeriesIsDown() {
    assertThat(TrendClassifier.direction(new double[] {50, 45, 40, 35, 30}))
        .isEqualTo(TrendDirection.DOWN);
  }

  @Test
  void slopeBelowOnePercentOfMeanIsFlat() {
    // slope 0.5 against a mean near 1000
    assertThat(TrendClassifier.direction(new double[] {1000, 1000.5, 1001, 1001.5}))
        .isEqualTo(TrendDirection.FLAT);
  }

  @Test
  void zeroMeanUsesFixedThreshold() {
    assertThat(TrendClassifier.direction(new double[] {-1, 0, 1})).isEqualTo(TrendDirection.UP);
    assertThat(TrendClassifier.direction(new double[] {-0.005, 0, 0.005}))
        .isEqualTo(TrendDirection.FLAT);
  }

  @Test
  void singleValueIsInsufficient() {
    assertThat(TrendClassifier.direction(new double[] {3}))
        .isEqualTo(TrendDirection.INSUFFICIENT_DATA);
    assertThat(TrendClassifier.volatility(new double[] {3})).isEqualTo(Volatility.UNKNOWN);
  }

  @Test
  void volatilityBandsFollowCoefficientOfVariation() {
    assertThat(TrendClassifier.volatility(new double[] {100, 101, 99, 100}))
        .isEqualTo(Volatility.LOW);
    assertThat(TrendClassifier.volatility(new double[] {100, 120, 80, 100}))
        .isEqualTo(Volatility.MEDIUM);
    assertThat(TrendClassifier.volatility(new double[] {10, 100, 50, 5}))
        .isEqualTo(Volatility.HIGH);
    assertThat(TrendClassifier.volatility(new double[] {-1, 1})).isEqualTo(Volatility.UNKNOWN);
  }
}
