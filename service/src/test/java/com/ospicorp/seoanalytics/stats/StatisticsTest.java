package com.ospicorp.seoanalytics.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class StatisticsTest {

  @Test
  void meanOfArrayAndCollection() {
    assertEquals(2.5d, Statistics.mean(new double[] {1, 2, 3, 4}));
    assertEquals(2d, Statistics.mean(List.of(1, 2, 3)));
  }

  @Test
  void meanOfEmptySeriesIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Statistics.mean(new double[0]));
  }

  @Test
  void sampleAndPopulationStdDevUseDifferentDenominators() {
    double[] values = {2, 4, 4, 4, 5, 5, 7, 9};

    assertEquals(2d, Statistics.populationStdDev(values), 1e-12);
    assertEquals(Math.sqrt(32d / 7d), Statistics.sampleStdDev(values), 1e-12);
    assertEquals(0d, Statistics.sampleStdDev(new double[] {3}));
  }

  @Test
  void percentChangeGuardsZeroBase() {
    assertEquals(50d, Statistics.percentChange(150, 100));
    assertEquals(-100d, Statistics.percentChange(0, 20));
    assertEquals(0d, Statistics.percentChange(10, 0));
  }

  @Test
  void roundsToPlaces() {
    assertEquals(1.24d, Statistics.round(1.236d, 2), 1e-12);
    assertEquals(3d, Statistics.round(2.5d, 0));
  }
}
