package com.ospicorp.seoanalytics.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Volatility {
  LOW,
  MEDIUM,
  HIGH,
  UNKNOWN;

  /** Coefficient of variation bands: below 10% low, below 25% medium, otherwise high. */
  public static Volatility fromCoefficientOfVariation(double percent) {
    if (percent < 10) {
      return LOW;
    }
    return percent < 25 ? MEDIUM : HIGH;
  }

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
