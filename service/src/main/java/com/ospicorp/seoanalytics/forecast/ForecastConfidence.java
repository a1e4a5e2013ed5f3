package com.ospicorp.seoanalytics.forecast;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ForecastConfidence {
  HIGH,
  MEDIUM,
  LOW;

  public static ForecastConfidence fromRSquared(double rSquared) {
    if (rSquared > 0.7) {
      return HIGH;
    }
    return rSquared > 0.4 ? MEDIUM : LOW;
  }

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
