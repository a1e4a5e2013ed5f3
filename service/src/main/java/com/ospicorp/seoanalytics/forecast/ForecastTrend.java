package com.ospicorp.seoanalytics.forecast;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ForecastTrend {
  INCREASING,
  DECREASING,
  STABLE;

  public static ForecastTrend ofSlope(double slope) {
    if (slope > 0) {
      return INCREASING;
    }
    return slope < 0 ? DECREASING : STABLE;
  }

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
