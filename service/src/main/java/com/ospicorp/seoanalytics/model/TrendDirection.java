package com.ospicorp.seoanalytics.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum TrendDirection {
  UP,
  DOWN,
  FLAT,
  INSUFFICIENT_DATA;

  public static TrendDirection ofChange(double change) {
    if (change > 0) {
      return UP;
    }
    return change < 0 ? DOWN : FLAT;
  }

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
