package com.ospicorp.seoanalytics.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Severity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  /** Bands an absolute deviation percentage: >50 critical, >30 high, >15 medium. */
  public static Severity fromDeviation(double absoluteDeviationPercent) {
    if (absoluteDeviationPercent > 50) {
      return CRITICAL;
    }
    if (absoluteDeviationPercent > 30) {
      return HIGH;
    }
    if (absoluteDeviationPercent > 15) {
      return MEDIUM;
    }
    return LOW;
  }

  public static Severity fromLabel(String label) {
    return valueOf(label.toUpperCase(Locale.ROOT));
  }

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
