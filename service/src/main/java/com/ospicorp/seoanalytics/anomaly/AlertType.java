package com.ospicorp.seoanalytics.anomaly;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AlertType {
  CRITICAL_ANOMALY,
  RANKING_DROP,
  CANNIBALIZATION;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
