package com.ospicorp.seoanalytics.history;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum OverallHealth {
  IMPROVING,
  DECLINING;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
