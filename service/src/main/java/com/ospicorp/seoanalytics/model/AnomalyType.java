package com.ospicorp.seoanalytics.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AnomalyType {
  SPIKE,
  DROP;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
