package com.ospicorp.seoanalytics.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ModelType {
  LINEAR,
  MOVING_AVERAGE,
  SEASONAL_LINEAR;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ModelType fromLabel(String label) {
    return valueOf(label.toUpperCase(Locale.ROOT));
  }
}
