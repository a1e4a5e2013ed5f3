package com.ospicorp.seoanalytics.history;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum KeywordStatus {
  IMPROVED,
  DECLINED,
  STABLE;

  static KeywordStatus ofPositionChange(double positionChange) {
    if (positionChange > 0) {
      return IMPROVED;
    }
    return positionChange < 0 ? DECLINED : STABLE;
  }

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
