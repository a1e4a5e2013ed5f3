package com.ospicorp.seoanalytics.common;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ErrorKind {
  INSUFFICIENT_DATA,
  INVALID_INPUT,
  UPSTREAM_FAILURE;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
