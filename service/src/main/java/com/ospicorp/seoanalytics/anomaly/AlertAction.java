package com.ospicorp.seoanalytics.anomaly;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Routing tags consumers switch on; never free text. */
public enum AlertAction {
  IMMEDIATE_INVESTIGATION_REQUIRED,
  REVIEW_PAGE_AND_COMPETITORS,
  CONSOLIDATE_OR_DIFFERENTIATE_CONTENT;

  @JsonValue
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
