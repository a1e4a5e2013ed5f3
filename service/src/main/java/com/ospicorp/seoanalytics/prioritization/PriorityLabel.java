package com.ospicorp.seoanalytics.prioritization;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PriorityLabel {
  QUICK_WIN("QUICK WIN"),
  HIGH_IMPACT("HIGH IMPACT"),
  STRATEGIC("STRATEGIC");

  private final String label;

  PriorityLabel(String label) {
    this.label = label;
  }

  /** Checked in order: quick win, then high impact, otherwise strategic. */
  static PriorityLabel of(double finalScore, double effortScore, double timelineScore) {
    if (finalScore > 8 && effortScore < 4 && timelineScore >= 2) {
      return QUICK_WIN;
    }
    return finalScore > 6 ? HIGH_IMPACT : STRATEGIC;
  }

  @JsonValue
  public String label() {
    return label;
  }
}
