package com.ospicorp.seoanalytics.history;

import com.fasterxml.jackson.annotation.JsonProperty;

public record KeywordComparison(
    String keyword,
    @JsonProperty("current_position") Double currentPosition,
    @JsonProperty("previous_position") Double previousPosition,
    @JsonProperty("position_change") double positionChange,
    @JsonProperty("current_clicks") long currentClicks,
    @JsonProperty("previous_clicks") long previousClicks,
    @JsonProperty("clicks_change") long clicksChange,
    KeywordStatus status
) {

  double impact() {
    return positionChange * 10 + clicksChange;
  }
}
