package com.ospicorp.seoanalytics.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record KeywordPerformance(
    int improved,
    int declined,
    @JsonProperty("top_winners") List<KeywordComparison> topWinners,
    @JsonProperty("top_losers") List<KeywordComparison> topLosers
) {

  static KeywordPerformance of(KeywordPeriodReport report) {
    return new KeywordPerformance(report.improved(), report.declined(), report.topWinners(),
        report.topLosers());
  }
}
