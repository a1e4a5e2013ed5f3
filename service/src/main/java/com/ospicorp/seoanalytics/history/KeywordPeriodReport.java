package com.ospicorp.seoanalytics.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record KeywordPeriodReport(
    @JsonProperty("period_days") int periodDays,
    @JsonProperty("total_keywords") int totalKeywords,
    int improved,
    int declined,
    int stable,
    @JsonProperty("top_winners") List<KeywordComparison> topWinners,
    @JsonProperty("top_losers") List<KeywordComparison> topLosers,
    @JsonProperty("all_comparisons") List<KeywordComparison> allComparisons
) {}
