package com.ospicorp.seoanalytics.history;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TrendSummary(
    @JsonProperty("total_metrics_tracked") int totalMetricsTracked,
    @JsonProperty("positive_trends") int positiveTrends,
    @JsonProperty("negative_trends") int negativeTrends,
    @JsonProperty("overall_health") OverallHealth overallHealth
) {}
