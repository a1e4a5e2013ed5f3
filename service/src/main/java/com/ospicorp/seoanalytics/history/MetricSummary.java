package com.ospicorp.seoanalytics.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.seoanalytics.model.MetricSample;
import com.ospicorp.seoanalytics.model.TrendDirection;
import com.ospicorp.seoanalytics.model.Volatility;
import java.util.List;

public record MetricSummary(
    String metric,
    @JsonProperty("period_months") int periodMonths,
    @JsonProperty("current_value") double currentValue,
    @JsonProperty("min_value") double minValue,
    @JsonProperty("max_value") double maxValue,
    @JsonProperty("average_value") double averageValue,
    @JsonProperty("std_deviation") double stdDeviation,
    @JsonProperty("trend_direction") TrendDirection trendDirection,
    Volatility volatility,
    @JsonProperty("data_points") int dataPoints,
    List<MetricSample> timeline
) {}
