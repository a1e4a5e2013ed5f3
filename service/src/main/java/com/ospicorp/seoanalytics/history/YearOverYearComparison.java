package com.ospicorp.seoanalytics.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.seoanalytics.model.TrendDirection;

public record YearOverYearComparison(
    String metric,
    @JsonProperty("current_average") double currentAverage,
    @JsonProperty("year_ago_average") double yearAgoAverage,
    double change,
    @JsonProperty("change_percent") double changePercent,
    TrendDirection trend
) {}
