package com.ospicorp.seoanalytics.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.seoanalytics.model.Severity;
import com.ospicorp.seoanalytics.model.TrendDirection;
import com.ospicorp.seoanalytics.model.Volatility;

public record ConcerningTrend(
    String metric,
    TrendDirection trend,
    Volatility volatility,
    Severity severity,
    @JsonProperty("current_value") double currentValue,
    double average
) {}
