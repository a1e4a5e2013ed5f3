package com.ospicorp.seoanalytics.history;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MetricImprovement(
    String metric,
    @JsonProperty("change_percent") double changePercent,
    @JsonProperty("change_value") double changeValue,
    @JsonProperty("current_value") double currentValue
) {}
