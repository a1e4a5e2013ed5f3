package com.ospicorp.seoanalytics.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.seoanalytics.model.TrendDirection;
import java.time.LocalDate;

public record PeriodComparison(
    String metric,
    @JsonProperty("current_value") double currentValue,
    @JsonProperty("current_date") LocalDate currentDate,
    @JsonProperty("previous_value") double previousValue,
    @JsonProperty("previous_date") LocalDate previousDate,
    double change,
    @JsonProperty("change_percent") double changePercent,
    TrendDirection trend
) {}
