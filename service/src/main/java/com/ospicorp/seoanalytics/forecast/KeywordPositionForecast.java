package com.ospicorp.seoanalytics.forecast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.seoanalytics.model.TrendDirection;
import java.util.List;

public record KeywordPositionForecast(
    String keyword,
    @JsonProperty("current_position") double currentPosition,
    @JsonProperty("daily_change") double dailyChange,
    @JsonProperty("forecasted_position_30d") Double forecastedPosition30d,
    @JsonProperty("expected_change") double expectedChange,
    TrendDirection trend,
    List<PositionForecastPoint> forecasts
) {}
