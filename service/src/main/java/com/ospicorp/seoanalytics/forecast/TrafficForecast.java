package com.ospicorp.seoanalytics.forecast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.seoanalytics.model.ForecastPoint;
import java.util.List;

public record TrafficForecast(
    @JsonProperty("current_daily_avg") double currentDailyAvg,
    @JsonProperty("forecasted_daily_avg_30d") double forecastedDailyAvg30d,
    @JsonProperty("expected_growth_rate") double expectedGrowthRate,
    ForecastTrend trend,
    @JsonProperty("seasonality_detected") boolean seasonalityDetected,
    @JsonProperty("seasonal_factors") List<Double> seasonalFactors,
    List<ForecastPoint> forecasts,
    @JsonProperty("total_forecasts") int totalForecasts
) {}
