package com.ospicorp.seoanalytics.forecast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.seoanalytics.model.ForecastPoint;
import java.util.List;

public record LinearForecast(
    String metric,
    String model,
    @JsonProperty("r_squared") double rSquared,
    ForecastConfidence confidence,
    double slope,
    ForecastTrend trend,
    List<ForecastPoint> forecasts,
    @JsonProperty("total_forecasts") int totalForecasts
) {}
