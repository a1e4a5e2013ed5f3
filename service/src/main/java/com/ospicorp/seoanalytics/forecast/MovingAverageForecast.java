package com.ospicorp.seoanalytics.forecast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.seoanalytics.model.ForecastPoint;
import java.util.List;

public record MovingAverageForecast(
    String metric,
    String model,
    @JsonProperty("window_size") int windowSize,
    @JsonProperty("baseline_value") double baselineValue,
    List<ForecastPoint> forecasts
) {}
