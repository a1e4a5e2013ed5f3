package com.ospicorp.seoanalytics.forecast;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;

public record PositionForecastPoint(
    LocalDate date,
    @JsonProperty("predicted_position") double predictedPosition,
    ForecastConfidence confidence
) {}
