package com.ospicorp.seoanalytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;

public record ForecastPoint(
    LocalDate date,
    @JsonProperty("predicted_value") double predictedValue,
    @JsonProperty("confidence_low") double confidenceLow,
    @JsonProperty("confidence_high") double confidenceHigh,
    @JsonProperty("model_type") ModelType modelType
) {
  public ForecastPoint {
    if (confidenceLow > predictedValue || predictedValue > confidenceHigh) {
      throw new IllegalArgumentException("interval [" + confidenceLow + ", " + confidenceHigh
          + "] does not contain " + predictedValue);
    }
  }
}
