package com.ospicorp.seoanalytics.forecast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.seoanalytics.common.AnalysisError;
import java.time.LocalDate;
import java.util.Map;

/**
 * Every forecast that could be produced for a client. Metrics left out, organic traffic
 * included, are listed under {@code skipped_metrics} with the reason.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForecastBatch(
    @JsonProperty("client_id") long clientId,
    Map<String, LinearForecast> forecasts,
    @JsonProperty("organic_traffic") TrafficForecast organicTraffic,
    @JsonProperty("total_metrics") int totalMetrics,
    @JsonProperty("generated_at") LocalDate generatedAt,
    @JsonProperty("skipped_metrics") Map<String, AnalysisError> skippedMetrics
) {}
