package com.ospicorp.seoanalytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Anomaly(
    @JsonProperty("client_id") long clientId,
    @JsonProperty("metric") String metricName,
    LocalDate date,
    @JsonProperty("expected_value") double expectedValue,
    @JsonProperty("actual_value") double actualValue,
    @JsonProperty("deviation_percent") double deviationPercent,
    @JsonProperty("z_score") Double zScore,
    Severity severity,
    AnomalyType type
) implements ScanFinding {}
