package com.ospicorp.seoanalytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricSample(
    @JsonProperty("client_id") long clientId,
    @JsonProperty("metric_name") String metricName,
    double value,
    LocalDate date,
    String unit,
    String module
) {}
