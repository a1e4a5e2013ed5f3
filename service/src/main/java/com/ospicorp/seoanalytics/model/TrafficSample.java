package com.ospicorp.seoanalytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrafficSample(
    @JsonProperty("client_id") long clientId,
    LocalDate date,
    long sessions,
    long users,
    long pageviews,
    @JsonProperty("bounce_rate") Double bounceRate,
    @JsonProperty("avg_session_duration") Double avgSessionDuration,
    String source,
    String device
) {}
