package com.ospicorp.seoanalytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;

// position and its deltas are null when the source export left them blank
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeywordObservation(
    @JsonProperty("client_id") long clientId,
    String keyword,
    Double position,
    @JsonProperty("previous_position") Double previousPosition,
    @JsonProperty("position_change") Double positionChange,
    long impressions,
    long clicks,
    double ctr,
    LocalDate date,
    String url
) {}
