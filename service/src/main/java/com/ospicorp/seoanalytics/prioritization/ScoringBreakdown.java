package com.ospicorp.seoanalytics.prioritization;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ScoringBreakdown(
    double impact,
    double effort,
    @JsonProperty("confidence_multiplier") double confidenceMultiplier,
    @JsonProperty("timeline_urgency") double timelineUrgency,
    double roi,
    @JsonProperty("estimated_value") double estimatedValue
) {}
