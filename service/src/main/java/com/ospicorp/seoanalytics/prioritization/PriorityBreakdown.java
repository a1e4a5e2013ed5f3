package com.ospicorp.seoanalytics.prioritization;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PriorityBreakdown(
    @JsonProperty("quick_wins") int quickWins,
    @JsonProperty("high_impact") int highImpact,
    int strategic
) {}
