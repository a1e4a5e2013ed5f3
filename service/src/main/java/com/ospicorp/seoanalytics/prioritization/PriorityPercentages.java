package com.ospicorp.seoanalytics.prioritization;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PriorityPercentages(
    @JsonProperty("quick_wins") double quickWins,
    @JsonProperty("high_impact") double highImpact,
    double strategic
) {}
