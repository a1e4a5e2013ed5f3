package com.ospicorp.seoanalytics.prioritization;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PriorityScore(
    @JsonProperty("impact_score") double impactScore,
    @JsonProperty("effort_score") double effortScore,
    @JsonProperty("roi_score") double roiScore,
    @JsonProperty("final_score") double finalScore,
    PriorityLabel priority,
    @JsonProperty("scoring_breakdown") ScoringBreakdown scoringBreakdown
) {}
