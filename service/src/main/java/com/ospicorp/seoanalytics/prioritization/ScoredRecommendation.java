package com.ospicorp.seoanalytics.prioritization;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

// serializes flat: the original fields followed by the scores and the rank
public record ScoredRecommendation(
    @JsonUnwrapped RecommendationRecord recommendation,
    @JsonUnwrapped PriorityScore score,
    int rank
) {}
