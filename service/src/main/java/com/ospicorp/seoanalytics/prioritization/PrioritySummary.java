package com.ospicorp.seoanalytics.prioritization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PrioritySummary(
    @JsonProperty("total_recommendations") int totalRecommendations,
    PriorityBreakdown breakdown,
    PriorityPercentages percentages,
    @JsonProperty("average_scores") AverageScores averageScores,
    @JsonProperty("top_priority") String topPriority
) {}
