package com.ospicorp.seoanalytics.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.seoanalytics.model.TrendDirection;
import java.util.List;

/** Health scores of the latest reports; {@code history} is newest first. */
public record HealthScoreTrend(
    @JsonProperty("current_score") double currentScore,
    @JsonProperty("average_score") double averageScore,
    @JsonProperty("best_score") double bestScore,
    @JsonProperty("worst_score") double worstScore,
    double improvement,
    TrendDirection trend,
    List<HealthScorePoint> history
) {}
