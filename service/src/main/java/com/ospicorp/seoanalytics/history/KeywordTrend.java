package com.ospicorp.seoanalytics.history;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.seoanalytics.model.KeywordObservation;
import com.ospicorp.seoanalytics.model.TrendDirection;
import java.time.LocalDate;
import java.util.List;

// positive positionImprovement means the keyword moved up the results page
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeywordTrend(
    String keyword,
    @JsonProperty("first_tracked") LocalDate firstTracked,
    @JsonProperty("last_tracked") LocalDate lastTracked,
    @JsonProperty("current_position") Double currentPosition,
    @JsonProperty("best_position") Double bestPosition,
    @JsonProperty("worst_position") Double worstPosition,
    @JsonProperty("average_position") Double averagePosition,
    @JsonProperty("position_improvement") double positionImprovement,
    @JsonProperty("total_clicks") long totalClicks,
    @JsonProperty("avg_monthly_clicks") double avgMonthlyClicks,
    TrendDirection trend,
    List<KeywordObservation> history
) {}
