package com.ospicorp.seoanalytics.history;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;
import java.util.List;

// healthScoreTrend is omitted when the client has no scored reports
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrendReport(
    @JsonProperty("client_name") String clientName,
    @JsonProperty("generated_at") LocalDate generatedAt,
    @JsonProperty("health_score_trend") HealthScoreTrend healthScoreTrend,
    @JsonProperty("top_improvements") List<MetricImprovement> topImprovements,
    @JsonProperty("concerning_trends") List<ConcerningTrend> concerningTrends,
    @JsonProperty("keyword_performance") KeywordPerformance keywordPerformance,
    TrendSummary summary
) {}
