package com.ospicorp.seoanalytics.anomaly;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ScanSummary(
    @JsonProperty("total_anomalies") int totalAnomalies,
    @JsonProperty("ranking_drops") int rankingDrops,
    @JsonProperty("cannibalization_issues") int cannibalizationIssues,
    @JsonProperty("critical_count") int criticalCount,
    @JsonProperty("high_count") int highCount,
    @JsonProperty("medium_count") int mediumCount
) {}
