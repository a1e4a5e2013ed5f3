package com.ospicorp.seoanalytics.anomaly;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.seoanalytics.model.Anomaly;
import com.ospicorp.seoanalytics.model.ScanFinding;
import java.time.LocalDate;
import java.util.List;

public record AnomalyScanReport(
    @JsonProperty("client_name") String clientName,
    @JsonProperty("scan_date") LocalDate scanDate,
    ScanSummary summary,
    @JsonProperty("critical_issues") List<ScanFinding> criticalIssues,
    @JsonProperty("high_priority") List<ScanFinding> highPriority,
    @JsonProperty("medium_priority") List<ScanFinding> mediumPriority,
    @JsonProperty("ranking_drops") List<RankingDrop> rankingDrops,
    List<CannibalizationIssue> cannibalization,
    @JsonProperty("recent_anomalies") List<Anomaly> recentAnomalies,
    List<String> recommendations
) {}
