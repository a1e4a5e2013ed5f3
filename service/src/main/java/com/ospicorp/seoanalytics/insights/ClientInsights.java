package com.ospicorp.seoanalytics.insights;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.seoanalytics.anomaly.Alert;
import com.ospicorp.seoanalytics.anomaly.AnomalyScanReport;
import com.ospicorp.seoanalytics.common.AnalysisError;
import com.ospicorp.seoanalytics.forecast.ForecastBatch;
import com.ospicorp.seoanalytics.history.TrendReport;
import com.ospicorp.seoanalytics.prioritization.PrioritySummary;
import com.ospicorp.seoanalytics.prioritization.ScoredRecommendation;
import java.util.List;
import java.util.Map;

/**
 * Everything computed for one client. A section that could not be produced is null and its
 * error is listed under {@code omitted_sections}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClientInsights(
    @JsonProperty("client_id") long clientId,
    @JsonProperty("client_name") String clientName,
    ForecastBatch forecasts,
    @JsonProperty("anomaly_scan") AnomalyScanReport anomalyScan,
    List<Alert> alerts,
    @JsonProperty("trend_report") TrendReport trendReport,
    List<ScoredRecommendation> recommendations,
    @JsonProperty("priority_summary") PrioritySummary prioritySummary,
    @JsonProperty("omitted_sections") Map<String, AnalysisError> omittedSections
) {}
