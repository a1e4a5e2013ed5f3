package com.ospicorp.seoanalytics.insights;

import com.ospicorp.seoanalytics.anomaly.Alert;
import com.ospicorp.seoanalytics.anomaly.AnomalyDetector;
import com.ospicorp.seoanalytics.anomaly.AnomalyScanReport;
import com.ospicorp.seoanalytics.common.AnalysisError;
import com.ospicorp.seoanalytics.common.AnalysisResult;
import com.ospicorp.seoanalytics.forecast.ForecastBatch;
import com.ospicorp.seoanalytics.forecast.Forecaster;
import com.ospicorp.seoanalytics.history.HistoricalAnalyzer;
import com.ospicorp.seoanalytics.history.TrendReport;
import com.ospicorp.seoanalytics.model.ClientInfo;
import com.ospicorp.seoanalytics.prioritization.PrioritizationEngine;
import com.ospicorp.seoanalytics.prioritization.PrioritySummary;
import com.ospicorp.seoanalytics.prioritization.RecommendationRecord;
import com.ospicorp.seoanalytics.prioritization.ScoredRecommendation;
import com.ospicorp.seoanalytics.repository.MetricRepository;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Runs every engine for a client and assembles the result. Sections whose input is missing are
 * omitted; a repository failure aborts the client but never the rest of a batch.
 */
@Service
public class ClientInsightsService {

  private static final Logger log = LoggerFactory.getLogger(ClientInsightsService.class);

  private final MetricRepository repository;
  private final Forecaster forecaster;
  private final AnomalyDetector anomalyDetector;
  private final HistoricalAnalyzer historicalAnalyzer;
  private final PrioritizationEngine prioritizationEngine;

  public ClientInsightsService(MetricRepository repository, Forecaster forecaster,
      AnomalyDetector anomalyDetector, HistoricalAnalyzer historicalAnalyzer,
      PrioritizationEngine prioritizationEngine) {
    this.repository = repository;
    this.forecaster = forecaster;
    this.anomalyDetector = anomalyDetector;
    this.historicalAnalyzer = historicalAnalyzer;
    this.prioritizationEngine = prioritizationEngine;
  }

  public AnalysisResult<ClientInsights> analyze(long clientId) {
    return analyze(clientId, List.of());
  }

  /** Repository exceptions propagate; see {@link #analyzeClients(Collection)} for isolation. */
  public AnalysisResult<ClientInsights> analyze(long clientId,
      List<RecommendationRecord> recommendations) {
    Optional<ClientInfo> client = repository.getClient(clientId);
    if (client.isEmpty()) {
      return AnalysisResult.invalidInput("Client not found: " + clientId);
    }
    Map<String, AnalysisError> omitted = new LinkedHashMap<>();

    ForecastBatch forecasts = forecaster.forecastAllMetrics(clientId);
    AnomalyScanReport scan = section("anomaly_scan",
        anomalyDetector.scanAllAnomalies(clientId), omitted);
    List<Alert> alerts = scan != null ? AnomalyDetector.alertsFor(scan) : null;
    TrendReport trends = section("trend_report",
        historicalAnalyzer.generateTrendReport(clientId), omitted);

    List<ScoredRecommendation> ranked = null;
    PrioritySummary summary = null;
    if (recommendations != null && !recommendations.isEmpty()) {
      ranked = prioritizationEngine.prioritize(recommendations);
      summary = prioritizationEngine.summarize(ranked);
    }

    log.info("Analysis for client {} finished: {} forecasts, {} alerts, {} recommendations",
        clientId, forecasts.totalMetrics(), alerts != null ? alerts.size() : 0,
        ranked != null ? ranked.size() : 0);
    return AnalysisResult.ok(new ClientInsights(
        clientId,
        client.get().name(),
        forecasts,
        scan,
        alerts,
        trends,
        ranked,
        summary,
        omitted.isEmpty() ? null : Map.copyOf(omitted)));
  }

  /**
   * Analyzes each client in turn. A data access failure becomes an upstream failure result for
   * that client and the batch continues.
   */
  public Map<Long, AnalysisResult<ClientInsights>> analyzeClients(Collection<Long> clientIds) {
    Map<Long, AnalysisResult<ClientInsights>> results = new LinkedHashMap<>();
    for (Long clientId : clientIds) {
      try {
        results.put(clientId, analyze(clientId));
      } catch (DataAccessException ex) {
        log.warn("Analysis for client {} aborted: {}", clientId, ex.getMessage());
        results.put(clientId, AnalysisResult.upstreamFailure(
            "Data access failed: " + ex.getMostSpecificCause().getClass().getSimpleName()));
      }
    }
    return results;
  }

  private static <T> T section(String name, AnalysisResult<T> result,
      Map<String, AnalysisError> omitted) {
    if (!result.isOk()) {
      omitted.put(name, result.error());
      return null;
    }
    return result.value();
  }
}
