package com.ospicorp.seoanalytics.repository;

import com.ospicorp.seoanalytics.model.Anomaly;
import com.ospicorp.seoanalytics.model.ClientInfo;
import com.ospicorp.seoanalytics.model.ForecastPoint;
import com.ospicorp.seoanalytics.model.KeywordObservation;
import com.ospicorp.seoanalytics.model.MetricSample;
import com.ospicorp.seoanalytics.model.ReportSnapshot;
import com.ospicorp.seoanalytics.model.TrafficSample;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Source of the performance history the analytics engines read, and sink for the forecasts and
 * anomalies they record for audit.
 *
 * <p>Implementations report failures as unchecked exceptions (Spring's
 * {@code DataAccessException} for the JDBC adapter); the engines let them propagate.
 */
public interface MetricRepository {

  /** Samples newest first. Any of {@code metricName}, {@code startDate}, {@code endDate} may be null. */
  List<MetricSample> getMetrics(long clientId, String metricName, LocalDate startDate,
      LocalDate endDate);

  default List<MetricSample> getMetrics(long clientId) {
    return getMetrics(clientId, null, null, null);
  }

  default List<MetricSample> getMetrics(long clientId, String metricName) {
    return getMetrics(clientId, metricName, null, null);
  }

  /** Samples of one metric over the last {@code months} months, oldest first. */
  List<MetricSample> getMetricTrend(long clientId, String metricName, int months);

  /** One aggregated sample per date over the last {@code days} days, oldest first. */
  List<TrafficSample> getTrafficTrend(long clientId, int days);

  /** Every observation of a keyword, oldest first. */
  List<KeywordObservation> getKeywordHistory(long clientId, String keyword);

  /** Observations on the latest tracked date, most clicks first. */
  List<KeywordObservation> getTopKeywords(long clientId, int limit);

  void saveForecast(long clientId, String metricName, List<ForecastPoint> forecasts);

  void saveAnomaly(Anomaly anomaly);

  /** Anomalies dated within the last {@code days} days, newest first. */
  List<Anomaly> getRecentAnomalies(long clientId, int days);

  /** Reports newest first. */
  List<ReportSnapshot> getReports(long clientId, int limit);

  Optional<ClientInfo> getClient(long clientId);
}
