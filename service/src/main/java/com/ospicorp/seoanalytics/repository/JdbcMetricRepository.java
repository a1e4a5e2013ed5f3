package com.ospicorp.seoanalytics.repository;

import com.ospicorp.seoanalytics.model.Anomaly;
import com.ospicorp.seoanalytics.model.AnomalyType;
import com.ospicorp.seoanalytics.model.ClientInfo;
import com.ospicorp.seoanalytics.model.ForecastPoint;
import com.ospicorp.seoanalytics.model.KeywordObservation;
import com.ospicorp.seoanalytics.model.MetricSample;
import com.ospicorp.seoanalytics.model.ReportSnapshot;
import com.ospicorp.seoanalytics.model.Severity;
import com.ospicorp.seoanalytics.model.TrafficSample;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcMetricRepository implements MetricRepository {

  private static final RowMapper<MetricSample> METRIC_ROW = (rs, i) -> new MetricSample(
      rs.getLong("client_id"),
      rs.getString("metric_name"),
      rs.getDouble("metric_value"),
      rs.getDate("metric_date").toLocalDate(),
      rs.getString("metric_unit"),
      rs.getString("module"));

  private static final RowMapper<KeywordObservation> KEYWORD_ROW = (rs, i) -> new KeywordObservation(
      rs.getLong("client_id"),
      rs.getString("keyword"),
      nullableDouble(rs, "position"),
      nullableDouble(rs, "previous_position"),
      nullableDouble(rs, "position_change"),
      rs.getLong("impressions"),
      rs.getLong("clicks"),
      rs.getDouble("ctr"),
      rs.getDate("date").toLocalDate(),
      rs.getString("url"));

  private final JdbcTemplate jdbc;
  private final Clock clock;

  public JdbcMetricRepository(JdbcTemplate jdbc, Clock clock) {
    this.jdbc = jdbc;
    this.clock = clock;
  }

  @Override
  public List<MetricSample> getMetrics(long clientId, String metricName, LocalDate startDate,
      LocalDate endDate) {
    StringBuilder sql = new StringBuilder("""
        SELECT client_id, metric_name, metric_value, metric_date, metric_unit, module
        FROM metrics
        WHERE client_id = ? AND metric_value IS NOT NULL
        """);
    List<Object> args = new ArrayList<>();
    args.add(clientId);
    if (metricName != null) {
      sql.append(" AND metric_name = ?");
      args.add(metricName);
    }
    if (startDate != null) {
      sql.append(" AND metric_date >= ?");
      args.add(Date.valueOf(startDate));
    }
    if (endDate != null) {
      sql.append(" AND metric_date <= ?");
      args.add(Date.valueOf(endDate));
    }
    sql.append(" ORDER BY metric_date DESC, id DESC");
    return jdbc.query(sql.toString(), METRIC_ROW, args.toArray());
  }

  @Override
  public List<MetricSample> getMetricTrend(long clientId, String metricName, int months) {
    String sql = """
      SELECT client_id, metric_name, metric_value, metric_date, metric_unit, module
      FROM metrics
      WHERE client_id = ? AND metric_name = ? AND metric_date >= ?
        AND metric_value IS NOT NULL
      ORDER BY metric_date ASC, id ASC
    """;
    LocalDate since = LocalDate.now(clock).minusMonths(months);
    return jdbc.query(sql, METRIC_ROW, clientId, metricName, Date.valueOf(since));
  }

  @Override
  public List<TrafficSample> getTrafficTrend(long clientId, int days) {
    String sql = """
      SELECT date,
             COALESCE(SUM(sessions), 0) AS sessions,
             COALESCE(SUM(users), 0) AS users,
             COALESCE(SUM(pageviews), 0) AS pageviews,
             AVG(bounce_rate) AS bounce_rate,
             AVG(avg_session_duration) AS avg_session_duration
      FROM traffic
      WHERE client_id = ? AND date >= ?
      GROUP BY date
      ORDER BY date ASC
    """;
    LocalDate since = LocalDate.now(clock).minusDays(days);
    return jdbc.query(sql, (rs, i) -> new TrafficSample(
            clientId,
            rs.getDate("date").toLocalDate(),
            rs.getLong("sessions"),
            rs.getLong("users"),
            rs.getLong("pageviews"),
            nullableDouble(rs, "bounce_rate"),
            nullableDouble(rs, "avg_session_duration"),
            null,
            null),
        clientId, Date.valueOf(since));
  }

  @Override
  public List<KeywordObservation> getKeywordHistory(long clientId, String keyword) {
    String sql = """
      SELECT client_id, keyword, position, previous_position, position_change,
             impressions, clicks, ctr, date, url
      FROM keywords
      WHERE client_id = ? AND keyword = ?
      ORDER BY date ASC, id ASC
    """;
    return jdbc.query(sql, KEYWORD_ROW, clientId, keyword);
  }

  @Override
  public List<KeywordObservation> getTopKeywords(long clientId, int limit) {
    String sql = """
      SELECT client_id, keyword, position, previous_position, position_change,
             impressions, clicks, ctr, date, url
      FROM keywords
      WHERE client_id = ?
        AND date = (SELECT MAX(date) FROM keywords WHERE client_id = ?)
      ORDER BY clicks DESC, id ASC
      LIMIT ?
    """;
    return jdbc.query(sql, KEYWORD_ROW, clientId, clientId, limit);
  }

  @Override
  public void saveForecast(long clientId, String metricName, List<ForecastPoint> forecasts) {
    final String sql = """
      INSERT INTO forecasts (client_id, metric_name, forecast_date, predicted_value,
                             confidence_low, confidence_high, model_type)
      VALUES (?, ?, ?, ?, ?, ?, ?)
    """;
    List<Object[]> batchArgs = new ArrayList<>(forecasts.size());
    for (ForecastPoint point : forecasts) {
      batchArgs.add(new Object[]{
          clientId,
          metricName,
          Date.valueOf(point.date()),
          point.predictedValue(),
          point.confidenceLow(),
          point.confidenceHigh(),
          point.modelType().label()
      });
    }
    jdbc.batchUpdate(sql, batchArgs);
  }

  @Override
  public void saveAnomaly(Anomaly anomaly) {
    jdbc.update("""
        INSERT INTO anomalies (client_id, metric_name, date, expected_value, actual_value,
                               deviation_percent, severity)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        """,
        anomaly.clientId(),
        anomaly.metricName(),
        Date.valueOf(anomaly.date()),
        anomaly.expectedValue(),
        anomaly.actualValue(),
        anomaly.deviationPercent(),
        anomaly.severity().label());
  }

  @Override
  public List<Anomaly> getRecentAnomalies(long clientId, int days) {
    String sql = """
      SELECT client_id, metric_name, date, expected_value, actual_value,
             deviation_percent, severity
      FROM anomalies
      WHERE client_id = ? AND date >= ?
      ORDER BY date DESC, ABS(deviation_percent) DESC
    """;
    LocalDate since = LocalDate.now(clock).minusDays(days);
    return jdbc.query(sql, (rs, i) -> {
      double expected = rs.getDouble("expected_value");
      double actual = rs.getDouble("actual_value");
      return new Anomaly(
          rs.getLong("client_id"),
          rs.getString("metric_name"),
          rs.getDate("date").toLocalDate(),
          expected,
          actual,
          rs.getDouble("deviation_percent"),
          null,
          Severity.fromLabel(rs.getString("severity")),
          actual > expected ? AnomalyType.SPIKE : AnomalyType.DROP);
    }, clientId, Date.valueOf(since));
  }

  @Override
  public List<ReportSnapshot> getReports(long clientId, int limit) {
    String sql = """
      SELECT report_date, health_score
      FROM reports
      WHERE client_id = ?
      ORDER BY report_date DESC, id DESC
      LIMIT ?
    """;
    return jdbc.query(sql, (rs, i) -> new ReportSnapshot(
            rs.getDate("report_date").toLocalDate(),
            nullableDouble(rs, "health_score")),
        clientId, limit);
  }

  @Override
  public Optional<ClientInfo> getClient(long clientId) {
    List<ClientInfo> rows = jdbc.query(
        "SELECT id, name, domain, industry FROM clients WHERE id = ?",
        (rs, i) -> new ClientInfo(rs.getLong("id"), rs.getString("name"),
            rs.getString("domain"), rs.getString("industry")),
        clientId);
    return rows.stream().findFirst();
  }

  private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
    double value = rs.getDouble(column);
    return rs.wasNull() ? null : value;
  }
}
