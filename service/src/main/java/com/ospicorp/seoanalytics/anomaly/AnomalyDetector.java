package com.ospicorp.seoanalytics.anomaly;

import static com.ospicorp.seoanalytics.stats.Statistics.round;

import com.ospicorp.seoanalytics.common.AnalysisResult;
import com.ospicorp.seoanalytics.model.Anomaly;
import com.ospicorp.seoanalytics.model.AnomalyType;
import com.ospicorp.seoanalytics.model.ClientInfo;
import com.ospicorp.seoanalytics.model.KeywordObservation;
import com.ospicorp.seoanalytics.model.MetricSample;
import com.ospicorp.seoanalytics.model.ScanFinding;
import com.ospicorp.seoanalytics.model.Severity;
import com.ospicorp.seoanalytics.model.TrafficSample;
import com.ospicorp.seoanalytics.repository.MetricRepository;
import com.ospicorp.seoanalytics.stats.Statistics;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Flags unusual points in metric and traffic series and structural problems in keyword
 * rankings.
 *
 * <p>Metric points are judged by their z-score against the whole window; traffic points by
 * their distance from an exponential moving average of the preceding points. Each flagged point
 * is recorded through {@link MetricRepository#saveAnomaly(Anomaly)}.
 */
@Service
public class AnomalyDetector {

  private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

  public static final String TRAFFIC_METRIC = "traffic_sessions";
  static final int MIN_POINTS = 7;
  private static final int BASELINE_WINDOW = 7;
  private static final double EMA_ALPHA = 0.3d;
  private static final int RANKING_KEYWORDS = 100;
  private static final int CANNIBALIZATION_KEYWORDS = 200;
  private static final double CRITICAL_POSITION_DROP = 10d;
  private static final int SCANNED_METRICS = 10;
  private static final int RECENT_ANOMALY_DAYS = 7;
  private static final int REPORTED_RANKING_DROPS = 10;
  private static final int REPORTED_CANNIBALIZATION = 5;
  private static final int ALERTED_RANKING_DROPS = 5;
  private static final int ALERTED_CANNIBALIZATION = 3;
  private static final int HIGH_PRIORITY_BACKLOG = 5;

  private final MetricRepository repository;
  private final Clock clock;
  private final double zScoreThreshold;
  private final double percentChangeThreshold;
  private final int metricLookbackDays;
  private final int trafficLookbackDays;
  private final int rankingDropThreshold;

  public AnomalyDetector(MetricRepository repository, Clock clock,
      @Value("${analytics.anomaly.z-score-threshold:2.5}") double zScoreThreshold,
      @Value("${analytics.anomaly.percent-change-threshold:30}") double percentChangeThreshold,
      @Value("${analytics.anomaly.metric-lookback-days:90}") int metricLookbackDays,
      @Value("${analytics.anomaly.traffic-lookback-days:30}") int trafficLookbackDays,
      @Value("${analytics.anomaly.ranking-drop-threshold:5}") int rankingDropThreshold) {
    this.repository = repository;
    this.clock = clock;
    this.zScoreThreshold = zScoreThreshold;
    this.percentChangeThreshold = percentChangeThreshold;
    this.metricLookbackDays = metricLookbackDays;
    this.trafficLookbackDays = trafficLookbackDays;
    this.rankingDropThreshold = rankingDropThreshold;
  }

  // ---- metric series ----

  public List<Anomaly> detectMetricAnomalies(long clientId, String metricName) {
    return detectMetricAnomalies(clientId, metricName, metricLookbackDays);
  }

  public List<Anomaly> detectMetricAnomalies(long clientId, String metricName, int days) {
    LocalDate since = LocalDate.now(clock).minusDays(days);
    List<MetricSample> samples =
        new ArrayList<>(repository.getMetrics(clientId, metricName, since, null));
    samples.sort(Comparator.comparing(MetricSample::date));
    List<Anomaly> anomalies = findMetricAnomalies(clientId, metricName, samples);
    anomalies.forEach(repository::saveAnomaly);
    return anomalies;
  }

  /**
   * Z-score scan of a chronological series. A point is flagged when
   * |value - mean| / stddev exceeds the threshold (population standard deviation over the
   * window); its expected value is the mean of the seven points before it, or the window mean
   * when fewer precede it.
   */
  public List<Anomaly> findMetricAnomalies(long clientId, String metricName,
      List<MetricSample> samples) {
    if (samples.size() < MIN_POINTS) {
      log.debug("Skipping {} for client {}: {} points", metricName, clientId, samples.size());
      return new ArrayList<>();
    }
    double[] values = samples.stream().mapToDouble(MetricSample::value).toArray();
    double mean = Statistics.mean(values);
    double std = Statistics.populationStdDev(values);
    if (std == 0d) {
      log.debug("Skipping {} for client {}: zero variance", metricName, clientId);
      return new ArrayList<>();
    }

    List<Anomaly> anomalies = new ArrayList<>();
    for (int i = 0; i < values.length; i++) {
      double z = Math.abs((values[i] - mean) / std);
      if (z <= zScoreThreshold) {
        continue;
      }
      double expected = i >= BASELINE_WINDOW
          ? Statistics.mean(Arrays.copyOfRange(values, i - BASELINE_WINDOW, i))
          : mean;
      double deviation = Statistics.percentChange(values[i], expected);
      anomalies.add(new Anomaly(
          clientId,
          metricName,
          samples.get(i).date(),
          round(expected, 2),
          values[i],
          round(deviation, 2),
          round(z, 2),
          Severity.fromDeviation(Math.abs(deviation)),
          values[i] > expected ? AnomalyType.SPIKE : AnomalyType.DROP));
    }
    return anomalies;
  }

  // ---- traffic ----

  public List<Anomaly> detectTrafficAnomalies(long clientId) {
    return detectTrafficAnomalies(clientId, trafficLookbackDays);
  }

  public List<Anomaly> detectTrafficAnomalies(long clientId, int days) {
    List<Anomaly> anomalies =
        findTrafficAnomalies(clientId, repository.getTrafficTrend(clientId, days));
    anomalies.forEach(repository::saveAnomaly);
    return anomalies;
  }

  /**
   * Compares each day's sessions with an exponential moving average (alpha 0.3) seeded at the
   * first day and updated with every earlier day, flagging relative differences above the
   * percent-change threshold.
   */
  public List<Anomaly> findTrafficAnomalies(long clientId, List<TrafficSample> samples) {
    if (samples.size() < MIN_POINTS) {
      return new ArrayList<>();
    }
    List<Anomaly> anomalies = new ArrayList<>();
    double ema = samples.get(0).sessions();
    for (int i = 1; i < samples.size(); i++) {
      ema = EMA_ALPHA * samples.get(i - 1).sessions() + (1 - EMA_ALPHA) * ema;
      double actual = samples.get(i).sessions();
      double percentDiff = Statistics.percentChange(actual, ema);
      if (Math.abs(percentDiff) > percentChangeThreshold) {
        anomalies.add(new Anomaly(
            clientId,
            TRAFFIC_METRIC,
            samples.get(i).date(),
            Math.round(ema),
            actual,
            round(percentDiff, 2),
            null,
            Severity.fromDeviation(Math.abs(percentDiff)),
            percentDiff > 0 ? AnomalyType.SPIKE : AnomalyType.DROP));
      }
    }
    return anomalies;
  }

  // ---- keywords ----

  public List<RankingDrop> detectRankingDrops(long clientId) {
    return detectRankingDrops(clientId, rankingDropThreshold);
  }

  /**
   * Keywords whose latest {@code position_change} is worse than {@code -positionThreshold},
   * largest drop first. Clicks lost compare the two most recent history entries.
   */
  public List<RankingDrop> detectRankingDrops(long clientId, int positionThreshold) {
    LocalDate today = LocalDate.now(clock);
    Set<String> seen = new LinkedHashSet<>();
    List<RankingDrop> drops = new ArrayList<>();
    for (KeywordObservation kw : repository.getTopKeywords(clientId, RANKING_KEYWORDS)) {
      Double change = kw.positionChange();
      if (change == null || change >= -positionThreshold || !seen.add(kw.keyword())) {
        continue;
      }
      List<KeywordObservation> history = repository.getKeywordHistory(clientId, kw.keyword());
      if (history.size() < 2) {
        continue;
      }
      KeywordObservation current = history.get(history.size() - 1);
      KeywordObservation previous = history.get(history.size() - 2);
      double drop = Math.abs(change);
      drops.add(new RankingDrop(
          kw.keyword(),
          current.position(),
          previous.position(),
          drop,
          previous.clicks() - current.clicks(),
          drop > CRITICAL_POSITION_DROP ? Severity.CRITICAL : Severity.HIGH,
          today));
    }
    drops.sort(Comparator.comparingDouble(RankingDrop::positionDrop).reversed());
    return drops;
  }

  public List<CannibalizationIssue> detectKeywordCannibalization(long clientId) {
    return findCannibalization(repository.getTopKeywords(clientId, CANNIBALIZATION_KEYWORDS));
  }

  /**
   * Groups observations by keyword and reports every keyword served by more than one distinct
   * URL. When a URL repeats for a keyword its best position is kept.
   */
  public static List<CannibalizationIssue> findCannibalization(
      List<KeywordObservation> observations) {
    Map<String, Map<String, CompetingUrl>> byKeyword = new LinkedHashMap<>();
    for (KeywordObservation kw : observations) {
      if (kw.url() == null || kw.url().isBlank()) {
        continue;
      }
      CompetingUrl candidate = new CompetingUrl(kw.url(), kw.position(), kw.clicks());
      byKeyword.computeIfAbsent(kw.keyword(), k -> new LinkedHashMap<>())
          .merge(kw.url(), candidate,
              (a, b) -> POSITION_ORDER.compare(a, b) <= 0 ? a : b);
    }

    List<CannibalizationIssue> issues = new ArrayList<>();
    byKeyword.forEach((keyword, urls) -> {
      if (urls.size() < 2) {
        return;
      }
      List<CompetingUrl> ranked = new ArrayList<>(urls.values());
      ranked.sort(POSITION_ORDER);
      issues.add(new CannibalizationIssue(
          keyword,
          ranked.size(),
          ranked.get(0).position(),
          ranked.get(ranked.size() - 1).position(),
          List.copyOf(ranked),
          ranked.size() > 2 ? Severity.HIGH : Severity.MEDIUM));
    });
    return issues;
  }

  private static final Comparator<CompetingUrl> POSITION_ORDER =
      Comparator.comparing(CompetingUrl::position, Comparator.nullsLast(Comparator.naturalOrder()));

  // ---- scans and alerts ----

  public AnalysisResult<AnomalyScanReport> scanAllAnomalies(long clientId) {
    Optional<ClientInfo> client = repository.getClient(clientId);
    if (client.isEmpty()) {
      return AnalysisResult.invalidInput("Client not found: " + clientId);
    }

    Set<String> metricNames = new LinkedHashSet<>();
    for (MetricSample sample : repository.getMetrics(clientId)) {
      if (metricNames.size() == SCANNED_METRICS) {
        break;
      }
      metricNames.add(sample.metricName());
    }
    List<Anomaly> seriesAnomalies = new ArrayList<>();
    for (String metricName : metricNames) {
      seriesAnomalies.addAll(detectMetricAnomalies(clientId, metricName));
    }
    seriesAnomalies.addAll(detectTrafficAnomalies(clientId));
    List<RankingDrop> rankingDrops = detectRankingDrops(clientId);
    List<CannibalizationIssue> cannibalization = detectKeywordCannibalization(clientId);
    List<Anomaly> recent = repository.getRecentAnomalies(clientId, RECENT_ANOMALY_DAYS);

    List<ScanFinding> critical = new ArrayList<>();
    List<ScanFinding> high = new ArrayList<>();
    List<ScanFinding> medium = new ArrayList<>();
    for (Anomaly anomaly : seriesAnomalies) {
      switch (anomaly.severity()) {
        case CRITICAL -> critical.add(anomaly);
        case HIGH -> high.add(anomaly);
        default -> medium.add(anomaly);
      }
    }
    for (RankingDrop drop : rankingDrops) {
      (drop.severity() == Severity.CRITICAL ? critical : high).add(drop);
    }

    ScanSummary summary = new ScanSummary(seriesAnomalies.size(), rankingDrops.size(),
        cannibalization.size(), critical.size(), high.size(), medium.size());
    log.info("Anomaly scan for client {} found {} anomalies, {} ranking drops, {} cannibalized"
            + " keywords ({} critical)", clientId, seriesAnomalies.size(), rankingDrops.size(),
        cannibalization.size(), critical.size());

    return AnalysisResult.ok(new AnomalyScanReport(
        client.get().name(),
        LocalDate.now(clock),
        summary,
        critical,
        high,
        medium,
        List.copyOf(rankingDrops.subList(0, Math.min(REPORTED_RANKING_DROPS, rankingDrops.size()))),
        List.copyOf(cannibalization.subList(0,
            Math.min(REPORTED_CANNIBALIZATION, cannibalization.size()))),
        recent,
        recommendations(critical, high, rankingDrops, cannibalization)));
  }

  public AnalysisResult<List<Alert>> generateAlerts(long clientId) {
    return scanAllAnomalies(clientId).map(AnomalyDetector::alertsFor);
  }

  /**
   * Flattens a scan into alerts: critical series anomalies first, then the five largest ranking
   * drops, then three cannibalized keywords.
   */
  public static List<Alert> alertsFor(AnomalyScanReport scan) {
    List<Alert> alerts = new ArrayList<>();
    for (ScanFinding finding : scan.criticalIssues()) {
      if (finding instanceof Anomaly anomaly) {
        alerts.add(new Alert(
            AlertType.CRITICAL_ANOMALY,
            "Critical " + anomaly.type().label() + " in " + anomaly.metricName(),
            "Detected " + plain(anomaly.deviationPercent()) + "% deviation on " + anomaly.date(),
            AlertAction.IMMEDIATE_INVESTIGATION_REQUIRED,
            1));
      }
    }
    scan.rankingDrops().stream().limit(ALERTED_RANKING_DROPS).forEach(drop -> alerts.add(
        new Alert(
            AlertType.RANKING_DROP,
            "Ranking drop for '" + drop.keyword() + "'",
            "Dropped " + plain(drop.positionDrop()) + " positions (now #"
                + (drop.currentPosition() != null ? plain(drop.currentPosition()) : "n/a") + ")",
            AlertAction.REVIEW_PAGE_AND_COMPETITORS,
            2)));
    scan.cannibalization().stream().limit(ALERTED_CANNIBALIZATION).forEach(issue -> alerts.add(
        new Alert(
            AlertType.CANNIBALIZATION,
            "Keyword cannibalization: '" + issue.keyword() + "'",
            issue.competingUrls() + " URLs competing for this keyword",
            AlertAction.CONSOLIDATE_OR_DIFFERENTIATE_CONTENT,
            3)));
    return alerts;
  }

  static List<String> recommendations(List<ScanFinding> critical, List<ScanFinding> high,
      List<RankingDrop> rankingDrops, List<CannibalizationIssue> cannibalization) {
    List<String> out = new ArrayList<>();
    if (!critical.isEmpty()) {
      out.add("URGENT: Investigate critical anomalies immediately - check for technical issues,"
          + " algorithm updates, or data collection problems");
    }
    if (!rankingDrops.isEmpty()) {
      out.add("Review pages with ranking drops for content quality, technical issues, and"
          + " competitor changes");
    }
    if (!cannibalization.isEmpty()) {
      out.add("Address keyword cannibalization by consolidating similar pages or"
          + " differentiating content focus");
    }
    if (high.size() > HIGH_PRIORITY_BACKLOG) {
      out.add("Multiple high-priority issues detected - prioritize investigation and allocate"
          + " resources accordingly");
    }
    if (critical.isEmpty() && high.isEmpty() && rankingDrops.isEmpty()) {
      out.add("No critical issues detected - continue monitoring trends");
    }
    return out;
  }

  private static String plain(double value) {
    return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
  }
}
