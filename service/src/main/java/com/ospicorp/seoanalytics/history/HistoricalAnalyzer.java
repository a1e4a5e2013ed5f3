package com.ospicorp.seoanalytics.history;

import static com.ospicorp.seoanalytics.stats.Statistics.round;

import com.ospicorp.seoanalytics.common.AnalysisResult;
import com.ospicorp.seoanalytics.model.ClientInfo;
import com.ospicorp.seoanalytics.model.KeywordObservation;
import com.ospicorp.seoanalytics.model.MetricSample;
import com.ospicorp.seoanalytics.model.ReportSnapshot;
import com.ospicorp.seoanalytics.model.Severity;
import com.ospicorp.seoanalytics.model.TrendDirection;
import com.ospicorp.seoanalytics.model.Volatility;
import com.ospicorp.seoanalytics.repository.MetricRepository;
import com.ospicorp.seoanalytics.stats.Statistics;
import com.ospicorp.seoanalytics.stats.TrendClassifier;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Compares current performance with earlier periods: metric deltas, keyword movement and the
 * health score of past reports.
 */
@Service
public class HistoricalAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(HistoricalAnalyzer.class);

  private static final int CURRENT_WINDOW_DAYS = 30;
  private static final int DAYS_PER_YEAR = 365;
  private static final int COMPARED_KEYWORDS = 100;
  private static final int REPORTED_KEYWORD_MOVERS = 10;
  private static final int CONCERN_WINDOW_MONTHS = 3;
  private static final int TOP_IMPROVEMENTS = 10;

  private final MetricRepository repository;
  private final Clock clock;
  private final int keywordDaysBack;
  private final int summaryMonths;

  public HistoricalAnalyzer(MetricRepository repository, Clock clock,
      @Value("${analytics.history.keyword-days-back:30}") int keywordDaysBack,
      @Value("${analytics.history.summary-months:6}") int summaryMonths) {
    this.repository = repository;
    this.clock = clock;
    this.keywordDaysBack = keywordDaysBack;
    this.summaryMonths = summaryMonths;
  }

  // ---- period comparisons ----

  /** Latest sample against the one before it. */
  public AnalysisResult<PeriodComparison> compareMonthOverMonth(long clientId,
      String metricName) {
    List<MetricSample> metrics = repository.getMetrics(clientId, metricName);
    if (metrics.size() < 2) {
      return AnalysisResult.insufficientData("Insufficient data for comparison");
    }
    MetricSample current = metrics.get(0);
    MetricSample previous = metrics.get(1);
    if (previous.value() == 0d) {
      return AnalysisResult.insufficientData("Previous value is zero, change is undefined");
    }
    double change = current.value() - previous.value();
    return AnalysisResult.ok(new PeriodComparison(
        metricName,
        current.value(),
        current.date(),
        previous.value(),
        previous.date(),
        change,
        round(Statistics.percentChange(current.value(), previous.value()), 2),
        TrendDirection.ofChange(change)));
  }

  /** Average of the last 30 days against the average of the same 30 days a year earlier. */
  public AnalysisResult<YearOverYearComparison> compareYearOverYear(long clientId,
      String metricName) {
    LocalDate today = LocalDate.now(clock);
    LocalDate yearAgo = today.minusDays(DAYS_PER_YEAR);
    List<MetricSample> current = repository.getMetrics(clientId, metricName,
        today.minusDays(CURRENT_WINDOW_DAYS), null);
    List<MetricSample> lastYear = repository.getMetrics(clientId, metricName,
        yearAgo.minusDays(CURRENT_WINDOW_DAYS), yearAgo);
    if (current.isEmpty() || lastYear.isEmpty()) {
      return AnalysisResult.insufficientData("Insufficient historical data");
    }
    double currentAvg = Statistics.mean(values(current));
    double yearAgoAvg = Statistics.mean(values(lastYear));
    if (yearAgoAvg == 0d) {
      return AnalysisResult.insufficientData("Year-ago average is zero, change is undefined");
    }
    double change = currentAvg - yearAgoAvg;
    return AnalysisResult.ok(new YearOverYearComparison(
        metricName,
        round(currentAvg, 2),
        round(yearAgoAvg, 2),
        round(change, 2),
        round(Statistics.percentChange(currentAvg, yearAgoAvg), 2),
        TrendDirection.ofChange(change)));
  }

  public AnalysisResult<MetricSummary> getMetricSummary(long clientId, String metricName) {
    return getMetricSummary(clientId, metricName, summaryMonths);
  }

  public AnalysisResult<MetricSummary> getMetricSummary(long clientId, String metricName,
      int months) {
    if (months <= 0) {
      return AnalysisResult.invalidInput("months must be positive, got " + months);
    }
    List<MetricSample> trend = repository.getMetricTrend(clientId, metricName, months);
    if (trend.isEmpty()) {
      return AnalysisResult.insufficientData("No data available");
    }
    double[] values = values(trend);
    return AnalysisResult.ok(new MetricSummary(
        metricName,
        months,
        values[values.length - 1],
        Arrays.stream(values).min().orElseThrow(),
        Arrays.stream(values).max().orElseThrow(),
        round(Statistics.mean(values), 2),
        round(Statistics.sampleStdDev(values), 2),
        TrendClassifier.direction(values),
        TrendClassifier.volatility(values),
        values.length,
        trend));
  }

  // ---- keywords ----

  public AnalysisResult<KeywordTrend> analyzeKeywordTrends(long clientId, String keyword) {
    List<KeywordObservation> history = repository.getKeywordHistory(clientId, keyword);
    if (history.isEmpty()) {
      return AnalysisResult.insufficientData("No historical data for this keyword");
    }
    double[] positions = history.stream()
        .map(KeywordObservation::position)
        .filter(Objects::nonNull)
        .mapToDouble(Double::doubleValue)
        .toArray();
    long totalClicks = history.stream().mapToLong(KeywordObservation::clicks).sum();
    KeywordObservation first = history.get(0);
    KeywordObservation last = history.get(history.size() - 1);
    boolean ranked = positions.length > 0;

    return AnalysisResult.ok(new KeywordTrend(
        keyword,
        first.date(),
        last.date(),
        last.position(),
        ranked ? Arrays.stream(positions).min().getAsDouble() : null,
        ranked ? Arrays.stream(positions).max().getAsDouble() : null,
        ranked ? round(Statistics.mean(positions), 2) : null,
        positions.length > 1 ? positions[0] - positions[positions.length - 1] : 0d,
        totalClicks,
        round((double) totalClicks / history.size(), 2),
        TrendClassifier.direction(positions),
        history));
  }

  public KeywordPeriodReport compareKeywordPeriods(long clientId) {
    return compareKeywordPeriods(clientId, keywordDaysBack);
  }

  /**
   * Compares each top keyword's latest observation with the latest one on or before
   * {@code daysBack} days ago. Keywords tracked for less than that fall back to their earliest
   * observation, which can overstate the movement of newly tracked keywords.
   */
  public KeywordPeriodReport compareKeywordPeriods(long clientId, int daysBack) {
    LocalDate cutoff = LocalDate.now(clock).minusDays(daysBack);
    Set<String> keywords = new LinkedHashSet<>();
    repository.getTopKeywords(clientId, COMPARED_KEYWORDS)
        .forEach(kw -> keywords.add(kw.keyword()));

    List<KeywordComparison> comparisons = new ArrayList<>();
    for (String keyword : keywords) {
      List<KeywordObservation> history = repository.getKeywordHistory(clientId, keyword);
      if (history.size() < 2) {
        continue;
      }
      KeywordObservation current = history.get(history.size() - 1);
      KeywordObservation previous = history.get(0);
      for (int i = history.size() - 2; i >= 0; i--) {
        if (!history.get(i).date().isAfter(cutoff)) {
          previous = history.get(i);
          break;
        }
      }
      double positionChange =
          round(orZero(previous.position()) - orZero(current.position()), 1);
      comparisons.add(new KeywordComparison(
          keyword,
          current.position(),
          previous.position(),
          positionChange,
          current.clicks(),
          previous.clicks(),
          current.clicks() - previous.clicks(),
          KeywordStatus.ofPositionChange(positionChange)));
    }
    comparisons.sort(Comparator.comparingDouble(KeywordComparison::impact).reversed());

    List<KeywordComparison> winners = byStatus(comparisons, KeywordStatus.IMPROVED);
    List<KeywordComparison> losers = byStatus(comparisons, KeywordStatus.DECLINED);
    int stable = comparisons.size() - winners.size() - losers.size();
    return new KeywordPeriodReport(
        daysBack,
        comparisons.size(),
        winners.size(),
        losers.size(),
        stable,
        List.copyOf(winners.subList(0, Math.min(REPORTED_KEYWORD_MOVERS, winners.size()))),
        List.copyOf(losers.subList(0, Math.min(REPORTED_KEYWORD_MOVERS, losers.size()))),
        List.copyOf(comparisons));
  }

  // ---- performance ----

  public AnalysisResult<HealthScoreTrend> calculateHealthScoreTrend(long clientId) {
    return calculateHealthScoreTrend(clientId, summaryMonths);
  }

  /** Health scores of the last {@code months} reports; reports without a score are skipped. */
  public AnalysisResult<HealthScoreTrend> calculateHealthScoreTrend(long clientId, int months) {
    List<HealthScorePoint> scores = new ArrayList<>();
    for (ReportSnapshot report : repository.getReports(clientId, months)) {
      if (report.healthScore() != null) {
        scores.add(new HealthScorePoint(report.reportDate(), report.healthScore()));
      }
    }
    if (scores.isEmpty()) {
      return AnalysisResult.insufficientData("No health score data available");
    }
    double[] newestFirst = scores.stream().mapToDouble(HealthScorePoint::score).toArray();
    double[] chronological = newestFirst.clone();
    reverse(chronological);

    return AnalysisResult.ok(new HealthScoreTrend(
        newestFirst[0],
        round(Statistics.mean(newestFirst), 2),
        Arrays.stream(newestFirst).max().getAsDouble(),
        Arrays.stream(newestFirst).min().getAsDouble(),
        newestFirst[0] - newestFirst[newestFirst.length - 1],
        TrendClassifier.direction(chronological),
        List.copyOf(scores)));
  }

  public List<MetricImprovement> identifyTopImprovements(long clientId) {
    return identifyTopImprovements(clientId, TOP_IMPROVEMENTS);
  }

  /** Month-over-month movers ordered by the size of their percent change, either direction. */
  public List<MetricImprovement> identifyTopImprovements(long clientId, int limit) {
    List<MetricImprovement> improvements = new ArrayList<>();
    for (String metricName : metricNames(clientId)) {
      AnalysisResult<PeriodComparison> comparison = compareMonthOverMonth(clientId, metricName);
      if (!comparison.isOk() || comparison.value().changePercent() == 0d) {
        continue;
      }
      PeriodComparison c = comparison.value();
      improvements.add(
          new MetricImprovement(metricName, c.changePercent(), c.change(), c.currentValue()));
    }
    improvements.sort(
        Comparator.comparingDouble((MetricImprovement i) -> Math.abs(i.changePercent()))
            .reversed());
    return improvements.size() > limit
        ? new ArrayList<>(improvements.subList(0, limit))
        : improvements;
  }

  /** Metrics trending down over the last three months; high volatility escalates severity. */
  public List<ConcerningTrend> identifyConcerningTrends(long clientId) {
    List<ConcerningTrend> concerns = new ArrayList<>();
    for (String metricName : metricNames(clientId)) {
      Optional<MetricSummary> summary =
          getMetricSummary(clientId, metricName, CONCERN_WINDOW_MONTHS).toOptional();
      if (summary.isEmpty() || summary.get().trendDirection() != TrendDirection.DOWN) {
        continue;
      }
      MetricSummary s = summary.get();
      concerns.add(new ConcerningTrend(
          metricName,
          s.trendDirection(),
          s.volatility(),
          s.volatility() == Volatility.HIGH ? Severity.HIGH : Severity.MEDIUM,
          s.currentValue(),
          s.averageValue()));
    }
    concerns.sort(Comparator.comparing(ConcerningTrend::severity).reversed());
    return concerns;
  }

  // ---- reporting ----

  public AnalysisResult<TrendReport> generateTrendReport(long clientId) {
    Optional<ClientInfo> client = repository.getClient(clientId);
    if (client.isEmpty()) {
      return AnalysisResult.invalidInput("Client not found: " + clientId);
    }
    AnalysisResult<HealthScoreTrend> health = calculateHealthScoreTrend(clientId);
    List<MetricImprovement> improvements = identifyTopImprovements(clientId);
    List<ConcerningTrend> concerns = identifyConcerningTrends(clientId);
    KeywordPeriodReport keywords = compareKeywordPeriods(clientId);

    int positive = (int) improvements.stream().filter(i -> i.changePercent() > 0).count();
    TrendSummary summary = new TrendSummary(
        improvements.size() + concerns.size(),
        positive,
        concerns.size(),
        improvements.size() > concerns.size() ? OverallHealth.IMPROVING : OverallHealth.DECLINING);
    log.info("Trend report for client {}: {} movers, {} concerning trends, {} keywords compared",
        clientId, improvements.size(), concerns.size(), keywords.totalKeywords());

    return AnalysisResult.ok(new TrendReport(
        client.get().name(),
        LocalDate.now(clock),
        health.toOptional().orElse(null),
        improvements,
        concerns,
        KeywordPerformance.of(keywords),
        summary));
  }

  // Distinct metric names, most recently recorded first.
  private Set<String> metricNames(long clientId) {
    Set<String> names = new LinkedHashSet<>();
    repository.getMetrics(clientId).forEach(m -> names.add(m.metricName()));
    return names;
  }

  private static List<KeywordComparison> byStatus(List<KeywordComparison> comparisons,
      KeywordStatus status) {
    return comparisons.stream().filter(c -> c.status() == status).toList();
  }

  private static double[] values(List<MetricSample> samples) {
    return samples.stream().mapToDouble(MetricSample::value).toArray();
  }

  private static double orZero(Double value) {
    return value != null ? value : 0d;
  }

  private static void reverse(double[] values) {
    for (int i = 0, j = values.length - 1; i < j; i++, j--) {
      double tmp = values[i];
      values[i] = values[j];
      values[j] = tmp;
    }
  }
}
