package com.ospicorp.seoanalytics.anomaly;

import static com.ospicorp.seoanalytics.support.TestData.CLOCK;
import static com.ospicorp.seoanalytics.support.TestData.TODAY;
import static com.ospicorp.seoanalytics.support.TestData.keyword;
import static com.ospicorp.seoanalytics.support.TestData.series;
import static com.ospicorp.seoanalytics.support.TestData.sessions;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ospicorp.seoanalytics.common.AnalysisResult;
import com.ospicorp.seoanalytics.common.ErrorKind;
import com.ospicorp.seoanalytics.model.Anomaly;
import com.ospicorp.seoanalytics.model.AnomalyType;
import com.ospicorp.seoanalytics.model.Severity;
import com.ospicorp.seoanalytics.support.InMemoryMetricRepository;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnomalyDetectorTest {

  private static final double[] SPIKE = {100, 102, 98, 101, 99, 103, 97, 250};

  private InMemoryMetricRepository repository;
  private AnomalyDetector detector;

  @BeforeEach
  void setUp() {
    repository = new InMemoryMetricRepository(CLOCK).addClient(1L, "Acme Shoes");
    detector = new AnomalyDetector(repository, CLOCK, 2.5, 30, 90, 30, 5);
  }

  @Test
  void flagsSpikeAgainstPrecedingWeek() {
    List<Anomaly> anomalies = detector.findMetricAnomalies(1L, "clicks", series("clicks", SPIKE));

    assertThat(anomalies).hasSize(1);
    Anomaly spike = anomalies.get(0);
    assertThat(spike.date()).isEqualTo(TODAY);
    assertThat(spike.type()).isEqualTo(AnomalyType.SPIKE);
    assertThat(spike.expectedValue()).isCloseTo(100d, within(0.01));
    assertThat(spike.actualValue()).isEqualTo(250d);
    assertThat(spike.deviationPercent()).isCloseTo(150d, within(0.01));
    assertThat(spike.zScore()).isCloseTo(2.64d, within(0.01));
    assertThat(spike.severity()).isEqualTo(Severity.CRITICAL);
  }

  @Test
  void repositoryScanSortsChronologicallyAndRecordsFindings() {
    repository.addDailyMetric(1L, "clicks", SPIKE);

    List<Anomaly> anomalies = detector.detectMetricAnomalies(1L, "clicks");

    assertThat(anomalies).singleElement()
        .satisfies(a -> assertThat(a.expectedValue()).isCloseTo(100d, within(0.01)));
    assertThat(repository.savedAnomalies()).containsExactlyElementsOf(anomalies);
  }

  @Test
  void shortSeriesYieldsNothing() {
    assertThat(detector.findMetricAnomalies(1L, "clicks",
        series("clicks", 100, 100, 100, 100, 100, 900))).isEmpty();
    assertThat(detector.findMetricAnomalies(1L, "clicks", List.of())).isEmpty();
  }

  @Test
  void constantSeriesYieldsNothing() {
    assertThat(detector.findMetricAnomalies(1L, "clicks",
        series("clicks", 5, 5, 5, 5, 5, 5, 5, 5, 5))).isEmpty();
  }

  @Test
  void earlyOutlierUsesWindowMeanAsExpectation() {
    double[] values = {10, 200, 10, 10, 10, 10, 10, 10, 10, 10, 10, 10};

    List<Anomaly> anomalies = detector.findMetricAnomalies(1L, "sessions",
        series("sessions", values));

    assertThat(anomalies).singleElement().satisfies(a -> {
      assertThat(a.expectedValue()).isCloseTo(25.83d, within(0.01));
      assertThat(a.type()).isEqualTo(AnomalyType.SPIKE);
    });
  }

  @Test
  void trafficJumpIsFlaggedAgainstMovingAverage() {
    List<Anomaly> anomalies = detector.findTrafficAnomalies(1L,
        sessions(100, 100, 100, 100, 100, 100, 100, 100, 200, 100));

    assertThat(anomalies).singleElement().satisfies(a -> {
      assertThat(a.metricName()).isEqualTo(AnomalyDetector.TRAFFIC_METRIC);
      assertThat(a.date()).isEqualTo(TODAY.minusDays(1));
      assertThat(a.expectedValue()).isEqualTo(100d);
      assertThat(a.deviationPercent()).isEqualTo(100d);
      assertThat(a.zScore()).isNull();
      assertThat(a.type()).isEqualTo(AnomalyType.SPIKE);
      assertThat(a.severity()).isEqualTo(Severity.CRITICAL);
    });
  }

  @Test
  void trafficDropIsFlaggedAndRecorded() {
    repository.addDailySessions(1L, 1000, 1000, 1000, 1000, 1000, 1000, 1000, 400);

    List<Anomaly> anomalies = detector.detectTrafficAnomalies(1L);

    assertThat(anomalies).singleElement().satisfies(a -> {
      assertThat(a.type()).isEqualTo(AnomalyType.DROP);
      assertThat(a.deviationPercent()).isEqualTo(-60d);
    });
    assertThat(repository.savedAnomalies()).hasSize(1);
  }

  @Test
  void shortTrafficSeriesYieldsNothing() {
    assertThat(detector.findTrafficAnomalies(1L, sessions(100, 100, 100, 100, 100, 900)))
        .isEmpty();
    assertThat(detector.findTrafficAnomalies(1L, List.of())).isEmpty();

    repository.addDailySessions(1L, 100, 100, 100, 100, 100, 900);

    assertThat(detector.detectTrafficAnomalies(1L)).isEmpty();
    assertThat(repository.savedAnomalies()).isEmpty();
  }

  @Test
  void rankingDropUsesPositionChangeField() {
    addHistory("running shoes", new double[] {5, 6, 7, 15, 16}, new long[] {50, 48, 44, 10, 9},
        -9d);

    List<RankingDrop> drops = detector.detectRankingDrops(1L);

    assertThat(drops).singleElement().satisfies(d -> {
      assertThat(d.keyword()).isEqualTo("running shoes");
      assertThat(d.positionDrop()).isEqualTo(9d);
      assertThat(d.severity()).isEqualTo(Severity.HIGH);
      assertThat(d.currentPosition()).isEqualTo(16d);
      assertThat(d.previousPosition()).isEqualTo(15d);
      assertThat(d.clicksLost()).isEqualTo(1L);
      assertThat(d.detectedAt()).isEqualTo(TODAY);
    });
  }

  @Test
  void rankingDropsAreSortedAndThresholded() {
    addHistory("boots", new double[] {3, 15}, new long[] {80, 20}, -12d);
    addHistory("sandals", new double[] {4, 10}, new long[] {30, 25}, -6d);
    addHistory("slippers", new double[] {8, 13}, new long[] {12, 10}, -5d);

    List<RankingDrop> drops = detector.detectRankingDrops(1L);

    assertThat(drops).extracting(RankingDrop::keyword).containsExactly("boots", "sandals");
    assertThat(drops.get(0).severity()).isEqualTo(Severity.CRITICAL);
    assertThat(drops.get(0).clicksLost()).isEqualTo(60L);
    assertThat(detector.detectRankingDrops(1L, 4)).hasSize(3);
  }

  @Test
  void twoUrlsForOneKeywordIsMediumCannibalization() {
    List<CannibalizationIssue> issues = AnomalyDetector.findCannibalization(List.of(
        keyword(1L, "buy shoes", 4d, null, 30, TODAY, "/a"),
        keyword(1L, "buy shoes", 9d, null, 12, TODAY, "/b"),
        keyword(1L, "red shoes", 2d, null, 50, TODAY, "/red")));

    assertThat(issues).singleElement().satisfies(issue -> {
      assertThat(issue.keyword()).isEqualTo("buy shoes");
      assertThat(issue.competingUrls()).isEqualTo(2);
      assertThat(issue.severity()).isEqualTo(Severity.MEDIUM);
      assertThat(issue.bestPosition()).isEqualTo(4d);
      assertThat(issue.worstPosition()).isEqualTo(9d);
    });
  }

  @Test
  void threeUrlsIsHighAndUnrankedUrlsSortLast() {
    repository.addKeyword(keyword(1L, "shoes", null, null, 5, TODAY, "/c"))
        .addKeyword(keyword(1L, "shoes", 12d, null, 8, TODAY, "/b"))
        .addKeyword(keyword(1L, "shoes", 3d, null, 40, TODAY, "/a"))
        .addKeyword(keyword(1L, "shoes", 7d, null, 2, TODAY, "/a"));

    List<CannibalizationIssue> issues = detector.detectKeywordCannibalization(1L);

    assertThat(issues).singleElement().satisfies(issue -> {
      assertThat(issue.competingUrls()).isEqualTo(3);
      assertThat(issue.severity()).isEqualTo(Severity.HIGH);
      assertThat(issue.urls()).extracting(CompetingUrl::url).containsExactly("/a", "/b", "/c");
      assertThat(issue.worstPosition()).isNull();
    });
  }

  @Test
  void scanRejectsUnknownClient() {
    AnalysisResult<AnomalyScanReport> result = detector.scanAllAnomalies(99L);

    assertThat(result.hasError(ErrorKind.INVALID_INPUT)).isTrue();
  }

  @Test
  void quietClientGetsAllClearRecommendation() {
    repository.addDailyMetric(1L, "clicks", 10, 11, 10, 12, 11, 10, 11, 12);

    AnomalyScanReport report = detector.scanAllAnomalies(1L).orElseThrow();

    assertThat(report.clientName()).isEqualTo("Acme Shoes");
    assertThat(report.scanDate()).isEqualTo(TODAY);
    assertThat(report.summary().totalAnomalies()).isZero();
    assertThat(report.recommendations())
        .containsExactly("No critical issues detected - continue monitoring trends");
  }

  @Test
  void scanBucketsFindingsAndBuildsAlerts() {
    repository.addDailyMetric(1L, "clicks", SPIKE)
        .addAnomaly(new Anomaly(1L, "ctr", TODAY.minusDays(2), 3, 1, -66.67, null,
            Severity.CRITICAL, AnomalyType.DROP));
    addHistory("boots", new double[] {3, 15}, new long[] {80, 20}, -12d);
    addHistory("sandals", new double[] {4, 10}, new long[] {30, 25}, -6d);
    repository.addKeyword(keyword(1L, "sneakers", 6d, null, 15, TODAY, "/sneakers"))
        .addKeyword(keyword(1L, "sneakers", 11d, null, 4, TODAY, "/sale/sneakers"));

    AnomalyScanReport report = detector.scanAllAnomalies(1L).orElseThrow();

    assertThat(report.summary().totalAnomalies()).isEqualTo(1);
    assertThat(report.summary().rankingDrops()).isEqualTo(2);
    assertThat(report.summary().cannibalizationIssues()).isEqualTo(1);
    assertThat(report.criticalIssues()).hasSize(2);
    assertThat(report.highPriority()).singleElement().isInstanceOf(RankingDrop.class);
    assertThat(report.mediumPriority()).isEmpty();
    assertThat(report.recentAnomalies()).extracting(Anomaly::metricName).contains("ctr");
    assertThat(report.recommendations()).hasSize(3)
        .noneMatch(r -> r.startsWith("No critical issues"));
    assertThat(report.recommendations().get(0)).startsWith("URGENT");

    List<Alert> alerts = AnomalyDetector.alertsFor(report);

    assertThat(alerts).extracting(Alert::type).containsExactly(
        AlertType.CRITICAL_ANOMALY, AlertType.RANKING_DROP, AlertType.RANKING_DROP,
        AlertType.CANNIBALIZATION);
    assertThat(alerts).extracting(Alert::priority).containsExactly(1, 2, 2, 3);
    assertThat(alerts.get(0).title()).isEqualTo("Critical spike in clicks");
    assertThat(alerts.get(0).action()).isEqualTo(AlertAction.IMMEDIATE_INVESTIGATION_REQUIRED);
    assertThat(alerts.get(1).message()).isEqualTo("Dropped 12 positions (now #15)");
    assertThat(alerts.get(3).action()).isEqualTo(AlertAction.CONSOLIDATE_OR_DIFFERENTIATE_CONTENT);
  }

  @Test
  void generateAlertsPropagatesScanErrors() {
    assertThat(detector.generateAlerts(42L).hasError(ErrorKind.INVALID_INPUT)).isTrue();
  }

  // History ending today; the latest observation carries the position change.
  private void addHistory(String kw, double[] positions, long[] clicks, double latestChange) {
    int n = positions.length;
    for (int i = 0; i < n; i++) {
      Double change = i == n - 1 ? latestChange : null;
      repository.addKeyword(keyword(1L, kw, positions[i], change, clicks[i],
          TODAY.minusDays(n - 1 - i), "/" + kw.replace(' ', '-')));
    }
  }
}
