package com.ospicorp.seoanalytics.insights;

import static com.ospicorp.seoanalytics.support.TestData.CLOCK;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.seoanalytics.anomaly.AlertType;
import com.ospicorp.seoanalytics.anomaly.AnomalyDetector;
import com.ospicorp.seoanalytics.common.AnalysisResult;
import com.ospicorp.seoanalytics.common.ErrorKind;
import com.ospicorp.seoanalytics.forecast.Forecaster;
import com.ospicorp.seoanalytics.history.HistoricalAnalyzer;
import com.ospicorp.seoanalytics.prioritization.PrioritizationEngine;
import com.ospicorp.seoanalytics.prioritization.RecommendationRecord;
import com.ospicorp.seoanalytics.support.InMemoryMetricRepository;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;

class ClientInsightsServiceTest {

  private InMemoryMetricRepository repository;
  private ClientInsightsService service;

  @BeforeEach
  void setUp() {
    repository = new InMemoryMetricRepository(CLOCK)
        .addClient(1L, "Acme Shoes")
        .addClient(2L, "Globex")
        .addDailyMetric(1L, "clicks", 100, 102, 98, 101, 99, 103, 97, 250)
        .makeUnavailable(2L);
    service = new ClientInsightsService(
        repository,
        new Forecaster(repository, CLOCK, 6, 90, 30),
        new AnomalyDetector(repository, CLOCK, 2.5, 30, 90, 30, 5),
        new HistoricalAnalyzer(repository, CLOCK, 30, 6),
        new PrioritizationEngine());
  }

  @Test
  void assemblesSectionsForKnownClient() {
    ClientInsights insights = service.analyze(1L).orElseThrow();

    assertThat(insights.clientName()).isEqualTo("Acme Shoes");
    assertThat(insights.forecasts().clientId()).isEqualTo(1L);
    assertThat(insights.anomalyScan().summary().criticalCount()).isEqualTo(1);
    assertThat(insights.alerts()).singleElement()
        .satisfies(a -> {
          assertThat(a.type()).isEqualTo(AlertType.CRITICAL_ANOMALY);
          assertThat(a.priority()).isEqualTo(1);
        });
    assertThat(insights.trendReport().clientName()).isEqualTo("Acme Shoes");
    assertThat(insights.recommendations()).isNull();
    assertThat(insights.prioritySummary()).isNull();
  }

  @Test
  void ranksSuppliedRecommendations() {
    List<RecommendationRecord> recs = List.of(
        RecommendationRecord.of("Build backlinks", "High", "6 months", "Low", ""),
        RecommendationRecord.of("Optimize product pages", "Low", "2 weeks", "High",
            "+300 clicks, $15,000 revenue"));

    ClientInsights insights = service.analyze(1L, recs).orElseThrow();

    assertThat(insights.recommendations())
        .extracting(r -> r.recommendation().recommendation())
        .containsExactly("Optimize product pages", "Build backlinks");
    assertThat(insights.prioritySummary().topPriority()).isEqualTo("Optimize product pages");
  }

  @Test
  void unknownClientIsInvalidInput() {
    AnalysisResult<ClientInsights> result = service.analyze(42L);

    assertThat(result.hasError(ErrorKind.INVALID_INPUT)).isTrue();
    assertThat(result.error().reason()).isEqualTo("Client not found: 42");
  }

  @Test
  void singleAnalysisLetsRepositoryFailuresPropagate() {
    assertThatThrownBy(() -> service.analyze(2L)).isInstanceOf(DataAccessException.class);
  }

  @Test
  void batchIsolatesFailingClient() {
    Map<Long, AnalysisResult<ClientInsights>> results =
        service.analyzeClients(List.of(2L, 1L, 42L));

    assertThat(results).containsOnlyKeys(2L, 1L, 42L);
    assertThat(results.keySet()).containsExactly(2L, 1L, 42L);

    AnalysisResult<ClientInsights> failed = results.get(2L);
    assertThat(failed.hasError(ErrorKind.UPSTREAM_FAILURE)).isTrue();
    assertThat(failed.error().reason())
        .isEqualTo("Data access failed: DataAccessResourceFailureException");

    assertThat(results.get(1L).isOk()).isTrue();
    assertThat(results.get(42L).hasError(ErrorKind.INVALID_INPUT)).isTrue();
  }
}
