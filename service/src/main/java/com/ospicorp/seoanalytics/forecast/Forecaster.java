package com.ospicorp.seoanalytics.forecast;

import static com.ospicorp.seoanalytics.stats.Statistics.round;

import com.ospicorp.seoanalytics.common.AnalysisError;
import com.ospicorp.seoanalytics.common.AnalysisResult;
import com.ospicorp.seoanalytics.model.ForecastPoint;
import com.ospicorp.seoanalytics.model.KeywordObservation;
import com.ospicorp.seoanalytics.model.MetricSample;
import com.ospicorp.seoanalytics.model.ModelType;
import com.ospicorp.seoanalytics.model.TrafficSample;
import com.ospicorp.seoanalytics.model.TrendDirection;
import com.ospicorp.seoanalytics.repository.MetricRepository;
import com.ospicorp.seoanalytics.stats.LinearFit;
import com.ospicorp.seoanalytics.stats.Statistics;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Projects metric, keyword position and traffic series forward.
 *
 * <p>Every mode reports unmet preconditions as an {@link AnalysisResult} error instead of
 * throwing; repository exceptions propagate.
 */
@Service
public class Forecaster {

  private static final Logger log = LoggerFactory.getLogger(Forecaster.class);

  static final String TRAFFIC_METRIC = "traffic_sessions";
  private static final int MIN_LINEAR_POINTS = 3;
  private static final int MIN_KEYWORD_POSITIONS = 5;
  private static final int KEYWORD_TREND_WINDOW = 10;
  private static final int MIN_TRAFFIC_SAMPLES = 7;
  private static final int MIN_SEASONAL_SAMPLES = 14;
  private static final int WEEK = 7;
  private static final int SUMMARY_HORIZON = 30;
  private static final double MIN_POSITION = 1d;
  private static final double MAX_POSITION = 100d;
  private static final double Z_95 = 1.96d;

  private final MetricRepository repository;
  private final Clock clock;
  private final int trendMonths;
  private final int trafficLookbackDays;
  private final int returnedPoints;

  public Forecaster(MetricRepository repository, Clock clock,
      @Value("${analytics.forecast.trend-months:6}") int trendMonths,
      @Value("${analytics.forecast.traffic-lookback-days:90}") int trafficLookbackDays,
      @Value("${analytics.forecast.returned-points:30}") int returnedPoints) {
    this.repository = repository;
    this.clock = clock;
    this.trendMonths = trendMonths;
    this.trafficLookbackDays = trafficLookbackDays;
    this.returnedPoints = returnedPoints;
  }

  // ---- linear regression ----

  public AnalysisResult<LinearForecast> forecastLinear(long clientId, String metricName) {
    return forecastLinear(clientId, metricName, 90);
  }

  public AnalysisResult<LinearForecast> forecastLinear(long clientId, String metricName,
      int daysAhead) {
    if (metricName == null || metricName.isBlank()) {
      return AnalysisResult.invalidInput("metric name must be provided");
    }
    List<MetricSample> trend = repository.getMetricTrend(clientId, metricName, trendMonths);
    AnalysisResult<List<ForecastPoint>> points = projectLinear(trend, daysAhead);
    if (!points.isOk()) {
      log.debug("No linear forecast for client {} metric {}: {}", clientId, metricName,
          points.error().reason());
      return AnalysisResult.failure(points.error().kind(), points.error().reason());
    }
    repository.saveForecast(clientId, metricName, points.value());
    LinearFit fit = LinearFit.of(values(trend));
    return AnalysisResult.ok(toLinearForecast(metricName, fit, points.value()));
  }

  /** Linear forecast over an already loaded series (oldest first), without recording it. */
  public AnalysisResult<LinearForecast> forecastLinear(String metricName,
      List<MetricSample> trend, int daysAhead) {
    return projectLinear(trend, daysAhead)
        .map(points -> toLinearForecast(metricName, LinearFit.of(values(trend)), points));
  }

  private AnalysisResult<List<ForecastPoint>> projectLinear(List<MetricSample> trend,
      int daysAhead) {
    if (daysAhead <= 0) {
      return AnalysisResult.invalidInput("days ahead must be positive, got " + daysAhead);
    }
    if (trend.size() < MIN_LINEAR_POINTS) {
      return AnalysisResult.insufficientData("Insufficient data for forecasting");
    }
    LinearFit fit = LinearFit.of(values(trend));
    LocalDate lastDate = trend.get(trend.size() - 1).date();
    int n = trend.size();

    List<ForecastPoint> points = new ArrayList<>(daysAhead);
    for (int day = 1; day <= daysAhead; day++) {
      int x = n + day - 1;
      double raw = fit.predict(x);
      double margin = fit.margin(x);
      double predicted = Math.max(0d, round(raw, 2));
      double low = Math.max(0d, round(raw - margin, 2));
      double high = Math.max(predicted, round(raw + margin, 2));
      points.add(new ForecastPoint(lastDate.plusDays(day), predicted, low, high, ModelType.LINEAR));
    }
    return AnalysisResult.ok(points);
  }

  private LinearForecast toLinearForecast(String metricName, LinearFit fit,
      List<ForecastPoint> points) {
    return new LinearForecast(
        metricName,
        "linear_regression",
        round(fit.rSquared(), 3),
        ForecastConfidence.fromRSquared(fit.rSquared()),
        round(fit.slope(), 4),
        ForecastTrend.ofSlope(fit.slope()),
        List.copyOf(points.subList(0, Math.min(returnedPoints, points.size()))),
        points.size());
  }

  // ---- moving average ----

  public AnalysisResult<MovingAverageForecast> forecastMovingAverage(long clientId,
      String metricName) {
    return forecastMovingAverage(clientId, metricName, 7, 30);
  }

  public AnalysisResult<MovingAverageForecast> forecastMovingAverage(long clientId,
      String metricName, int window, int daysAhead) {
    if (metricName == null || metricName.isBlank()) {
      return AnalysisResult.invalidInput("metric name must be provided");
    }
    List<MetricSample> trend = repository.getMetricTrend(clientId, metricName, trendMonths);
    AnalysisResult<MovingAverageForecast> result =
        forecastMovingAverage(metricName, trend, window, daysAhead);
    result.toOptional()
        .ifPresent(f -> repository.saveForecast(clientId, metricName, f.forecasts()));
    return result;
  }

  /** Flat projection of the mean of the last {@code window} points. */
  public AnalysisResult<MovingAverageForecast> forecastMovingAverage(String metricName,
      List<MetricSample> trend, int window, int daysAhead) {
    if (window <= 0 || daysAhead <= 0) {
      return AnalysisResult.invalidInput("window and days ahead must be positive");
    }
    if (trend.size() < window) {
      return AnalysisResult.insufficientData("Need at least " + window + " data points");
    }
    double[] recent = values(trend.subList(trend.size() - window, trend.size()));
    double baseline = Statistics.mean(recent);
    double band = Z_95 * Statistics.sampleStdDev(recent);
    LocalDate lastDate = trend.get(trend.size() - 1).date();

    double predicted = Math.max(0d, round(baseline, 2));
    double low = Math.max(0d, round(baseline - band, 2));
    double high = Math.max(predicted, round(baseline + band, 2));
    List<ForecastPoint> points = new ArrayList<>(daysAhead);
    for (int day = 1; day <= daysAhead; day++) {
      points.add(new ForecastPoint(lastDate.plusDays(day), predicted, low, high,
          ModelType.MOVING_AVERAGE));
    }
    return AnalysisResult.ok(new MovingAverageForecast(metricName, "moving_average", window,
        round(baseline, 2), points));
  }

  // ---- keyword position ----

  public AnalysisResult<KeywordPositionForecast> forecastKeywordPosition(long clientId,
      String keyword) {
    return forecastKeywordPosition(clientId, keyword, 30);
  }

  public AnalysisResult<KeywordPositionForecast> forecastKeywordPosition(long clientId,
      String keyword, int daysAhead) {
    if (keyword == null || keyword.isBlank()) {
      return AnalysisResult.invalidInput("keyword must be provided");
    }
    return forecastKeywordPosition(keyword, repository.getKeywordHistory(clientId, keyword),
        daysAhead);
  }

  /**
   * Extrapolates the average daily position change of the last ten observations, keeping every
   * projected rank within [1, 100].
   */
  public AnalysisResult<KeywordPositionForecast> forecastKeywordPosition(String keyword,
      List<KeywordObservation> history, int daysAhead) {
    if (daysAhead <= 0) {
      return AnalysisResult.invalidInput("days ahead must be positive, got " + daysAhead);
    }
    double[] positions = history.stream()
        .map(KeywordObservation::position)
        .filter(Objects::nonNull)
        .mapToDouble(Double::doubleValue)
        .toArray();
    if (positions.length < MIN_KEYWORD_POSITIONS) {
      return AnalysisResult.insufficientData("Insufficient keyword history");
    }

    int from = Math.max(0, positions.length - KEYWORD_TREND_WINDOW);
    int count = positions.length - from;
    double totalChange = positions[positions.length - 1] - positions[from];
    double dailyChange = totalChange / count;

    double current = positions[positions.length - 1];
    LocalDate lastDate = history.get(history.size() - 1).date();
    List<PositionForecastPoint> points = new ArrayList<>(daysAhead);
    double projected = current;
    for (int day = 1; day <= daysAhead; day++) {
      projected = Math.max(MIN_POSITION, Math.min(MAX_POSITION, projected + dailyChange));
      points.add(new PositionForecastPoint(lastDate.plusDays(day), round(projected, 1),
          ForecastConfidence.MEDIUM));
    }

    Double at30 = points.size() >= SUMMARY_HORIZON
        ? points.get(SUMMARY_HORIZON - 1).predictedPosition()
        : null;
    double expectedChange = at30 != null ? round(at30 - current, 1) : 0d;
    return AnalysisResult.ok(new KeywordPositionForecast(keyword, current,
        round(dailyChange, 4), at30, expectedChange, TrendDirection.ofChange(totalChange),
        points));
  }

  // ---- seasonal traffic ----

  public AnalysisResult<TrafficForecast> forecastTraffic(long clientId) {
    return forecastTraffic(clientId, 90);
  }

  public AnalysisResult<TrafficForecast> forecastTraffic(long clientId, int daysAhead) {
    List<TrafficSample> samples = repository.getTrafficTrend(clientId, trafficLookbackDays);
    AnalysisResult<TrafficForecast> result = projectTraffic(samples, daysAhead);
    result.toOptional()
        .ifPresent(f -> repository.saveForecast(clientId, TRAFFIC_METRIC, f.forecasts()));
    return result.map(this::trimmed);
  }

  /**
   * Linear sessions trend scaled by a day-of-week factor. The weekday of a point is its index
   * modulo 7, continued past the end of the history; with fewer than 14 samples every factor
   * is 1.0.
   */
  public AnalysisResult<TrafficForecast> forecastTraffic(List<TrafficSample> samples,
      int daysAhead) {
    return projectTraffic(samples, daysAhead).map(this::trimmed);
  }

  // every projected point; callers trim after recording
  private AnalysisResult<TrafficForecast> projectTraffic(List<TrafficSample> samples,
      int daysAhead) {
    if (daysAhead <= 0) {
      return AnalysisResult.invalidInput("days ahead must be positive, got " + daysAhead);
    }
    if (samples.size() < MIN_TRAFFIC_SAMPLES) {
      return AnalysisResult.insufficientData("Insufficient traffic data");
    }
    double[] sessions = samples.stream().mapToDouble(TrafficSample::sessions).toArray();
    int n = sessions.length;
    LinearFit fit = LinearFit.of(sessions);
    boolean seasonal = n >= MIN_SEASONAL_SAMPLES;
    double[] factors = seasonal ? weeklyFactors(sessions) : flatFactors();

    LocalDate lastDate = samples.get(n - 1).date();
    List<ForecastPoint> points = new ArrayList<>(daysAhead);
    for (int day = 1; day <= daysAhead; day++) {
      int x = n + day - 1;
      double factor = factors[x % WEEK];
      double base = fit.predict(x);
      double margin = fit.margin(x);
      double predicted = Math.max(0d, Math.round(base * factor));
      double low = Math.max(0d, Math.round((base - margin) * factor));
      double high = Math.max(predicted, Math.round((base + margin) * factor));
      points.add(new ForecastPoint(lastDate.plusDays(day), predicted, low, high,
          ModelType.SEASONAL_LINEAR));
    }

    double currentAvg = Statistics.mean(tail(sessions, WEEK));
    double forecastAvg = 0d;
    double growthRate = 0d;
    if (points.size() >= SUMMARY_HORIZON) {
      forecastAvg = points.subList(0, SUMMARY_HORIZON).stream()
          .mapToDouble(ForecastPoint::predictedValue).average().orElse(0d);
      growthRate = Statistics.percentChange(forecastAvg, currentAvg);
    }

    List<Double> factorList = new ArrayList<>(WEEK);
    for (double f : factors) {
      factorList.add(round(f, 4));
    }
    return AnalysisResult.ok(new TrafficForecast(
        Math.round(currentAvg),
        Math.round(forecastAvg),
        round(growthRate, 2),
        ForecastTrend.ofSlope(fit.slope()),
        seasonal,
        factorList,
        List.copyOf(points),
        points.size()));
  }

  private TrafficForecast trimmed(TrafficForecast full) {
    List<ForecastPoint> points = full.forecasts();
    return new TrafficForecast(
        full.currentDailyAvg(),
        full.forecastedDailyAvg30d(),
        full.expectedGrowthRate(),
        full.trend(),
        full.seasonalityDetected(),
        full.seasonalFactors(),
        List.copyOf(points.subList(0, Math.min(returnedPoints, points.size()))),
        full.totalForecasts());
  }

  private static double[] weeklyFactors(double[] values) {
    double overall = Statistics.mean(values);
    double[] sums = new double[WEEK];
    int[] counts = new int[WEEK];
    for (int i = 0; i < values.length; i++) {
      sums[i % WEEK] += values[i];
      counts[i % WEEK]++;
    }
    double[] factors = new double[WEEK];
    for (int d = 0; d < WEEK; d++) {
      factors[d] = (overall == 0d || counts[d] == 0) ? 1d : (sums[d] / counts[d]) / overall;
    }
    return factors;
  }

  private static double[] flatFactors() {
    double[] factors = new double[WEEK];
    Arrays.fill(factors, 1d);
    return factors;
  }

  // ---- batch ----

  public ForecastBatch forecastAllMetrics(long clientId) {
    return forecastAllMetrics(clientId, 90);
  }

  /** Linear forecasts for every tracked metric with enough history, plus organic traffic. */
  public ForecastBatch forecastAllMetrics(long clientId, int daysAhead) {
    Set<String> metricNames = new LinkedHashSet<>();
    for (MetricSample sample : repository.getMetrics(clientId)) {
      metricNames.add(sample.metricName());
    }

    Map<String, LinearForecast> forecasts = new LinkedHashMap<>();
    Map<String, AnalysisError> skipped = new LinkedHashMap<>();
    for (String metricName : metricNames) {
      AnalysisResult<LinearForecast> result = forecastLinear(clientId, metricName, daysAhead);
      if (result.isOk()) {
        forecasts.put(metricName, result.value());
      } else {
        skipped.put(metricName, result.error());
      }
    }
    AnalysisResult<TrafficForecast> trafficResult = forecastTraffic(clientId, daysAhead);
    TrafficForecast traffic = trafficResult.toOptional().orElse(null);
    if (traffic == null) {
      skipped.put(TRAFFIC_METRIC, trafficResult.error());
    }
    int total = forecasts.size() + (traffic != null ? 1 : 0);

    log.info("Forecast {} of {} metrics for client {} (traffic forecast: {}, skipped: {})",
        forecasts.size(), metricNames.size(), clientId, traffic != null, skipped.keySet());
    return new ForecastBatch(clientId, forecasts, traffic, total, LocalDate.now(clock),
        skipped.isEmpty() ? null : Map.copyOf(skipped));
  }

  private static double[] values(List<MetricSample> samples) {
    return samples.stream().mapToDouble(MetricSample::value).toArray();
  }

  private static double[] tail(double[] values, int count) {
    int from = Math.max(0, values.length - count);
    return Arrays.copyOfRange(values, from, values.length);
  }
}
