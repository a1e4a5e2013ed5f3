package com.ospicorp.seoanalytics.support;

import com.ospicorp.seoanalytics.model.KeywordObservation;
import com.ospicorp.seoanalytics.model.MetricSample;
import com.ospicorp.seoanalytics.model.TrafficSample;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

public final class TestData {

  public static final LocalDate TODAY = LocalDate.of(2024, 6, 30);
  public static final Clock CLOCK =
      Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

  private TestData() {
  }

  /** Daily samples ending today, oldest first. */
  public static List<MetricSample> series(String metric, double... values) {
    List<MetricSample> samples = new ArrayList<>(values.length);
    LocalDate start = TODAY.minusDays(values.length - 1L);
    for (int i = 0; i < values.length; i++) {
      samples.add(new MetricSample(1L, metric, values[i], start.plusDays(i), null, null));
    }
    return samples;
  }

  /** Daily traffic samples ending today, oldest first. */
  public static List<TrafficSample> sessions(long... sessions) {
    List<TrafficSample> samples = new ArrayList<>(sessions.length);
    LocalDate start = TODAY.minusDays(sessions.length - 1L);
    for (int i = 0; i < sessions.length; i++) {
      samples.add(new TrafficSample(1L, start.plusDays(i), sessions[i], sessions[i],
          sessions[i] * 2, null, null, null, null));
    }
    return samples;
  }

  public static KeywordObservation keyword(long clientId, String keyword, Double position,
      Double positionChange, long clicks, LocalDate date, String url) {
    return new KeywordObservation(clientId, keyword, position, null, positionChange,
        clicks * 20, clicks, clicks / (clicks * 20d + 1), date, url);
  }
}
