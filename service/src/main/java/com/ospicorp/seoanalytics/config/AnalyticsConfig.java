package com.ospicorp.seoanalytics.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalyticsConfig {

  // "today" for every lookback window and scan date
  @Bean
  Clock analyticsClock(@Value("${analytics.zone:UTC}") String zone) {
    return Clock.system(ZoneId.of(zone));
  }
}
