package com.ospicorp.seoanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SeoAnalyticsApplication {

  public static void main(String[] args) {
    SpringApplication.run(SeoAnalyticsApplication.class, args);
  }
}
