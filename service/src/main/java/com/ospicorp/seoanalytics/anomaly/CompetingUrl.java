package com.ospicorp.seoanalytics.anomaly;

public record CompetingUrl(String url, Double position, long clicks) {}
