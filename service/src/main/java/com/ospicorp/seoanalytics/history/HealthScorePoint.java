package com.ospicorp.seoanalytics.history;

import java.time.LocalDate;

public record HealthScorePoint(LocalDate date, double score) {}
