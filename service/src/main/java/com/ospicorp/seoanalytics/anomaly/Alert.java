package com.ospicorp.seoanalytics.anomaly;

public record Alert(
    AlertType type,
    String title,
    String message,
    AlertAction action,
    int priority
) {}
