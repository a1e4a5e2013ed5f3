package com.ospicorp.seoanalytics.model;

/** Anything an anomaly scan can place into a severity bucket. */
public interface ScanFinding {

  Severity severity();
}
