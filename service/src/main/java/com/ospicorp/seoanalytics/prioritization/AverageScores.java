package com.ospicorp.seoanalytics.prioritization;

public record AverageScores(double impact, double effort, double roi) {}
