package com.ospicorp.seoanalytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;

public record ReportSnapshot(
    @JsonProperty("report_date") LocalDate reportDate,
    @JsonProperty("health_score") Double healthScore
) {}
