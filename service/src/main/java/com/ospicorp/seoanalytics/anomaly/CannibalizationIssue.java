package com.ospicorp.seoanalytics.anomaly;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.seoanalytics.model.Severity;
import java.util.List;

public record CannibalizationIssue(
    String keyword,
    @JsonProperty("competing_urls") int competingUrls,
    @JsonProperty("best_position") Double bestPosition,
    @JsonProperty("worst_position") Double worstPosition,
    List<CompetingUrl> urls,
    Severity severity
) {}
