package com.ospicorp.seoanalytics.anomaly;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.seoanalytics.model.ScanFinding;
import com.ospicorp.seoanalytics.model.Severity;
import java.time.LocalDate;

public record RankingDrop(
    String keyword,
    @JsonProperty("current_position") Double currentPosition,
    @JsonProperty("previous_position") Double previousPosition,
    @JsonProperty("position_drop") double positionDrop,
    @JsonProperty("clicks_lost") long clicksLost,
    Severity severity,
    @JsonProperty("detected_at") LocalDate detectedAt
) implements ScanFinding {}
