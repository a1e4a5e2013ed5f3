package com.ospicorp.seoanalytics.prioritization;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A recommendation as produced by the insight step. Only {@code recommendation} is required;
 * the categorical fields ({@code effort}, {@code confidence}, {@code timeline}) fall back to
 * documented defaults when missing or unrecognized.
 *
 * <p>An incoming {@code priority} is accepted but never written back: the scored form carries
 * the computed label instead.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecommendationRecord(
    String recommendation,
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY) String priority,
    String timeline,
    String effort,
    @JsonProperty("impact_estimate") String impactEstimate,
    String confidence,
    String reasoning,
    @JsonProperty("data_evidence") List<String> dataEvidence,
    @JsonProperty("implementation_steps") List<String> implementationSteps,
    List<String> kpis,
    List<String> dependencies,
    List<String> risks
) {

  public static RecommendationRecord of(String recommendation, String effort, String timeline,
      String confidence, String impactEstimate) {
    return new RecommendationRecord(recommendation, null, timeline, effort, impactEstimate,
        confidence, null, null, null, null, null, null);
  }
}
