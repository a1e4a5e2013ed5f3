package com.ospicorp.seoanalytics.prioritization;

import static com.ospicorp.seoanalytics.stats.Statistics.round;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Scores recommendations by estimated impact against effort, weighted by confidence and timeline
 * urgency, and ranks a batch by the result. Scoring depends on nothing but the record.
 */
@Service
public class PrioritizationEngine {

  private static final Logger log = LoggerFactory.getLogger(PrioritizationEngine.class);

  private static final Map<String, Double> EFFORT_SCORES =
      Map.of("low", 2d, "medium", 5d, "high", 8d);
  private static final Map<String, Double> CONFIDENCE_MULTIPLIERS =
      Map.of("high", 1.0d, "medium", 0.8d, "low", 0.6d);
  private static final Map<String, Double> TIMELINE_SCORES =
      Map.of("2 weeks", 3d, "1 month", 2d, "3 months", 1d, "6 months", 0.5d);

  private static final double DEFAULT_EFFORT = 5d;
  private static final double DEFAULT_CONFIDENCE = 0.8d;
  private static final double MISSING_TIMELINE = 2d;
  private static final double UNKNOWN_TIMELINE = 1d;
  private static final double MAX_SCORE = 10d;

  public PriorityScore score(RecommendationRecord rec) {
    double impact = impactScore(rec);
    double effort = effortScore(rec);
    double confidence = confidenceMultiplier(rec.confidence());
    double timeline = timelineScore(rec.timeline());

    double roi = impact / Math.max(effort, 1d) * confidence;
    double finalScore = roi + timeline;

    return new PriorityScore(
        round(impact, 2),
        effort,
        round(roi, 2),
        round(finalScore, 2),
        PriorityLabel.of(finalScore, effort, timeline),
        new ScoringBreakdown(impact, effort, confidence, timeline, roi,
            ImpactEstimateParser.dollars(rec.impactEstimate())));
  }

  /** Scores every record and ranks them by final score, highest first; ties keep input order. */
  public List<ScoredRecommendation> prioritize(List<RecommendationRecord> recommendations) {
    List<RecommendationRecord> ordered = new ArrayList<>(recommendations);
    List<PriorityScore> scores = new ArrayList<>(ordered.size());
    ordered.forEach(rec -> scores.add(score(rec)));

    List<Integer> indexes = new ArrayList<>(ordered.size());
    for (int i = 0; i < ordered.size(); i++) {
      indexes.add(i);
    }
    indexes.sort(Comparator.comparingDouble((Integer i) -> scores.get(i).finalScore()).reversed());

    List<ScoredRecommendation> ranked = new ArrayList<>(ordered.size());
    for (int i : indexes) {
      ranked.add(new ScoredRecommendation(ordered.get(i), scores.get(i), ranked.size() + 1));
    }
    log.debug("Prioritized {} recommendations", ranked.size());
    return ranked;
  }

  public PrioritySummary summarize(List<ScoredRecommendation> ranked) {
    int total = ranked.size();
    int quickWins = count(ranked, PriorityLabel.QUICK_WIN);
    int highImpact = count(ranked, PriorityLabel.HIGH_IMPACT);
    int strategic = count(ranked, PriorityLabel.STRATEGIC);
    int denominator = Math.max(total, 1);

    double impact = 0d;
    double effort = 0d;
    double roi = 0d;
    for (ScoredRecommendation r : ranked) {
      impact += r.score().impactScore();
      effort += r.score().effortScore();
      roi += r.score().roiScore();
    }

    return new PrioritySummary(
        total,
        new PriorityBreakdown(quickWins, highImpact, strategic),
        new PriorityPercentages(
            percentOf(quickWins, denominator),
            percentOf(highImpact, denominator),
            percentOf(strategic, denominator)),
        new AverageScores(
            round(impact / denominator, 2),
            round(effort / denominator, 2),
            round(roi / denominator, 2)),
        ranked.isEmpty() ? null : ranked.get(0).recommendation().recommendation());
  }

  /**
   * Clicks add one point per 50 (up to 5), conversions one per 10 (up to 3), a monetary mention
   * adds 2 and supporting evidence adds 1; capped at 10.
   */
  static double impactScore(RecommendationRecord rec) {
    String estimate = rec.impactEstimate();
    double score = 0d;
    double clicks = ImpactEstimateParser.clicks(estimate);
    if (clicks > 0) {
      score += Math.min(clicks / 50d, 5d);
    }
    double conversions = ImpactEstimateParser.conversions(estimate);
    if (conversions > 0) {
      score += Math.min(conversions / 10d, 3d);
    }
    if (ImpactEstimateParser.mentionsMonetaryValue(estimate)) {
      score += 2d;
    }
    if (rec.dataEvidence() != null && !rec.dataEvidence().isEmpty()) {
      score += 1d;
    }
    return Math.min(score, MAX_SCORE);
  }

  static double effortScore(RecommendationRecord rec) {
    double score = EFFORT_SCORES.getOrDefault(level(rec.effort()), DEFAULT_EFFORT);
    if (rec.dependencies() != null && rec.dependencies().size() > 2) {
      score += 1d;
    }
    if (rec.implementationSteps() != null && rec.implementationSteps().size() > 5) {
      score += 0.5d;
    }
    return Math.min(score, MAX_SCORE);
  }

  static double confidenceMultiplier(String confidence) {
    return CONFIDENCE_MULTIPLIERS.getOrDefault(level(confidence), DEFAULT_CONFIDENCE);
  }

  // a missing timeline counts as "1 month"; an unrecognized one scores 1
  static double timelineScore(String timeline) {
    if (timeline == null || timeline.isBlank()) {
      return MISSING_TIMELINE;
    }
    return TIMELINE_SCORES.getOrDefault(timeline.trim().toLowerCase(Locale.ROOT),
        UNKNOWN_TIMELINE);
  }

  // "Low (5-10h)" -> "low", "High (85%)" -> "high"
  private static String level(String value) {
    if (value == null) {
      return "";
    }
    int paren = value.indexOf('(');
    String head = paren >= 0 ? value.substring(0, paren) : value;
    return head.trim().toLowerCase(Locale.ROOT);
  }

  private static int count(List<ScoredRecommendation> ranked, PriorityLabel label) {
    return (int) ranked.stream().filter(r -> r.score().priority() == label).count();
  }

  private static double percentOf(int count, int total) {
    return round((double) count / total * 100d, 1);
  }
}
