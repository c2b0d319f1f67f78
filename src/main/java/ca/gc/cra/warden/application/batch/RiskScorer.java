package ca.gc.cra.warden.application.batch;

import ca.gc.cra.warden.application.batch.BatchReport.Finding;
import ca.gc.cra.warden.application.batch.BatchReport.ModelMetadata;
import ca.gc.cra.warden.application.batch.BatchReport.Risk;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * <strong>What:</strong> Reduces a capture's findings and classifier scores to one 0-100 risk score.
 * <p><strong>Why:</strong> Analysts triage captures by a single level, but the score must say where it came from and
 * must never be invented when neither a classifier nor any finding backs it.</p>
 * <p><strong>Role:</strong> Pure function used by {@link BatchAnalyzer}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Prefer classifier malicious probabilities when a trained classifier produced scores.</li>
 *   <li>Fall back to a severity-weighted sum over the findings.</li>
 *   <li>Report {@code unavailable} with score 0 otherwise.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class RiskScorer {
  /** Risk source when the classifier produced the score. */
  public static final String SOURCE_CLASSIFICATION = "classification";
  /** Risk source when findings produced the score. */
  public static final String SOURCE_DETECTIONS = "detections";
  /** Risk source when nothing backs a score. */
  public static final String SOURCE_UNAVAILABLE = "unavailable";

  static final double MALICIOUS_THRESHOLD = 0.5;
  static final int MAX_RATIONALE = 6;
  static final int RATIONALE_FINDINGS = 4;
  static final int MAX_WEIGHTED_FINDINGS = 20;
  static final int DETECTION_FLOOR = 10;
  private static final Map<String, Integer> SEVERITY_WEIGHTS =
      Map.of("critical", 25, "high", 18, "medium", 12, "low", 6);

  private RiskScorer() {}

  /**
   * Scores a capture.
   *
   * @param findings deduplicated findings
   * @param metadata model metadata with classifier scores
   * @return risk assessment
   */
  public static Risk score(List<Finding> findings, ModelMetadata metadata) {
    List<String> rationale = new ArrayList<>();
    List<Double> scores = metadata.confidenceScores();
    String modelType = metadata.classificationModelType();

    if (metadata.classificationEnabled() && metadata.classificationTrained() && !scores.isEmpty()) {
      List<Double> malicious = new ArrayList<>();
      double total = 0d;
      for (double s : scores) {
        total += s;
        if (s > MALICIOUS_THRESHOLD) {
          malicious.add(s);
        }
      }
      int score;
      if (!malicious.isEmpty()) {
        double max = 0d;
        double sum = 0d;
        for (double s : malicious) {
          max = Math.max(max, s);
          sum += s;
        }
        double avg = sum / malicious.size();
        double ratio = (double) malicious.size() / scores.size();
        score = clamp(Math.round(max * 60d + avg * 25d + Math.min(ratio * 200d, 15d)));
        rationale.add("Classification (" + modelType + "): " + malicious.size() + " malicious packet(s) detected");
        rationale.add("Max confidence: " + percent(max) + ", Avg: " + percent(avg));
      } else {
        double mean = total / scores.size();
        score = clamp(Math.round(mean * 100d));
        rationale.add(String.format(
            Locale.ROOT, "Classification (%s): No malicious packets (avg confidence %.2f)", modelType, mean));
      }
      addTitles(findings, rationale);
      return new Risk(score, level(score), limit(rationale), SOURCE_CLASSIFICATION, modelType);
    }

    if (!findings.isEmpty()) {
      int sum = 0;
      for (int i = 0; i < findings.size() && i < MAX_WEIGHTED_FINDINGS; i++) {
        String severity = findings.get(i).severity().toLowerCase(Locale.ROOT);
        sum += SEVERITY_WEIGHTS.getOrDefault(severity, SEVERITY_WEIGHTS.get("low"));
      }
      int score = Math.max(DETECTION_FLOOR, Math.min(100, sum));
      rationale.add("Risk from " + findings.size() + " detection(s) (heuristic + ML)");
      addTitles(findings, rationale);
      return new Risk(score, level(score), limit(rationale), SOURCE_DETECTIONS, modelType);
    }

    rationale.add("No detections and no classifier scores; configure a classifier model for an ML risk score.");
    return new Risk(0, "low", rationale, SOURCE_UNAVAILABLE, null);
  }

  /**
   * Maps a score to its level.
   *
   * @param score score in [0, 100]
   * @return level label
   */
  public static String level(int score) {
    if (score >= 80) {
      return "critical";
    }
    if (score >= 65) {
      return "high";
    }
    if (score >= 40) {
      return "medium";
    }
    return "low";
  }

  private static void addTitles(List<Finding> findings, List<String> rationale) {
    for (int i = 0; i < findings.size() && i < RATIONALE_FINDINGS; i++) {
      String title = findings.get(i).title();
      rationale.add(title.isEmpty() ? "Detection identified" : title);
    }
  }

  private static List<String> limit(List<String> rationale) {
    return rationale.subList(0, Math.min(MAX_RATIONALE, rationale.size()));
  }

  private static int clamp(long score) {
    return (int) Math.max(0L, Math.min(100L, score));
  }

  private static String percent(double value) {
    return Math.round(value * 100d) + "%";
  }
}
