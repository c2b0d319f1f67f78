package ca.gc.cra.warden.application.detect;

import java.util.Locale;

/**
 * Maps an anomaly model's raw decision score onto a confidence in {@code [0,1]}.
 *
 * <p>Decision scores measure distance from the model's inlier boundary; they are not calibrated probabilities.
 * Every transform here is a heuristic and is labelled as such in model info.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ConfidenceTransform {
  /** {@code min(1, |score|)}: distance from the boundary read directly as confidence. */
  ConfidenceTransform ABS_CLAMP = score -> Double.isNaN(score) ? 0d : Math.min(1d, Math.abs(score));

  /** {@code tanh(|score|)}: saturates smoothly instead of at {@code |score| = 1}. */
  ConfidenceTransform TANH = score -> Double.isNaN(score) ? 0d : Math.tanh(Math.abs(score));

  /**
   * Converts a decision score to confidence.
   *
   * @param decisionScore raw model score; negative means outlier for the default estimator
   * @return confidence in {@code [0,1]}
   */
  double toConfidence(double decisionScore);

  /**
   * Resolves a transform by configuration name.
   *
   * @param name {@code abs_clamp} or {@code tanh}
   * @return transform
   * @throws IllegalArgumentException for unknown names
   */
  static ConfidenceTransform named(String name) {
    String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "", "abs_clamp" -> ABS_CLAMP;
      case "tanh" -> TANH;
      default -> throw new IllegalArgumentException("anomalyConfidence must be 'abs_clamp' or 'tanh'");
    };
  }
}
