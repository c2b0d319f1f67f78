package ca.gc.cra.warden.domain.detect;

import java.util.Locale;
import java.util.Objects;

/**
 * Outcome of classifying one feature map.
 *
 * @param label predicted label
 * @param confidence probability of the predicted label; {@code 0} when {@link Label#UNKNOWN}
 * @param benignProbability model probability of class 0
 * @param maliciousProbability model probability of class 1
 * @since 0.1.0
 */
public record ClassificationResult(
    Label label, double confidence, double benignProbability, double maliciousProbability) {

  /** Result reported while no trained model is loaded. */
  public static final ClassificationResult UNKNOWN = new ClassificationResult(Label.UNKNOWN, 0d, 0d, 0d);

  /** Binary label plus the "no model" outcome. */
  public enum Label {
    BENIGN,
    MALICIOUS,
    UNKNOWN;

    /**
     * Returns the lowercase label used in samples and reports.
     *
     * @return label text
     */
    public String label() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  /**
   * Validates the label.
   */
  public ClassificationResult {
    Objects.requireNonNull(label, "label");
  }

  /**
   * Indicates whether the classifier produced a verdict.
   *
   * @return {@code false} for {@link Label#UNKNOWN}
   */
  public boolean classified() {
    return label != Label.UNKNOWN;
  }
}
