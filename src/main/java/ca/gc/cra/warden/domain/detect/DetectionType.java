package ca.gc.cra.warden.domain.detect;

import java.util.Locale;

/**
 * Detector family that produced a {@link Detection}.
 *
 * @since 0.1.0
 */
public enum DetectionType {
  /** Pattern or connection-pattern rule. */
  SIGNATURE,
  /** Unsupervised anomaly model. */
  ANOMALY,
  /** Supervised benign/malicious classifier. */
  CLASSIFICATION;

  /**
   * Returns the lowercase label used in alert records.
   *
   * @return label such as {@code signature}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
