package ca.gc.cra.warden.domain.detect;

import java.util.Locale;

/**
 * Closed severity scale attached to every detection.
 *
 * @since 0.1.0
 */
public enum Severity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  /**
   * Returns the lowercase label used in alert records and reports.
   *
   * @return label such as {@code high}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a severity label case-insensitively.
   *
   * @param raw label such as {@code "High"}
   * @return matching severity
   * @throws IllegalArgumentException when the label is not part of the scale
   */
  public static Severity parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("severity must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown severity: " + raw, ex);
    }
  }
}
