package ca.gc.cra.warden.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by WARDEN CLI and configuration parsing.
 * <p><strong>Why:</strong> Guards capture (timeouts, snap length), ingest (queue capacity) and detection
 * (thresholds, windows) parameters before components allocate resources.
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., packets, seconds)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating-point value is finite and within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value, typically a probability or confidence threshold
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is NaN, infinite or outside {@code [min, max]}
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (!Double.isFinite(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer, reporting the parameter name on failure.
   *
   * @param name logical parameter name
   * @param raw text to parse; surrounding whitespace is ignored
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not a valid integer
   */
  public static long parseLong(String name, String raw) {
    try {
      return Long.parseLong(Strings.requireNonBlank(name, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be numeric (was " + raw + ")", ex);
    }
  }

  /**
   * Parses a decimal number, reporting the parameter name on failure.
   *
   * @param name logical parameter name
   * @param raw text to parse
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not a valid number
   */
  public static double parseDouble(String name, String raw) {
    try {
      return Double.parseDouble(Strings.requireNonBlank(name, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be numeric (was " + raw + ")", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
