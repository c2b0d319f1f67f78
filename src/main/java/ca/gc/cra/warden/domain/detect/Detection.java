package ca.gc.cra.warden.domain.detect;

import java.util.Objects;

/**
 * <strong>What:</strong> A single security finding raised by one detector for one packet.
 * <p><strong>Why:</strong> Normalizes signature, anomaly and classification output so deduplication and the alert
 * store handle every detector the same way.</p>
 * <p><strong>Role:</strong> Domain value object flowing from detectors through the deduplicator.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param type detector family; never {@code null}
 * @param ruleId signature or rule identifier (e.g. {@code sql_injection}, {@code ml_anomaly}); never blank
 * @param severity severity from the closed scale; never {@code null}
 * @param confidence confidence in {@code [0,1]}; clamped on construction
 * @param description human-readable summary
 * @param source tag naming the analysis that matched (e.g. {@code payload_analysis})
 * @param matchedPattern pattern or model label that matched; empty when not applicable
 * @param createdAtMillis creation time in epoch milliseconds; drives dedup windows
 * @since 0.1.0
 */
public record Detection(
    DetectionType type,
    String ruleId,
    Severity severity,
    double confidence,
    String description,
    String source,
    String matchedPattern,
    long createdAtMillis) {

  /**
   * Validates identifiers and clamps confidence.
   */
  public Detection {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(severity, "severity");
    if (ruleId == null || ruleId.isBlank()) {
      throw new IllegalArgumentException("ruleId must not be blank");
    }
    if (Double.isNaN(confidence)) {
      confidence = 0d;
    }
    confidence = Math.max(0d, Math.min(1d, confidence));
    description = Objects.requireNonNullElse(description, "");
    source = Objects.requireNonNullElse(source, "");
    matchedPattern = Objects.requireNonNullElse(matchedPattern, "");
  }
}
