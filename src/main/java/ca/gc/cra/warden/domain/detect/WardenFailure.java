package ca.gc.cra.warden.domain.detect;

import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Structured, user-visible description of a failure.
 * <p><strong>Why:</strong> Operators see what went wrong and what to do about it instead of a stack trace.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param kind failure category
 * @param detail what happened, including the offending value
 * @param suggestion actionable remediation
 * @since 0.1.0
 */
public record WardenFailure(Kind kind, String detail, String suggestion) {

  /** Failure categories surfaced to operators. */
  public enum Kind {
    PERMISSION_DENIED,
    INTERFACE_NOT_FOUND,
    CAPTURE_IO,
    CAPTURE_RETRIES_EXHAUSTED,
    PCAP_INVALID,
    PCAP_EMPTY,
    PCAP_TOO_LARGE,
    CONFIG_INVALID,
    STORE_UNAVAILABLE;

    /**
     * Returns the snake_case label used in structured output.
     *
     * @return label text
     */
    public String label() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  /**
   * Validates the failure description.
   */
  public WardenFailure {
    Objects.requireNonNull(kind, "kind");
    detail = Objects.requireNonNullElse(detail, "");
    suggestion = Objects.requireNonNullElse(suggestion, "");
  }

  /**
   * Renders the failure as a single operator-facing line.
   *
   * @return text of the form {@code kind: detail (suggestion)}
   */
  public String render() {
    if (suggestion.isEmpty()) {
      return kind.label() + ": " + detail;
    }
    return kind.label() + ": " + detail + " (" + suggestion + ")";
  }
}
