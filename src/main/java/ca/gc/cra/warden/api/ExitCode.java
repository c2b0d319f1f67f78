package ca.gc.cra.warden.api;

import ca.gc.cra.warden.domain.detect.WardenFailure;
import java.util.Objects;

/**
 * Process exit statuses of {@code warden live} and {@code warden analyze}.
 *
 * <p>Structured failures map onto a status through {@link #forFailure(WardenFailure.Kind)} so both commands report
 * the same code for the same kind of problem.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command finished; for {@code live} this includes a clean stop on shutdown. */
  SUCCESS(0),
  /** An argument was not {@code key=value}, repeated, or missing a required value. */
  INVALID_ARGS(2),
  /** Capture, alert store or report output failed. */
  IO_ERROR(3),
  /** Configuration file or overrides failed validation. */
  CONFIG_ERROR(4),
  /** Unexpected failure inside the engine. */
  RUNTIME_FAILURE(5),
  /** Capture file was rejected: wrong extension, missing, empty, malformed or too large. */
  INPUT_REJECTED(6),
  /** Interrupted while waiting for the live engine. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }

  /**
   * Chooses the exit status reported for a structured failure.
   *
   * @param kind failure category
   * @return matching exit status
   */
  public static ExitCode forFailure(WardenFailure.Kind kind) {
    Objects.requireNonNull(kind, "kind");
    return switch (kind) {
      case PCAP_INVALID, PCAP_EMPTY, PCAP_TOO_LARGE -> INPUT_REJECTED;
      case CONFIG_INVALID -> CONFIG_ERROR;
      case PERMISSION_DENIED, INTERFACE_NOT_FOUND, CAPTURE_IO, CAPTURE_RETRIES_EXHAUSTED, STORE_UNAVAILABLE ->
          IO_ERROR;
    };
  }
}
