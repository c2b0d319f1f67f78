package ca.gc.cra.warden.infrastructure.capture;

import ca.gc.cra.warden.domain.detect.StructuredFailure;
import ca.gc.cra.warden.domain.detect.WardenFailure;
import java.io.IOException;
import java.util.Objects;

/**
 * Offline capture input is missing, too large, empty or unreadable.
 *
 * @since 0.1.0
 */
public final class PcapFormatException extends IOException implements StructuredFailure {
  private static final long serialVersionUID = 1L;

  private final transient WardenFailure failure;

  /**
   * Creates an exception.
   *
   * @param kind failure category, one of the {@code PCAP_*} kinds
   * @param detail what happened
   * @param suggestion what the operator should do
   */
  public PcapFormatException(WardenFailure.Kind kind, String detail, String suggestion) {
    this(kind, detail, suggestion, null);
  }

  /**
   * Creates an exception with a cause.
   *
   * @param kind failure category
   * @param detail what happened
   * @param suggestion what the operator should do
   * @param cause underlying I/O failure; may be {@code null}
   */
  public PcapFormatException(WardenFailure.Kind kind, String detail, String suggestion, Throwable cause) {
    super(detail, cause);
    this.failure = new WardenFailure(kind, detail, suggestion);
  }

  @Override
  public WardenFailure failure() {
    return Objects.requireNonNullElseGet(
        failure, () -> new WardenFailure(WardenFailure.Kind.PCAP_INVALID, getMessage(), ""));
  }
}
