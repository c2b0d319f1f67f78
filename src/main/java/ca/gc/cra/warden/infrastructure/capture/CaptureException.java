package ca.gc.cra.warden.infrastructure.capture;

import ca.gc.cra.warden.domain.detect.StructuredFailure;
import ca.gc.cra.warden.domain.detect.WardenFailure;
import java.util.Objects;

/**
 * Capture failure carrying an operator-facing {@link WardenFailure}.
 *
 * @since 0.1.0
 */
public final class CaptureException extends Exception implements StructuredFailure {
  private static final long serialVersionUID = 1L;

  private final transient WardenFailure failure;

  /**
   * Creates an exception.
   *
   * @param kind failure category
   * @param detail what happened
   * @param suggestion what the operator should do
   * @param cause underlying native or I/O failure; may be {@code null}
   */
  public CaptureException(WardenFailure.Kind kind, String detail, String suggestion, Throwable cause) {
    super(detail, cause);
    this.failure = new WardenFailure(kind, detail, suggestion);
  }

  @Override
  public WardenFailure failure() {
    return Objects.requireNonNullElseGet(
        failure, () -> new WardenFailure(WardenFailure.Kind.CAPTURE_IO, getMessage(), ""));
  }
}
