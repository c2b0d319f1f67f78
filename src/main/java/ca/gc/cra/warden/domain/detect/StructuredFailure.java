package ca.gc.cra.warden.domain.detect;

/**
 * Implemented by exceptions that carry a {@link WardenFailure} for operator output.
 *
 * @since 0.1.0
 */
public interface StructuredFailure {
  /**
   * Returns the structured failure description.
   *
   * @return failure; never {@code null}
   */
  WardenFailure failure();
}
