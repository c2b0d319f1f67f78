package ca.gc.cra.warden.application.pipeline;

import java.time.Duration;

/**
 * Bounded exponential backoff: {@code base * 2^(attempt-1)}, capped.
 *
 * @since 0.1.0
 */
public final class Backoff {
  private Backoff() {}

  /**
   * Computes the delay before the given attempt.
   *
   * @param attempt attempt number starting at 1; values below 1 are treated as 1
   * @param base delay of the first attempt
   * @param cap maximum delay
   * @return delay, never longer than {@code cap}
   */
  public static Duration delay(int attempt, Duration base, Duration cap) {
    long baseMillis = Math.max(0L, base.toMillis());
    long capMillis = Math.max(0L, cap.toMillis());
    int exponent = Math.max(0, Math.min(attempt - 1, 30));
    long millis = baseMillis << exponent;
    if (millis < 0 || millis > capMillis || (baseMillis != 0 && millis >> exponent != baseMillis)) {
      millis = capMillis;
    }
    return Duration.ofMillis(millis);
  }
}
