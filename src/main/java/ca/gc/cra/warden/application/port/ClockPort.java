package ca.gc.cra.warden.application.port;

import java.time.Duration;

/**
 * Wall clock read by retrain gating, eviction sweeps, dedup store backoff and stats rates.
 *
 * <p>Packet timestamps never come from here; detections carry the capture time of their packet. Tests drive this
 * port by hand so timers can be crossed without sleeping.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ClockPort {
  /** Clock backed by {@link System#currentTimeMillis()}; wall-clock adjustments are visible. */
  ClockPort SYSTEM = System::currentTimeMillis;

  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Tells whether at least {@code interval} has passed since {@code sinceMillis}.
   *
   * @param sinceMillis earlier reading of this clock
   * @param interval required gap
   * @return {@code true} once the gap is reached; {@code false} if the clock stepped backwards
   */
  default boolean hasElapsed(long sinceMillis, Duration interval) {
    return nowMillis() - sinceMillis >= interval.toMillis();
  }
}
