package ca.gc.cra.warden.application.tracking;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Measures how often each source IP is seen within a rolling window (default five minutes).
 *
 * <p>The rate is {@code (n-1)/span}: intervals between the window's first and last event divided by their span in
 * seconds. Fewer than two events, or a zero span, yield {@code 0}.</p>
 *
 * @since 0.1.0
 */
public class AccessFrequencyTracker {
  /** Default rolling window. */
  public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(5);
  private static final int MAX_EVENTS_PER_SOURCE = 10_000;

  private final ConcurrentMap<String, TimestampWindow> accesses = new ConcurrentHashMap<>();
  private final long windowMillis;

  public AccessFrequencyTracker() {
    this(DEFAULT_WINDOW);
  }

  public AccessFrequencyTracker(Duration window) {
    this.windowMillis = window.toMillis();
  }

  /**
   * Records an access and returns the updated rate.
   *
   * @param sourceIp source address
   * @param nowMillis access time
   * @return accesses per second within the window
   */
  public double recordAndRate(String sourceIp, long nowMillis) {
    TimestampWindow window = accesses.compute(
        sourceIp, (ip, current) -> TimestampWindow.append(current, MAX_EVENTS_PER_SOURCE, nowMillis));
    return window.rate(nowMillis - windowMillis);
  }

  /**
   * Returns the rate without recording an access.
   *
   * @param sourceIp source address
   * @param nowMillis window end
   * @return accesses per second within the window
   */
  public double rate(String sourceIp, long nowMillis) {
    TimestampWindow window = accesses.get(sourceIp);
    return window == null ? 0d : window.rate(nowMillis - windowMillis);
  }

  /**
   * Drops sources with no accesses left in the window.
   *
   * @param nowMillis window end
   * @return number of sources dropped
   */
  public int evictIdle(long nowMillis) {
    return TimestampWindow.evictEmpty(accesses, nowMillis - windowMillis);
  }
}
