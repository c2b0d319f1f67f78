package ca.gc.cra.warden.application.tracking;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Counts failed logins per source IP within a rolling window (default one hour).
 *
 * <p>Thread-safe; each source owns its own synchronized window. Recording and eviction both go through the map's
 * per-key {@code compute}, so a window is never dropped between its lookup and an append.</p>
 *
 * @since 0.1.0
 */
public final class LoginAttemptTracker {
  /** Default rolling window. */
  public static final Duration DEFAULT_WINDOW = Duration.ofHours(1);
  private static final int MAX_EVENTS_PER_SOURCE = 10_000;

  private final ConcurrentMap<String, TimestampWindow> attempts = new ConcurrentHashMap<>();
  private final long windowMillis;

  public LoginAttemptTracker() {
    this(DEFAULT_WINDOW);
  }

  public LoginAttemptTracker(Duration window) {
    this.windowMillis = window.toMillis();
  }

  /**
   * Records one failed login.
   *
   * @param sourceIp source address
   * @param nowMillis event time
   */
  public void recordFailed(String sourceIp, long nowMillis) {
    attempts.compute(sourceIp, (ip, window) -> TimestampWindow.append(window, MAX_EVENTS_PER_SOURCE, nowMillis));
  }

  /**
   * Counts failed logins for a source within the window ending at {@code nowMillis}.
   *
   * @param sourceIp source address
   * @param nowMillis window end
   * @return failures in the window
   */
  public int count(String sourceIp, long nowMillis) {
    TimestampWindow window = attempts.get(sourceIp);
    return window == null ? 0 : window.count(nowMillis - windowMillis);
  }

  /**
   * Drops sources with no failures left in the window.
   *
   * @param nowMillis window end
   * @return number of sources dropped
   */
  public int evictIdle(long nowMillis) {
    return TimestampWindow.evictEmpty(attempts, nowMillis - windowMillis);
  }
}
