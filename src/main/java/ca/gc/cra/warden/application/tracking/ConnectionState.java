package ca.gc.cra.warden.application.tracking;

/**
 * Per-flow state held by the {@link ConnectionTracker}.
 *
 * <p>Instances are immutable; every touch produces a replacement so concurrent map updates stay atomic per
 * key.</p>
 *
 * @param startMillis time of the first packet
 * @param lastSeenMillis time of the most recent packet; never before {@code startMillis}
 * @param packets packets observed
 * @param bytes bytes observed
 * @since 0.1.0
 */
public record ConnectionState(long startMillis, long lastSeenMillis, long packets, long bytes) {

  /**
   * Enforces {@code lastSeenMillis >= startMillis}.
   */
  public ConnectionState {
    lastSeenMillis = Math.max(startMillis, lastSeenMillis);
  }

  static ConnectionState open(long nowMillis, long bytes) {
    return new ConnectionState(nowMillis, nowMillis, 1, Math.max(0, bytes));
  }

  ConnectionState touch(long nowMillis, long addedBytes) {
    return new ConnectionState(
        startMillis, Math.max(lastSeenMillis, nowMillis), packets + 1, bytes + Math.max(0, addedBytes));
  }

  /**
   * Returns seconds elapsed between the first packet and {@code nowMillis}.
   *
   * @param nowMillis reference time
   * @return non-negative duration in seconds
   */
  public double durationSeconds(long nowMillis) {
    return Math.max(0L, nowMillis - startMillis) / 1_000d;
  }
}
