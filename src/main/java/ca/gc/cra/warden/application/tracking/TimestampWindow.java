package ca.gc.cra.warden.application.tracking;

import java.util.ArrayDeque;
import java.util.concurrent.ConcurrentMap;

/**
 * Bounded, lazily pruned window of event timestamps for one key.
 *
 * <p>Timestamps are expected in non-decreasing order; pruning stops at the first timestamp inside the window.</p>
 */
final class TimestampWindow {
  private final ArrayDeque<Long> stamps = new ArrayDeque<>();
  private final int capacity;

  TimestampWindow(int capacity) {
    this.capacity = capacity;
  }

  /** Remapping step for {@code ConcurrentMap.compute}: creates the window when absent, then appends. */
  static TimestampWindow append(TimestampWindow window, int capacity, long millis) {
    TimestampWindow target = window == null ? new TimestampWindow(capacity) : window;
    target.add(millis);
    return target;
  }

  /**
   * Removes every key whose window holds nothing at or after {@code cutoffMillis}, atomically per key.
   *
   * @return number of keys removed
   */
  static <K> int evictEmpty(ConcurrentMap<K, TimestampWindow> windows, long cutoffMillis) {
    int removed = 0;
    for (K key : windows.keySet()) {
      boolean[] dropped = new boolean[1];
      windows.computeIfPresent(key, (k, window) -> {
        dropped[0] = window.isEmpty(cutoffMillis);
        return dropped[0] ? null : window;
      });
      if (dropped[0]) {
        removed++;
      }
    }
    return removed;
  }

  synchronized void add(long millis) {
    if (stamps.size() >= capacity) {
      stamps.pollFirst();
    }
    stamps.addLast(millis);
  }

  synchronized int count(long cutoffMillis) {
    prune(cutoffMillis);
    return stamps.size();
  }

  /**
   * Returns {@code (n-1)/span} in events per second, or {@code 0} with fewer than two events or no span.
   */
  synchronized double rate(long cutoffMillis) {
    prune(cutoffMillis);
    if (stamps.size() < 2) {
      return 0d;
    }
    long spanMillis = stamps.peekLast() - stamps.peekFirst();
    if (spanMillis <= 0) {
      return 0d;
    }
    return (stamps.size() - 1) / (spanMillis / 1_000d);
  }

  synchronized boolean isEmpty(long cutoffMillis) {
    prune(cutoffMillis);
    return stamps.isEmpty();
  }

  private void prune(long cutoffMillis) {
    while (!stamps.isEmpty() && stamps.peekFirst() < cutoffMillis) {
      stamps.pollFirst();
    }
  }
}
