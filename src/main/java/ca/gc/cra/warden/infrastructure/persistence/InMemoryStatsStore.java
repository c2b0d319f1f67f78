package ca.gc.cra.warden.infrastructure.persistence;

import ca.gc.cra.warden.application.port.StatsStorePort;
import ca.gc.cra.warden.domain.stats.CaptureStatsSnapshot;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Keeps the most recent capture snapshots in memory.
 *
 * @since 0.1.0
 */
public final class InMemoryStatsStore implements StatsStorePort {
  private static final int DEFAULT_RETAINED = 120;

  private final int retained;
  private final Deque<CaptureStatsSnapshot> snapshots = new ArrayDeque<>();

  /**
   * Creates a store retaining the last 120 snapshots (one hour at the default sweep interval).
   */
  public InMemoryStatsStore() {
    this(DEFAULT_RETAINED);
  }

  /**
   * Creates a store.
   *
   * @param retained snapshots kept; at least 1
   */
  public InMemoryStatsStore(int retained) {
    this.retained = Math.max(1, retained);
  }

  @Override
  public synchronized void record(CaptureStatsSnapshot snapshot) {
    if (snapshots.size() >= retained) {
      snapshots.pollFirst();
    }
    snapshots.addLast(snapshot);
  }

  /**
   * Returns the newest snapshot.
   *
   * @return latest snapshot, if any
   */
  public synchronized Optional<CaptureStatsSnapshot> latest() {
    return Optional.ofNullable(snapshots.peekLast());
  }

  /**
   * Returns retained snapshots, oldest first.
   *
   * @return snapshot copy
   */
  public synchronized List<CaptureStatsSnapshot> history() {
    return List.copyOf(snapshots);
  }
}
