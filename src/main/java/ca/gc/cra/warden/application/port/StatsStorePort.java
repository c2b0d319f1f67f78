package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.stats.CaptureStatsSnapshot;

/**
 * Port to the external traffic stats store; receives periodic capture snapshots from the sweep.
 *
 * @since 0.1.0
 */
public interface StatsStorePort {
  /**
   * Records one snapshot.
   *
   * @param snapshot capture counters at the time of the sweep
   * @throws Exception if the store is unavailable
   */
  void record(CaptureStatsSnapshot snapshot) throws Exception;
}
