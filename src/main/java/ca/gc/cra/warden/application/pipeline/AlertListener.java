package ca.gc.cra.warden.application.pipeline;

import ca.gc.cra.warden.application.detect.AlertDeduplicator;
import ca.gc.cra.warden.domain.detect.Detection;
import ca.gc.cra.warden.domain.net.PacketRecord;

/**
 * Receives detections that survived deduplication.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface AlertListener {
  /**
   * Called on the processing thread for each emitted alert.
   *
   * @param detection emitted detection
   * @param packet packet that produced it
   * @param outcome dedup outcome, {@code PERSISTED} or {@code STORE_UNAVAILABLE}
   */
  void onAlert(Detection detection, PacketRecord packet, AlertDeduplicator.Outcome outcome);

  /** Listener that ignores alerts. */
  AlertListener NONE = (detection, packet, outcome) -> {};
}
