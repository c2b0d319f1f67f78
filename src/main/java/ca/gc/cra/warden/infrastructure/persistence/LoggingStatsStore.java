package ca.gc.cra.warden.infrastructure.persistence;

import ca.gc.cra.warden.application.port.StatsStorePort;
import ca.gc.cra.warden.domain.stats.CaptureStatsSnapshot;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each capture snapshot to the log, at WARN when the engine is unhealthy.
 *
 * @since 0.1.0
 */
public final class LoggingStatsStore implements StatsStorePort {
  private static final Logger log = LoggerFactory.getLogger(LoggingStatsStore.class);

  @Override
  public void record(CaptureStatsSnapshot snapshot) {
    String line = String.format(Locale.ROOT,
        "capture state=%s healthy=%s packets=%d bytes=%d dropped=%d queue=%d rate=%.1fpps/%.1fBps "
            + "lastPacketAge=%dms connections=%d",
        snapshot.captureState(),
        snapshot.healthy(),
        snapshot.totalPackets(),
        snapshot.totalBytes(),
        snapshot.droppedPackets(),
        snapshot.queueSize(),
        snapshot.packetRate(),
        snapshot.byteRate(),
        snapshot.lastPacketAgeMillis(),
        snapshot.activeConnections());
    if (snapshot.healthy()) {
      log.info(line);
    } else {
      log.warn(line);
    }
  }
}
