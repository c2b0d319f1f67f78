package ca.gc.cra.warden.application.pipeline;

import ca.gc.cra.warden.domain.stats.CaptureStatsSnapshot;
import ca.gc.cra.warden.domain.stats.CaptureStatsSnapshot.CaptureState;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Process-wide capture counters, written by the capture and processing threads and read by health checks.
 *
 * <p>Counters are {@link LongAdder}s; readers see a consistent-enough view for monitoring, not a transaction.</p>
 *
 * @since 0.1.0
 */
public final class CaptureStats {
  private final LongAdder totalPackets = new LongAdder();
  private final LongAdder totalBytes = new LongAdder();
  private final LongAdder droppedPackets = new LongAdder();
  private final AtomicLong startedAtMillis = new AtomicLong(-1L);
  private final AtomicLong lastPacketAtMillis = new AtomicLong(-1L);
  private final Duration healthInterval;

  /**
   * Creates counters.
   *
   * @param healthInterval maximum silence before health degrades
   */
  public CaptureStats(Duration healthInterval) {
    this.healthInterval = healthInterval;
  }

  /**
   * Marks the start of capture; the first call wins.
   *
   * @param nowMillis start time
   */
  public void markStarted(long nowMillis) {
    startedAtMillis.compareAndSet(-1L, nowMillis);
  }

  /**
   * Counts a frame accepted from the capture source.
   *
   * @param bytes frame length
   * @param nowMillis arrival time
   */
  public void recordPacket(int bytes, long nowMillis) {
    totalPackets.increment();
    totalBytes.add(bytes);
    lastPacketAtMillis.set(nowMillis);
  }

  /**
   * Counts a frame dropped for a full queue or a failed decode.
   */
  public void recordDropped() {
    droppedPackets.increment();
  }

  /**
   * Returns the dropped-frame count.
   *
   * @return dropped frames
   */
  public long dropped() {
    return droppedPackets.sum();
  }

  /**
   * Takes a snapshot.
   *
   * @param nowMillis snapshot time
   * @param queueSize ingest queue occupancy
   * @param activeConnections tracked flows
   * @param state capture worker state
   * @return immutable snapshot
   */
  public CaptureStatsSnapshot snapshot(long nowMillis, int queueSize, int activeConnections, CaptureState state) {
    long packets = totalPackets.sum();
    long bytes = totalBytes.sum();
    long started = startedAtMillis.get();
    double runtimeSeconds = started < 0 ? 0d : Math.max(0L, nowMillis - started) / 1_000d;
    double packetRate = runtimeSeconds > 0 ? packets / runtimeSeconds : 0d;
    double byteRate = runtimeSeconds > 0 ? bytes / runtimeSeconds : 0d;

    long last = lastPacketAtMillis.get();
    long lastPacketAge = last < 0 ? -1L : Math.max(0L, nowMillis - last);
    // Before the first packet, silence is measured from capture start.
    long silence = last >= 0 ? lastPacketAge : (started < 0 ? 0L : Math.max(0L, nowMillis - started));
    boolean healthy = state == CaptureState.RUNNING && silence <= healthInterval.toMillis();

    return new CaptureStatsSnapshot(
        packets,
        bytes,
        droppedPackets.sum(),
        queueSize,
        packetRate,
        byteRate,
        lastPacketAge,
        activeConnections,
        state,
        healthy,
        nowMillis);
  }
}
