package ca.gc.cra.warden.domain.stats;

/**
 * <strong>What:</strong> Point-in-time view of the process-wide capture counters.
 * <p><strong>Role:</strong> Returned by health checks and flushed to the stats store by the sweep.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param totalPackets frames accepted into the pipeline
 * @param totalBytes bytes of accepted frames
 * @param droppedPackets frames dropped for a full queue or an unparseable header
 * @param queueSize ingest queue occupancy at snapshot time
 * @param packetRate packets per second since capture start
 * @param byteRate bytes per second since capture start
 * @param lastPacketAgeMillis milliseconds since the last packet; {@code -1} before the first packet
 * @param activeConnections flows held by the connection tracker
 * @param captureState capture worker state
 * @param healthy overall health flag
 * @param takenAtMillis snapshot time in epoch milliseconds
 * @since 0.1.0
 */
public record CaptureStatsSnapshot(
    long totalPackets,
    long totalBytes,
    long droppedPackets,
    int queueSize,
    double packetRate,
    double byteRate,
    long lastPacketAgeMillis,
    int activeConnections,
    CaptureState captureState,
    boolean healthy,
    long takenAtMillis) {

  /** Lifecycle of the capture worker as seen by the supervisor. */
  public enum CaptureState {
    /** Not yet started. */
    STOPPED,
    /** Capture loop running. */
    RUNNING,
    /** Worker died; supervisor is waiting out a backoff delay. */
    RESTARTING,
    /** Source drained normally (offline replay). */
    FINISHED,
    /** Capture disabled; detection continues on whatever is queued. */
    ANALYSIS_ONLY
  }
}
