package ca.gc.cra.warden.application.features;

import ca.gc.cra.warden.application.tracking.AccessFrequencyTracker;
import ca.gc.cra.warden.application.tracking.ConnectionState;
import ca.gc.cra.warden.application.tracking.ConnectionTracker;
import ca.gc.cra.warden.application.tracking.FlowRateCalculator;
import ca.gc.cra.warden.application.tracking.LoginAttemptTracker;
import ca.gc.cra.warden.domain.detect.FeatureVector;
import ca.gc.cra.warden.domain.net.FlowKey;
import ca.gc.cra.warden.domain.net.PacketRecord;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns a {@link PacketRecord} plus tracked connection state into a six-slot
 * {@link FeatureVector}.
 * <p><strong>Why:</strong> Anomaly and classification detectors consume the same fixed-order numeric summary.</p>
 * <p><strong>Role:</strong> Stateful application service owned by the detection orchestrator.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Touch the flow in the {@link ConnectionTracker} and read its duration.</li>
 *   <li>Record the access and flow-rate events for the packet (every call mutates the auxiliary trackers).</li>
 *   <li>Read the failed-login count for the packet's source.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; all trackers are concurrent maps with per-key
 * updates.</p>
 * <p><strong>Observability:</strong> Logs extraction failures at DEBUG and degrades to
 * {@link FeatureVector#ZERO}.</p>
 *
 * @implNote Windows are evaluated against the packet timestamp, so offline replay yields the same features as the
 *     original capture.
 * @since 0.1.0
 */
public final class FeatureExtractor {
  private static final Logger log = LoggerFactory.getLogger(FeatureExtractor.class);

  private final ConnectionTracker connections;
  private final LoginAttemptTracker logins;
  private final FlowRateCalculator flowRates;
  private final AccessFrequencyTracker accesses;

  /**
   * Creates an extractor with default auxiliary windows.
   *
   * @param connections shared connection tracker
   */
  public FeatureExtractor(ConnectionTracker connections) {
    this(connections, new LoginAttemptTracker(), new FlowRateCalculator(), new AccessFrequencyTracker());
  }

  /**
   * Creates an extractor from explicit trackers.
   *
   * @param connections shared connection tracker
   * @param logins failed-login tracker
   * @param flowRates per-flow byte rate calculator
   * @param accesses per-source access frequency tracker
   */
  public FeatureExtractor(
      ConnectionTracker connections,
      LoginAttemptTracker logins,
      FlowRateCalculator flowRates,
      AccessFrequencyTracker accesses) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.logins = Objects.requireNonNull(logins, "logins");
    this.flowRates = Objects.requireNonNull(flowRates, "flowRates");
    this.accesses = Objects.requireNonNull(accesses, "accesses");
  }

  /**
   * Extracts the feature vector for one packet; never throws.
   *
   * @param packet decoded packet
   * @return feature vector, or {@link FeatureVector#ZERO} if extraction fails
   */
  public FeatureVector extract(PacketRecord packet) {
    try {
      long now = packet.timestampMillis();
      FlowKey key = packet.flowKey();
      int size = packet.payloadSize() > 0 ? packet.payloadSize() : packet.rawSize();

      ConnectionState state = connections.startOrTouch(key, now, size);
      double duration = state.durationSeconds(now);
      int failedLogins = logins.count(packet.srcIp(), now);
      double transferRate = flowRates.addAndRate(key, size, now);
      double frequency = accesses.recordAndRate(packet.srcIp(), now);

      return new FeatureVector(
          size,
          packet.protocol().featureCode(),
          duration,
          failedLogins,
          transferRate,
          frequency);
    } catch (RuntimeException ex) {
      log.debug("Feature extraction failed for {}; using zero vector", packet, ex);
      return FeatureVector.ZERO;
    }
  }

  /**
   * Records a failed login for a source, as signalled by a brute-force signature.
   *
   * @param sourceIp source address
   * @param nowMillis event time
   */
  public void recordFailedLogin(String sourceIp, long nowMillis) {
    logins.recordFailed(sourceIp, nowMillis);
  }

  /**
   * Drops auxiliary windows that no longer hold events.
   *
   * @param nowMillis reference time
   * @return number of windows dropped across all trackers
   */
  public int evictIdle(long nowMillis) {
    return logins.evictIdle(nowMillis) + flowRates.evictIdle(nowMillis) + accesses.evictIdle(nowMillis);
  }

  /**
   * Returns the shared connection tracker.
   *
   * @return tracker
   */
  public ConnectionTracker connections() {
    return connections;
  }
}
