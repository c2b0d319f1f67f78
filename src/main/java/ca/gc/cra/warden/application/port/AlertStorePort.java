package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.detect.Detection;
import ca.gc.cra.warden.domain.net.PacketRecord;

/**
 * <strong>What:</strong> Port to the external alert store.
 * <p><strong>Why:</strong> Alert persistence and its query layer live outside the engine; the deduplicator only
 * needs to insert new alerts and ask whether a matching alert was stored recently.</p>
 * <p><strong>Role:</strong> Implemented by {@code InMemoryAlertStore} and {@code NdjsonAlertStore}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from the processing worker while the
 * sweep runs.</p>
 *
 * @since 0.1.0
 */
public interface AlertStorePort {
  /**
   * Persists a detection together with the packet that triggered it.
   *
   * @param detection detection to store
   * @param context packet context (addresses, ports, protocol, payload sample)
   * @return identifier assigned by the store
   * @throws Exception if the store is unavailable
   */
  String insert(Detection detection, PacketRecord context) throws Exception;

  /**
   * Checks for an alert with the same dedup key stored after {@code sinceMillis}.
   *
   * @param sourceIp source address of the detection
   * @param ruleId signature or rule identifier
   * @param destPort destination port
   * @param sinceMillis exclusive lower bound on the stored alert's creation time
   * @return {@code true} when such an alert exists
   * @throws Exception if the store is unavailable
   */
  boolean existsRecent(String sourceIp, String ruleId, int destPort, long sinceMillis) throws Exception;
}
