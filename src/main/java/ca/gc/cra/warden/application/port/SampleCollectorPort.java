package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.detect.FeatureVector;
import ca.gc.cra.warden.domain.net.PacketRecord;

/**
 * <strong>What:</strong> Optional hand-off of labelled samples to an external training data collector.
 * <p><strong>Role:</strong> Called by the detection orchestrator for every classified packet; failures are logged
 * and never interrupt detection.</p>
 *
 * @since 0.1.0
 */
public interface SampleCollectorPort {
  /**
   * Collects one labelled sample.
   *
   * @param features extracted feature vector
   * @param context packet the features were extracted from
   * @param label {@code malicious} or {@code benign}
   * @param labeledBy labelling origin, {@code auto} for engine-assigned labels
   * @param confidence confidence in the label
   * @throws Exception if the collector rejects the sample
   */
  void collect(FeatureVector features, PacketRecord context, String label, String labeledBy, double confidence)
      throws Exception;

  /**
   * Collector that discards every sample.
   */
  SampleCollectorPort NONE = (features, context, label, labeledBy, confidence) -> {};
}
