package ca.gc.cra.warden.domain.detect;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Fixed-order, six-slot numeric summary of a packet and its connection.
 * <p><strong>Role:</strong> Input to the anomaly and classification detectors and to the sample collector.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param packetSize payload bytes, or raw frame bytes when the payload is empty
 * @param protocolType encoded protocol (TCP=1, UDP=2, ICMP=3, other=0)
 * @param connectionDuration seconds since the flow's first packet
 * @param failedLoginAttempts failed logins recorded for the source within the login window
 * @param dataTransferRate bytes per second for the flow within the rate window
 * @param accessFrequency accesses per second by the source within the access window
 * @since 0.1.0
 */
public record FeatureVector(
    double packetSize,
    double protocolType,
    double connectionDuration,
    double failedLoginAttempts,
    double dataTransferRate,
    double accessFrequency) {

  /** Feature names in slot order. */
  public static final List<String> NAMES = List.of(
      "packet_size",
      "protocol_type",
      "connection_duration",
      "failed_login_attempts",
      "data_transfer_rate",
      "access_frequency");

  /** Number of slots; always six. */
  public static final int LENGTH = 6;

  /** Degraded vector returned when extraction fails. */
  public static final FeatureVector ZERO = new FeatureVector(0d, 0d, 0d, 0d, 0d, 0d);

  /**
   * Returns the slots as a new array in {@link #NAMES} order.
   *
   * @return array of length {@link #LENGTH}
   */
  public double[] toArray() {
    return new double[] {
        packetSize, protocolType, connectionDuration, failedLoginAttempts, dataTransferRate, accessFrequency
    };
  }

  /**
   * Returns the slots keyed by feature name, preserving slot order.
   *
   * @return insertion-ordered map of name to value
   */
  public Map<String, Double> toNamedMap() {
    double[] values = toArray();
    Map<String, Double> named = new LinkedHashMap<>();
    for (int i = 0; i < LENGTH; i++) {
      named.put(NAMES.get(i), values[i]);
    }
    return named;
  }

  /**
   * Rebuilds a vector from an array in {@link #NAMES} order.
   *
   * @param values six values
   * @return feature vector
   * @throws IllegalArgumentException when the array does not hold exactly six values
   */
  public static FeatureVector fromArray(double[] values) {
    if (values == null || values.length != LENGTH) {
      throw new IllegalArgumentException("feature vector requires exactly " + LENGTH + " values");
    }
    return new FeatureVector(values[0], values[1], values[2], values[3], values[4], values[5]);
  }
}
