package ca.gc.cra.warden.domain.net;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable representation of a captured link-layer frame.
 * <p><strong>Why:</strong> Allows capture adapters and the pcap reader to hand frames to the decoder without
 * exposing mutable buffers.</p>
 * <p><strong>Role:</strong> Domain value object bridging capture and decoding.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 * <p><strong>Performance:</strong> Clones frame bytes once on construction.</p>
 *
 * @param data raw frame bytes; defensively copied
 * @param timestampMicros capture timestamp in microseconds since epoch
 * @param linkType framing of {@code data}; never {@code null}
 * @since 0.1.0
 */
public record RawFrame(byte[] data, long timestampMicros, LinkType linkType) {
  /**
   * Creates a raw frame snapshot while defensively copying frame data.
   */
  public RawFrame {
    data = data != null ? data.clone() : new byte[0];
    linkType = Objects.requireNonNullElse(linkType, LinkType.ETHERNET);
  }

  /**
   * Creates an Ethernet frame snapshot.
   *
   * @param data raw frame bytes; defensively copied
   * @param timestampMicros capture timestamp in microseconds since epoch
   */
  public RawFrame(byte[] data, long timestampMicros) {
    this(data, timestampMicros, LinkType.ETHERNET);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawFrame that)) {
      return false;
    }
    return timestampMicros == that.timestampMicros()
        && linkType == that.linkType()
        && Arrays.equals(data, that.data());
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(data);
    result = 31 * result + Long.hashCode(timestampMicros);
    result = 31 * result + linkType.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return "RawFrame{"
        + "length=" + data.length
        + ", timestampMicros=" + timestampMicros
        + ", linkType=" + linkType
        + '}';
  }
}
