package ca.gc.cra.warden.domain.net;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * <strong>What:</strong> One decoded frame as seen by the tracker, the feature extractor and the detectors.
 * <p><strong>Why:</strong> Gives every consumer a fixed, typed view of the packet instead of re-parsing bytes.</p>
 * <p><strong>Role:</strong> Domain value object produced by the {@code FrameDecoder} port.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the payload sample is copied on construction.</p>
 * <p><strong>Performance:</strong> Keeps at most {@link #PAYLOAD_SAMPLE_BYTES} payload bytes; entropy is computed
 * once over the whole transport payload by the decoder.</p>
 *
 * @param timestampMicros capture timestamp in microseconds since epoch
 * @param srcIp source address, or {@link #UNKNOWN_ADDRESS} for non-IP frames
 * @param dstIp destination address, or {@link #UNKNOWN_ADDRESS} for non-IP frames
 * @param srcPort transport source port; {@code 0} when absent
 * @param dstPort transport destination port; {@code 0} when absent
 * @param protocol normalized protocol identifier
 * @param rawSize total frame length in bytes
 * @param payloadSize transport payload length in bytes
 * @param flags TCP flags; {@link TcpFlags#NONE} for other protocols
 * @param payloadSample first bytes of the transport payload (at most {@link #PAYLOAD_SAMPLE_BYTES})
 * @param http opportunistic HTTP request hints; {@link HttpHints#NONE} when absent
 * @param dnsQuery first DNS question name for port-53 UDP traffic; empty when absent
 * @param payloadEntropy Shannon entropy of the transport payload in bits per byte
 * @since 0.1.0
 */
public record PacketRecord(
    long timestampMicros,
    String srcIp,
    String dstIp,
    int srcPort,
    int dstPort,
    Protocol protocol,
    int rawSize,
    int payloadSize,
    TcpFlags flags,
    byte[] payloadSample,
    HttpHints http,
    String dnsQuery,
    double payloadEntropy) {

  /** Number of payload bytes retained for signature matching. */
  public static final int PAYLOAD_SAMPLE_BYTES = 100;
  /** Address placeholder for frames without an L3 header. */
  public static final String UNKNOWN_ADDRESS = "unknown";

  /**
   * Normalizes optional components and bounds the payload sample.
   */
  public PacketRecord {
    srcIp = Objects.requireNonNullElse(srcIp, UNKNOWN_ADDRESS);
    dstIp = Objects.requireNonNullElse(dstIp, UNKNOWN_ADDRESS);
    Objects.requireNonNull(protocol, "protocol");
    flags = Objects.requireNonNullElse(flags, TcpFlags.NONE);
    http = Objects.requireNonNullElse(http, HttpHints.NONE);
    dnsQuery = Objects.requireNonNullElse(dnsQuery, "");
    if (payloadSample == null) {
      payloadSample = new byte[0];
    } else {
      payloadSample = Arrays.copyOf(payloadSample, Math.min(payloadSample.length, PAYLOAD_SAMPLE_BYTES));
    }
  }

  /**
   * Provides access to the bounded payload sample without copying.
   *
   * @return internal sample array; callers must not mutate it
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Sample is copied on construction; detectors read it per packet on the hot path.")
  public byte[] payloadSample() {
    return payloadSample;
  }

  /**
   * Returns the capture timestamp in epoch milliseconds.
   *
   * @return timestamp in milliseconds
   */
  public long timestampMillis() {
    return timestampMicros / 1_000L;
  }

  /**
   * Returns the connection identity for this packet.
   *
   * @return flow key
   */
  public FlowKey flowKey() {
    return FlowKey.of(this);
  }

  /**
   * Indicates whether both endpoints carry an L3 address.
   *
   * @return {@code true} for IP and ARP frames
   */
  public boolean hasAddresses() {
    return !UNKNOWN_ADDRESS.equals(srcIp) && !UNKNOWN_ADDRESS.equals(dstIp);
  }

  /**
   * Renders the payload sample as best-effort ASCII; bytes outside 7-bit ASCII are dropped.
   *
   * @return printable view of the payload sample
   */
  public String payloadAscii() {
    StringBuilder sb = new StringBuilder(payloadSample.length);
    for (byte b : payloadSample) {
      if (b >= 0) {
        sb.append((char) b);
      }
    }
    return sb.toString();
  }

  /**
   * Renders the payload sample as lowercase hexadecimal.
   *
   * @return hex string; empty when there is no payload
   */
  public String payloadHex() {
    return HexFormat.of().formatHex(payloadSample);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PacketRecord that)) {
      return false;
    }
    return timestampMicros == that.timestampMicros
        && srcPort == that.srcPort
        && dstPort == that.dstPort
        && rawSize == that.rawSize
        && payloadSize == that.payloadSize
        && Double.compare(payloadEntropy, that.payloadEntropy) == 0
        && srcIp.equals(that.srcIp)
        && dstIp.equals(that.dstIp)
        && protocol.equals(that.protocol)
        && flags.equals(that.flags)
        && http.equals(that.http)
        && dnsQuery.equals(that.dnsQuery)
        && Arrays.equals(payloadSample, that.payloadSample);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(
        timestampMicros, srcIp, dstIp, srcPort, dstPort, protocol, rawSize, payloadSize, flags, http, dnsQuery,
        payloadEntropy);
    result = 31 * result + Arrays.hashCode(payloadSample);
    return result;
  }

  @Override
  public String toString() {
    return "PacketRecord{"
        + protocol.label()
        + ' ' + srcIp + ':' + srcPort
        + " -> " + dstIp + ':' + dstPort
        + ", raw=" + rawSize
        + ", payload=" + payloadSize
        + ", flags=" + flags.letters()
        + ", ts=" + timestampMicros
        + '}';
  }
}
