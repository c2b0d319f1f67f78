package ca.gc.cra.warden.domain.net;

import java.util.Objects;

/**
 * <strong>What:</strong> Identity of one logical connection, {@code (src_ip, dst_ip, dst_port)}.
 * <p><strong>Role:</strong> Map key for connection state, flow-rate windows and batch flow counters.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe as a concurrent map key.</p>
 *
 * @param srcIp source address in textual form
 * @param dstIp destination address in textual form
 * @param dstPort destination port, {@code 0} when the protocol has none
 * @since 0.1.0
 */
public record FlowKey(String srcIp, String dstIp, int dstPort) {
  /**
   * Validates the key components.
   */
  public FlowKey {
    Objects.requireNonNull(srcIp, "srcIp");
    Objects.requireNonNull(dstIp, "dstIp");
  }

  /**
   * Derives the flow key of a decoded packet.
   *
   * @param packet decoded packet
   * @return flow identity
   */
  public static FlowKey of(PacketRecord packet) {
    return new FlowKey(packet.srcIp(), packet.dstIp(), packet.dstPort());
  }

  @Override
  public String toString() {
    return srcIp + "->" + dstIp + ":" + dstPort;
  }
}
