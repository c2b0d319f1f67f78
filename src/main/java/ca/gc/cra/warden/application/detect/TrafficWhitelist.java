package ca.gc.cra.warden.application.detect;

import ca.gc.cra.warden.domain.net.PacketRecord;
import ca.gc.cra.warden.validation.Net;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Trusted address blocks and ports. Whitelisted packets are still connection-tracked but skip deep analysis.
 *
 * <p>A packet matches when either address lies in a listed block or either port is listed.</p>
 *
 * @since 0.1.0
 */
public final class TrafficWhitelist {
  /** Whitelist that matches nothing. */
  public static final TrafficWhitelist NONE = new TrafficWhitelist(List.of(), Set.of());

  private final List<Net.Cidr> blocks;
  private final Set<Integer> ports;

  private TrafficWhitelist(List<Net.Cidr> blocks, Set<Integer> ports) {
    this.blocks = List.copyOf(blocks);
    this.ports = Set.copyOf(ports);
  }

  /**
   * Parses CIDR blocks and port numbers.
   *
   * @param cidrs CIDR or bare address entries
   * @param portValues port numbers as text
   * @return whitelist
   * @throws IllegalArgumentException if any entry is malformed
   */
  public static TrafficWhitelist of(Collection<String> cidrs, Collection<String> portValues) {
    List<Net.Cidr> blocks = new ArrayList<>();
    for (String cidr : cidrs) {
      blocks.add(Net.parseCidr(cidr));
    }
    Set<Integer> ports = new LinkedHashSet<>();
    for (String port : portValues) {
      ports.add(Net.parsePort(port));
    }
    return new TrafficWhitelist(blocks, ports);
  }

  /**
   * Tests whether the packet should bypass deep analysis.
   *
   * @param packet decoded packet
   * @return {@code true} if an address or port is whitelisted
   */
  public boolean matches(PacketRecord packet) {
    if (!ports.isEmpty() && (ports.contains(packet.srcPort()) || ports.contains(packet.dstPort()))) {
      return true;
    }
    if (blocks.isEmpty() || !packet.hasAddresses()) {
      return false;
    }
    byte[] src = addressBytes(packet.srcIp());
    byte[] dst = addressBytes(packet.dstIp());
    for (Net.Cidr block : blocks) {
      if (block.contains(src) || block.contains(dst)) {
        return true;
      }
    }
    return false;
  }

  private static byte[] addressBytes(String address) {
    try {
      return Net.parseAddress(address);
    } catch (IllegalArgumentException ex) {
      return null;
    }
  }

  /**
   * Returns {@code true} when nothing is whitelisted.
   *
   * @return emptiness flag
   */
  public boolean isEmpty() {
    return blocks.isEmpty() && ports.isEmpty();
  }

  @Override
  public String toString() {
    return "TrafficWhitelist{blocks=" + blocks + ", ports=" + ports + '}';
  }
}
