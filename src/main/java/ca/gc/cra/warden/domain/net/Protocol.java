package ca.gc.cra.warden.domain.net;

import java.util.Objects;

/**
 * <strong>What:</strong> Normalized protocol identifier drawn from a closed set.
 * <p><strong>Why:</strong> Detectors and feature extraction switch over a small fixed vocabulary instead of raw
 * IP protocol numbers; unknown numbers stay representable as {@code Protocol-<n>} rather than failing.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param kind protocol family
 * @param number IP protocol number (or EtherType for non-IP frames) backing the identifier
 * @since 0.1.0
 */
public record Protocol(Kind kind, int number) {
  /** TCP over IPv4 or IPv6. */
  public static final Protocol TCP = new Protocol(Kind.TCP, 6);
  /** UDP over IPv4 or IPv6. */
  public static final Protocol UDP = new Protocol(Kind.UDP, 17);
  /** ICMP for IPv4. */
  public static final Protocol ICMP = new Protocol(Kind.ICMP, 1);
  /** ICMP for IPv6. */
  public static final Protocol ICMPV6 = new Protocol(Kind.ICMPV6, 58);
  /** Address resolution (EtherType 0x0806). */
  public static final Protocol ARP = new Protocol(Kind.ARP, 0x0806);
  /** IPv6 carrying a next header the decoder does not break out. */
  public static final Protocol IPV6 = new Protocol(Kind.IPV6, 41);

  /** Protocol families recognized by the engine. */
  public enum Kind {
    TCP,
    UDP,
    ICMP,
    ARP,
    IPV6,
    ICMPV6,
    OTHER
  }

  /**
   * Validates the identifier.
   */
  public Protocol {
    Objects.requireNonNull(kind, "kind");
  }

  /**
   * Maps an IPv4 protocol number to the closed set.
   *
   * @param number IPv4 protocol field
   * @return normalized protocol; {@link Kind#OTHER} for unknown numbers
   */
  public static Protocol fromIpv4(int number) {
    return switch (number) {
      case 1 -> ICMP;
      case 6 -> TCP;
      case 17 -> UDP;
      default -> other(number);
    };
  }

  /**
   * Maps an IPv6 next-header value to the closed set.
   *
   * @param nextHeader IPv6 next header field
   * @return normalized protocol; {@link #IPV6} for next headers not broken out
   */
  public static Protocol fromIpv6(int nextHeader) {
    return switch (nextHeader) {
      case 6 -> TCP;
      case 17 -> UDP;
      case 58 -> ICMPV6;
      default -> IPV6;
    };
  }

  /**
   * Builds an identifier for an unsupported protocol number.
   *
   * @param number protocol number
   * @return {@link Kind#OTHER} identifier labelled {@code Protocol-<n>}
   */
  public static Protocol other(int number) {
    return new Protocol(Kind.OTHER, number);
  }

  /**
   * Returns the display label used in reports and sample context.
   *
   * @return label such as {@code TCP}, {@code IPv6} or {@code Protocol-47}
   */
  public String label() {
    return switch (kind) {
      case TCP -> "TCP";
      case UDP -> "UDP";
      case ICMP -> "ICMP";
      case ARP -> "ARP";
      case IPV6 -> "IPv6";
      case ICMPV6 -> "ICMPv6";
      case OTHER -> "Protocol-" + number;
    };
  }

  /**
   * Returns the numeric protocol encoding used by the {@code protocol_type} feature.
   *
   * @return 1 for TCP, 2 for UDP, 3 for ICMP, otherwise 0
   */
  public int featureCode() {
    return switch (kind) {
      case TCP -> 1;
      case UDP -> 2;
      case ICMP -> 3;
      default -> 0;
    };
  }

  @Override
  public String toString() {
    return label();
  }
}
