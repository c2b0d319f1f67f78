package ca.gc.cra.warden.validation;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Network address validation utilities: IP literals, CIDR blocks and port numbers.
 *
 * <p>Only literals are accepted; nothing here performs name resolution.</p>
 *
 * @since 0.1.0
 */
public final class Net {

  // IPv4 dotted-quad shape (fast pre-check); octets are still range-checked.
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");
  private static final Pattern IPV6_CHARS = Pattern.compile("\\A[0-9A-Fa-f:.]+\\z");

  private Net() {
    // Utility
  }

  /**
   * Parses an IPv4 or IPv6 literal into its network-order bytes.
   *
   * @param value address literal; scope identifiers ({@code %eth0}) are rejected
   * @return 4 or 16 address bytes
   * @throws IllegalArgumentException if {@code value} is not an address literal
   */
  public static byte[] parseAddress(String value) {
    String host = Strings.requireNonBlank("address", value);
    if (IPV4_PATTERN.matcher(host).matches()) {
      return ipv4Octets(host);
    }
    if (host.indexOf(':') < 0 || !IPV6_CHARS.matcher(host).matches()) {
      throw new IllegalArgumentException("invalid IP literal: " + host);
    }
    try {
      // The character pre-check guarantees getByName parses a literal and never resolves a name.
      return InetAddress.getByName(host).getAddress();
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  /**
   * Parses a CIDR block ({@code 10.0.0.0/8}) or a bare address, which is treated as a host route.
   *
   * @param value CIDR text
   * @return parsed block
   * @throws IllegalArgumentException if the address or prefix length is invalid
   */
  public static Cidr parseCidr(String value) {
    String sanitized = Strings.requireNonBlank("cidr", value);
    int slash = sanitized.indexOf('/');
    String addressPart = slash < 0 ? sanitized : sanitized.substring(0, slash).trim();
    byte[] network = parseAddress(addressPart);
    int maxPrefix = network.length * 8;
    int prefix = maxPrefix;
    if (slash >= 0) {
      prefix = (int) Numbers.requireRange(
          "cidr prefix", Numbers.parseLong("cidr prefix", sanitized.substring(slash + 1)), 0, maxPrefix);
    }
    return new Cidr(network, prefix);
  }

  /**
   * Parses a TCP/UDP port number.
   *
   * @param value port text
   * @return port in {@code [0, 65535]}
   * @throws IllegalArgumentException if the value is not numeric or out of range
   */
  public static int parsePort(String value) {
    return (int) Numbers.requireRange("port", Numbers.parseLong("port", value), 0, 65_535);
  }

  /** Parses and range-checks IPv4 octets (0..255). */
  private static byte[] ipv4Octets(String host) {
    byte[] octets = new byte[4];
    int startIndex = 0;
    for (int i = 0; i < 4; i++) {
      final int endIndex = (i < 3) ? host.indexOf('.', startIndex) : host.length();
      final int octet = Integer.parseInt(host.substring(startIndex, endIndex));
      Numbers.requireRange("IPv4 octet", octet, 0, 255);
      octets[i] = (byte) octet;
      startIndex = endIndex + 1;
    }
    return octets;
  }

  /**
   * An address block with a prefix length. Host bits of the network address are ignored.
   */
  public static final class Cidr {
    private final byte[] network;
    private final int prefixLength;

    Cidr(byte[] network, int prefixLength) {
      this.network = network.clone();
      this.prefixLength = prefixLength;
    }

    /**
     * Returns the prefix length.
     *
     * @return prefix bits
     */
    public int prefixLength() {
      return prefixLength;
    }

    /**
     * Tests whether an address literal lies inside this block. Mismatched families never match.
     *
     * @param address textual address; unparseable values never match
     * @return {@code true} if the address is inside the block
     */
    public boolean contains(String address) {
      if (address == null || address.isBlank()) {
        return false;
      }
      byte[] candidate;
      try {
        candidate = parseAddress(address);
      } catch (IllegalArgumentException ex) {
        return false;
      }
      return contains(candidate);
    }

    /**
     * Tests whether raw address bytes lie inside this block.
     *
     * @param candidate 4 or 16 address bytes
     * @return {@code true} if the address is inside the block
     */
    public boolean contains(byte[] candidate) {
      if (candidate == null || candidate.length != network.length) {
        return false;
      }
      int fullBytes = prefixLength / 8;
      for (int i = 0; i < fullBytes; i++) {
        if (candidate[i] != network[i]) {
          return false;
        }
      }
      int remainder = prefixLength % 8;
      if (remainder == 0) {
        return true;
      }
      int mask = (0xFF << (8 - remainder)) & 0xFF;
      return (candidate[fullBytes] & mask) == (network[fullBytes] & mask);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Cidr that)) {
        return false;
      }
      return prefixLength == that.prefixLength && Arrays.equals(network, that.network);
    }

    @Override
    public int hashCode() {
      return 31 * Arrays.hashCode(network) + prefixLength;
    }

    @Override
    public String toString() {
      try {
        return InetAddress.getByAddress(network).getHostAddress() + "/" + prefixLength;
      } catch (UnknownHostException ex) {
        return Arrays.toString(network) + "/" + prefixLength;
      }
    }
  }
}
