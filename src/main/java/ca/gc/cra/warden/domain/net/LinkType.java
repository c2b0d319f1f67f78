package ca.gc.cra.warden.domain.net;

/**
 * Link-layer framing of a captured frame, keyed by the libpcap {@code LINKTYPE_*} code.
 *
 * @since 0.1.0
 */
public enum LinkType {
  /** BSD loopback encapsulation; 4-byte host-order address family header. */
  NULL(0),
  /** IEEE 802.3 Ethernet. */
  ETHERNET(1),
  /** Raw IPv4 or IPv6 without a link header. */
  RAW(101),
  /** Linux cooked capture v1 (16-byte header). */
  LINUX_SLL(113),
  /** Linux cooked capture v2 (20-byte header). */
  LINUX_SLL2(276),
  /** Any link type the decoder does not understand. */
  UNSUPPORTED(-1);

  private final int code;

  LinkType(int code) {
    this.code = code;
  }

  /**
   * Returns the libpcap link-type code.
   *
   * @return numeric code, or {@code -1} for {@link #UNSUPPORTED}
   */
  public int code() {
    return code;
  }

  /**
   * Maps a libpcap link-type (or legacy DLT) code to a link type.
   *
   * @param code link type from a pcap header or capture handle
   * @return matching link type; {@link #UNSUPPORTED} when unknown
   */
  public static LinkType fromCode(int code) {
    return switch (code) {
      case 0 -> NULL;
      case 1 -> ETHERNET;
      // DLT_RAW is 12 on most BSDs and 14 on OpenBSD; pcap files normally carry 101.
      case 12, 14, 101 -> RAW;
      case 113 -> LINUX_SLL;
      case 276 -> LINUX_SLL2;
      default -> UNSUPPORTED;
    };
  }
}
