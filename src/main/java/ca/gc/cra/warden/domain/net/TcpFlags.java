package ca.gc.cra.warden.domain.net;

/**
 * TCP control flags decoded from the flags octet.
 *
 * @param fin FIN set
 * @param syn SYN set
 * @param rst RST set
 * @param psh PSH set
 * @param ack ACK set
 * @param urg URG set
 * @since 0.1.0
 */
public record TcpFlags(boolean fin, boolean syn, boolean rst, boolean psh, boolean ack, boolean urg) {
  /** Flags for non-TCP packets. */
  public static final TcpFlags NONE = new TcpFlags(false, false, false, false, false, false);

  /**
   * Decodes the low six bits of the TCP flags octet.
   *
   * @param bits flags octet
   * @return decoded flags
   */
  public static TcpFlags fromBits(int bits) {
    return new TcpFlags(
        (bits & 0x01) != 0,
        (bits & 0x02) != 0,
        (bits & 0x04) != 0,
        (bits & 0x08) != 0,
        (bits & 0x10) != 0,
        (bits & 0x20) != 0);
  }

  /**
   * Indicates a connection-opening SYN without ACK.
   *
   * @return {@code true} for SYN-only segments
   */
  public boolean synOnly() {
    return syn && !ack;
  }

  /**
   * Renders the flags in the conventional {@code FSRPAU} letter form.
   *
   * @return letters for set flags; empty when none are set
   */
  public String letters() {
    StringBuilder sb = new StringBuilder(6);
    if (fin) sb.append('F');
    if (syn) sb.append('S');
    if (rst) sb.append('R');
    if (psh) sb.append('P');
    if (ack) sb.append('A');
    if (urg) sb.append('U');
    return sb.toString();
  }
}
