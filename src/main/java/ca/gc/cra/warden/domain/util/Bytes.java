package ca.gc.cra.warden.domain.util;

/**
 * <strong>What:</strong> Utility methods for reading unsigned integers from byte arrays.
 * <p><strong>Why:</strong> Supports the frame decoder (network byte order) and the pcap file reader (either byte
 * order, chosen by the file's magic number).</p>
 * <p><strong>Thread-safety:</strong> Stateless static helpers; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Constant-time bit manipulations; out-of-range reads return 0 instead of
 * throwing.</p>
 *
 * @since 0.1.0
 */
public final class Bytes {
  private Bytes() {}

  /**
   * Reads an unsigned 8-bit value.
   *
   * @param a byte array source; may be {@code null}
   * @param off offset in the array
   * @return unsigned value in the range {@code [0,255]} or {@code 0} if out of bounds
   */
  public static int u8(byte[] a, int off) {
    if (a == null || off < 0 || off >= a.length) {
      return 0;
    }
    return a[off] & 0xFF;
  }

  /**
   * Reads an unsigned 16-bit big-endian value.
   *
   * @param a byte array source; may be {@code null}
   * @param off offset of the first byte
   * @return unsigned value or {@code 0} when insufficient bytes remain
   */
  public static int u16be(byte[] a, int off) {
    if (a == null || off < 0 || off + 1 >= a.length) {
      return 0;
    }
    return ((a[off] & 0xFF) << 8) | (a[off + 1] & 0xFF);
  }

  /**
   * Reads an unsigned 16-bit little-endian value.
   *
   * @param a byte array source; may be {@code null}
   * @param off offset of the least significant byte
   * @return unsigned value or {@code 0} when insufficient bytes remain
   */
  public static int u16le(byte[] a, int off) {
    if (a == null || off < 0 || off + 1 >= a.length) {
      return 0;
    }
    return (a[off] & 0xFF) | ((a[off + 1] & 0xFF) << 8);
  }

  /**
   * Reads an unsigned 32-bit big-endian value.
   *
   * @param a byte array source; may be {@code null}
   * @param off offset of the most significant byte
   * @return value widened to {@code long} or {@code 0} if out of bounds
   */
  public static long u32be(byte[] a, int off) {
    if (a == null || off < 0 || off + 3 >= a.length) {
      return 0L;
    }
    return ((long) (a[off] & 0xFF) << 24)
        | ((a[off + 1] & 0xFF) << 16)
        | ((a[off + 2] & 0xFF) << 8)
        | (a[off + 3] & 0xFF);
  }

  /**
   * Reads an unsigned 32-bit little-endian value.
   *
   * @param a byte array source; may be {@code null}
   * @param off offset of the least significant byte
   * @return value widened to {@code long} or {@code 0} if out of bounds
   */
  public static long u32le(byte[] a, int off) {
    if (a == null || off < 0 || off + 3 >= a.length) {
      return 0L;
    }
    return (a[off] & 0xFF)
        | ((a[off + 1] & 0xFF) << 8)
        | ((a[off + 2] & 0xFF) << 16)
        | ((long) (a[off + 3] & 0xFF) << 24);
  }

  /**
   * Reads an unsigned 32-bit value in the requested byte order.
   *
   * @param a byte array source
   * @param off offset of the first byte
   * @param bigEndian {@code true} for network order
   * @return value widened to {@code long}
   */
  public static long u32(byte[] a, int off, boolean bigEndian) {
    return bigEndian ? u32be(a, off) : u32le(a, off);
  }

  /**
   * Reads an unsigned 16-bit value in the requested byte order.
   *
   * @param a byte array source
   * @param off offset of the first byte
   * @param bigEndian {@code true} for network order
   * @return unsigned value
   */
  public static int u16(byte[] a, int off, boolean bigEndian) {
    return bigEndian ? u16be(a, off) : u16le(a, off);
  }
}
