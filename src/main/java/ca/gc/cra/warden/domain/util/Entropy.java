package ca.gc.cra.warden.domain.util;

/**
 * Shannon entropy over byte ranges, in bits per byte.
 *
 * @since 0.1.0
 */
public final class Entropy {
  private static final double LN2 = Math.log(2d);

  private Entropy() {}

  /**
   * Computes the Shannon entropy of {@code data[off, off+len)}.
   *
   * @param data source bytes; may be {@code null}
   * @param off first byte
   * @param len number of bytes
   * @return entropy in {@code [0, 8]}; {@code 0} for empty or invalid ranges
   */
  public static double shannon(byte[] data, int off, int len) {
    if (data == null || len <= 0 || off < 0 || off + len > data.length) {
      return 0d;
    }
    int[] counts = new int[256];
    for (int i = off; i < off + len; i++) {
      counts[data[i] & 0xFF]++;
    }
    double entropy = 0d;
    for (int count : counts) {
      if (count == 0) {
        continue;
      }
      double p = (double) count / len;
      entropy -= p * (Math.log(p) / LN2);
    }
    return entropy;
  }
}
