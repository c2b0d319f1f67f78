package ca.gc.cra.warden.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Bounds and neutralizes packet-derived text before it reaches a log line.
 * <p><strong>Why:</strong> Rule descriptions, DNS names, HTTP paths and BPF expressions come from the wire or the
 * operator. A {@code \r\n} inside a DNS label must not forge a second log entry, and a multi-kilobyte payload must
 * not blow up the log.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final char REPLACEMENT = '?';

  private Logs() {}

  /**
   * Replaces ISO control characters with {@code '?'}, then truncates as {@link #truncate(String, int)} does.
   *
   * @param value untrusted text; {@code null} yields {@code "<null>"}
   * @param maxBytes maximum UTF-8 bytes kept; must be positive
   * @return single-line, bounded text
   */
  public static String sanitize(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    StringBuilder clean = null;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (Character.isISOControl(c)) {
        if (clean == null) {
          clean = new StringBuilder(value.length()).append(value, 0, i);
        }
        clean.append(REPLACEMENT);
      } else if (clean != null) {
        clean.append(c);
      }
    }
    return truncate(clean == null ? value : clean.toString(), maxBytes);
  }

  /**
   * Truncates to a UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} yields {@code "<null>"}
   * @param maxBytes maximum number of bytes to keep; must be positive
   * @return the original value when it fits, otherwise the prefix with a {@code (truncated, X of Y)} suffix
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    // A cut inside a multi-byte code point is dropped rather than replaced.
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "... (truncated)";
    }
  }
}
