package ca.gc.cra.warden.infrastructure.net;

import ca.gc.cra.warden.domain.net.HttpHints;
import ca.gc.cra.warden.domain.util.Bytes;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Best-effort application-layer hints: HTTP request line and headers, DNS question name.
 *
 * <p>Every method returns an empty result on malformed input; hints are never required for detection.</p>
 */
final class ApplicationHints {
  private static final Set<String> HTTP_METHODS =
      Set.of("GET", "POST", "PUT", "DELETE", "HEAD", "OPTIONS", "PATCH", "CONNECT", "TRACE");
  private static final int MAX_HTTP_SCAN_BYTES = 2_048;
  private static final int MAX_METHOD_LENGTH = 7;
  private static final int DNS_HEADER_BYTES = 12;
  private static final int MAX_DNS_NAME_LENGTH = 253;

  private ApplicationHints() {}

  static HttpHints http(byte[] pkt, int offset, int length) {
    if (length < 4 || offset < 0 || offset >= pkt.length) {
      return HttpHints.NONE;
    }
    int scan = Math.min(Math.min(length, MAX_HTTP_SCAN_BYTES), pkt.length - offset);
    int space = -1;
    for (int i = 0; i <= MAX_METHOD_LENGTH && i < scan; i++) {
      if (pkt[offset + i] == ' ') {
        space = i;
        break;
      }
    }
    if (space <= 0) {
      return HttpHints.NONE;
    }
    String method = new String(pkt, offset, space, StandardCharsets.US_ASCII);
    if (!HTTP_METHODS.contains(method)) {
      return HttpHints.NONE;
    }

    String text = new String(pkt, offset, scan, StandardCharsets.ISO_8859_1);
    String[] lines = text.split("\r?\n");
    String[] requestLine = lines[0].split(" ");
    String uri = requestLine.length > 1 ? requestLine[1] : "";
    String userAgent = "";
    String host = "";
    for (int i = 1; i < lines.length; i++) {
      String line = lines[i];
      if (line.isEmpty()) {
        break;
      }
      int colon = line.indexOf(':');
      if (colon <= 0) {
        continue;
      }
      String name = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
      String value = line.substring(colon + 1).trim();
      if (name.equals("user-agent")) {
        userAgent = value;
      } else if (name.equals("host")) {
        host = value;
      }
    }
    return new HttpHints(method, uri, userAgent, host);
  }

  static String dnsQuery(byte[] pkt, int offset, int length) {
    if (length <= DNS_HEADER_BYTES || offset < 0 || offset + length > pkt.length) {
      return "";
    }
    int questions = Bytes.u16be(pkt, offset + 4);
    if (questions == 0) {
      return "";
    }
    int end = offset + length;
    int pos = offset + DNS_HEADER_BYTES;
    StringBuilder name = new StringBuilder();
    while (pos < end) {
      int labelLen = Bytes.u8(pkt, pos);
      if (labelLen == 0) {
        return name.toString();
      }
      // Question names are never compressed; anything else is malformed.
      if ((labelLen & 0xC0) != 0 || pos + 1 + labelLen > end) {
        return "";
      }
      if (name.length() > 0) {
        name.append('.');
      }
      name.append(new String(pkt, pos + 1, labelLen, StandardCharsets.ISO_8859_1));
      if (name.length() > MAX_DNS_NAME_LENGTH) {
        return "";
      }
      pos += 1 + labelLen;
    }
    return "";
  }
}
