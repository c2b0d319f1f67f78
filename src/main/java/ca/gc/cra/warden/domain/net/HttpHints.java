package ca.gc.cra.warden.domain.net;

import java.util.Objects;

/**
 * Best-effort HTTP request attributes lifted from the first bytes of a TCP payload.
 *
 * <p>Empty strings mean "not observed"; hints are never required for detection.</p>
 *
 * @param method request method such as {@code GET}
 * @param uri request target as it appeared on the request line
 * @param userAgent value of the {@code User-Agent} header
 * @param host value of the {@code Host} header
 * @since 0.1.0
 */
public record HttpHints(String method, String uri, String userAgent, String host) {
  /** Hints for packets that carry no HTTP request line. */
  public static final HttpHints NONE = new HttpHints("", "", "", "");

  /**
   * Normalizes {@code null} components to empty strings.
   */
  public HttpHints {
    method = Objects.requireNonNullElse(method, "");
    uri = Objects.requireNonNullElse(uri, "");
    userAgent = Objects.requireNonNullElse(userAgent, "");
    host = Objects.requireNonNullElse(host, "");
  }

  /**
   * Indicates whether a request line was recognized.
   *
   * @return {@code true} when a method was extracted
   */
  public boolean present() {
    return !method.isEmpty();
  }
}
