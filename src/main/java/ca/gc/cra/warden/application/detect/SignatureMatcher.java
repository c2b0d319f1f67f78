package ca.gc.cra.warden.application.detect;

import ca.gc.cra.warden.domain.detect.Detection;
import ca.gc.cra.warden.domain.detect.DetectionType;
import ca.gc.cra.warden.domain.net.HttpHints;
import ca.gc.cra.warden.domain.net.PacketRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Signature stage of the detection pipeline.
 * <p><strong>Why:</strong> Known attack strings and behavioral patterns are cheap to match and precise, so they
 * run on every packet before the statistical detectors.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Evaluate content rules against the payload, then the URI, then the User-Agent.</li>
 *   <li>Delegate port-scan and flood rules to the {@link ConnectionPatternAnalyzer}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Content rules are immutable; connection-pattern state is internally locked.</p>
 *
 * @since 0.1.0
 */
public final class SignatureMatcher {
  /** Source tag for payload matches. */
  public static final String PAYLOAD_SOURCE = "payload_analysis";
  /** Source tag for URI matches. */
  public static final String URI_SOURCE = "uri_analysis";
  /** Source tag for User-Agent matches. */
  public static final String USER_AGENT_SOURCE = "user_agent_analysis";

  static final double PAYLOAD_CONFIDENCE = 0.8;
  static final double URI_CONFIDENCE = 0.9;
  static final double USER_AGENT_CONFIDENCE = 0.7;

  private final SignatureRuleSet rules;
  private final ConnectionPatternAnalyzer connectionPatterns;

  /**
   * Creates a matcher.
   *
   * @param rules content rules and scanner rule
   * @param connectionPatterns behavioral rule state owned by this matcher
   */
  public SignatureMatcher(SignatureRuleSet rules, ConnectionPatternAnalyzer connectionPatterns) {
    this.rules = Objects.requireNonNull(rules, "rules");
    this.connectionPatterns = Objects.requireNonNull(connectionPatterns, "connectionPatterns");
  }

  /**
   * Runs both rule classes; at most one content detection and one connection-pattern detection.
   *
   * @param packet decoded packet
   * @return detections in evaluation order
   */
  public List<Detection> match(PacketRecord packet) {
    List<Detection> detections = new ArrayList<>(2);
    matchContent(packet).ifPresent(detections::add);
    matchConnectionPattern(packet).ifPresent(detections::add);
    return detections;
  }

  /**
   * Evaluates content rules. First match wins: payload text, then URI, then User-Agent.
   *
   * @param packet decoded packet
   * @return the first matching signature
   */
  public Optional<Detection> matchContent(PacketRecord packet) {
    long now = packet.timestampMillis();
    String payload = packet.payloadAscii();
    if (!payload.isEmpty()) {
      Optional<Detection> hit = firstRule(payload, PAYLOAD_CONFIDENCE, PAYLOAD_SOURCE, now);
      if (hit.isPresent()) {
        return hit;
      }
    }

    HttpHints http = packet.http();
    if (!http.uri().isEmpty()) {
      Optional<Detection> hit = firstRule(http.uri(), URI_CONFIDENCE, URI_SOURCE, now);
      if (hit.isPresent()) {
        return hit;
      }
    }

    ScannerRule scanner = rules.scanner();
    return scanner.match(http.method(), http.userAgent())
        .map(tool -> new Detection(
            DetectionType.SIGNATURE,
            scanner.id(),
            scanner.severity(),
            USER_AGENT_CONFIDENCE,
            "Suspicious user agent detected: " + http.userAgent(),
            USER_AGENT_SOURCE,
            tool,
            now));
  }

  /**
   * Evaluates the sliding-window rules for the packet's source.
   *
   * @param packet decoded packet
   * @return port scan or flood detection
   */
  public Optional<Detection> matchConnectionPattern(PacketRecord packet) {
    return connectionPatterns.analyze(packet);
  }

  /**
   * Returns the number of loaded content signatures.
   *
   * @return rule count
   */
  public int ruleCount() {
    return rules.size();
  }

  private Optional<Detection> firstRule(String text, double confidence, String source, long now) {
    for (SignatureRule rule : rules.rules()) {
      Optional<Pattern> pattern = rule.firstMatch(text);
      if (pattern.isPresent()) {
        return Optional.of(new Detection(
            DetectionType.SIGNATURE,
            rule.id(),
            rule.severity(),
            confidence,
            rule.description(),
            source,
            pattern.get().pattern(),
            now));
      }
    }
    return Optional.empty();
  }
}
