package ca.gc.cra.warden.application.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.detect.Detection;
import ca.gc.cra.warden.domain.detect.DetectionType;
import ca.gc.cra.warden.domain.detect.Severity;
import ca.gc.cra.warden.testutil.Packets;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SignatureMatcherTest {
  private SignatureMatcher matcher;

  @BeforeEach
  void setUp() throws IOException {
    matcher = new SignatureMatcher(new SignatureRuleLoader().loadBuiltIn(), new ConnectionPatternAnalyzer());
  }

  @Test
  void sqlInjectionInPayloadIsHighSeverity() {
    Optional<Detection> hit = matcher.matchContent(
        Packets.tcp("10.0.0.5", "192.0.2.10", 40000, 80, "GET /?q=union select * from users HTTP/1.1"));

    assertTrue(hit.isPresent());
    Detection detection = hit.get();
    assertEquals(DetectionType.SIGNATURE, detection.type());
    assertEquals("sql_injection", detection.ruleId());
    assertEquals(Severity.HIGH, detection.severity());
    assertEquals(SignatureMatcher.PAYLOAD_CONFIDENCE, detection.confidence());
    assertEquals(SignatureMatcher.PAYLOAD_SOURCE, detection.source());
  }

  @Test
  void firstMatchingRuleWins() {
    // Matches both the sql_injection script pattern and the xss_attack patterns.
    Optional<Detection> hit = matcher.matchContent(
        Packets.tcp("10.0.0.5", "192.0.2.10", 40000, 80, "<script>alert(1)</script>"));

    assertEquals("sql_injection", hit.orElseThrow().ruleId());
  }

  @Test
  void uriIsCheckedWhenPayloadIsClean() {
    Optional<Detection> hit = matcher.matchContent(
        Packets.http("10.0.0.5", "192.0.2.10", "GET", "/search?q=document.cookie", "Mozilla/5.0", "hello"));

    Detection detection = hit.orElseThrow();
    assertEquals("xss_attack", detection.ruleId());
    assertEquals(SignatureMatcher.URI_SOURCE, detection.source());
    assertEquals(SignatureMatcher.URI_CONFIDENCE, detection.confidence());
  }

  @Test
  void scannerUserAgentOnlyFlagsStateChangingMethods() {
    Optional<Detection> post = matcher.matchContent(
        Packets.http("10.0.0.5", "192.0.2.10", "POST", "/login", "sqlmap/1.7", "user=a"));
    Optional<Detection> get = matcher.matchContent(
        Packets.http("10.0.0.5", "192.0.2.10", "GET", "/login", "sqlmap/1.7", "user=a"));

    Detection detection = post.orElseThrow();
    assertEquals(ScannerRule.DEFAULT_ID, detection.ruleId());
    assertEquals(Severity.MEDIUM, detection.severity());
    assertEquals("sqlmap", detection.matchedPattern());
    assertEquals(SignatureMatcher.USER_AGENT_SOURCE, detection.source());
    assertTrue(get.isEmpty());
  }

  @Test
  void benignTrafficProducesNothing() {
    List<Detection> detections =
        matcher.match(Packets.tcp("10.0.0.5", "192.0.2.10", 40000, 443, "hello world"));

    assertTrue(detections.isEmpty());
  }
}
