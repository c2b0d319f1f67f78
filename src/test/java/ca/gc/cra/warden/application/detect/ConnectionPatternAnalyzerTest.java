package ca.gc.cra.warden.application.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.detect.Detection;
import ca.gc.cra.warden.domain.detect.Severity;
import ca.gc.cra.warden.domain.net.PacketRecord;
import ca.gc.cra.warden.testutil.Frames;
import ca.gc.cra.warden.testutil.Packets;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConnectionPatternAnalyzerTest {

  @Test
  void elevenDistinctPortsFromOneSourceIsPortScan() {
    ConnectionPatternAnalyzer analyzer = new ConnectionPatternAnalyzer();
    for (int port = 1; port <= 10; port++) {
      assertTrue(analyzer.analyze(syn("10.0.0.5", port, port)).isEmpty(), "port " + port);
    }

    Optional<Detection> hit = analyzer.analyze(syn("10.0.0.5", 11, 11));

    Detection detection = hit.orElseThrow();
    assertEquals(ConnectionPatternAnalyzer.PORT_SCAN, detection.ruleId());
    assertEquals(Severity.MEDIUM, detection.severity());
    assertEquals(ConnectionPatternAnalyzer.SOURCE, detection.source());
    assertTrue(detection.description().contains("10.0.0.5"));
  }

  @Test
  void portsFromOtherSourcesDoNotCount() {
    ConnectionPatternAnalyzer analyzer = new ConnectionPatternAnalyzer();
    for (int port = 1; port <= 10; port++) {
      analyzer.analyze(syn("10.0.0.5", port, port));
    }

    assertTrue(analyzer.analyze(syn("10.0.0.6", 11, 11)).isEmpty());
  }

  @Test
  void observationsOutsideTimeWindowAreIgnored() {
    ConnectionPatternAnalyzer analyzer = new ConnectionPatternAnalyzer();
    for (int port = 1; port <= 10; port++) {
      analyzer.analyze(syn("10.0.0.5", port, 0));
    }

    assertTrue(analyzer.analyze(syn("10.0.0.5", 11, 61)).isEmpty());
  }

  @Test
  void packetBurstToOnePortIsDos() {
    ConnectionPatternAnalyzer analyzer = new ConnectionPatternAnalyzer(
        new ConnectionPatternAnalyzer.Settings(1_000, Duration.ofSeconds(60), 10, 5));
    for (int i = 0; i < 5; i++) {
      assertTrue(analyzer.analyze(syn("10.0.0.7", 80, 0)).isEmpty());
    }

    Detection detection = analyzer.analyze(syn("10.0.0.7", 80, 0)).orElseThrow();

    assertEquals(ConnectionPatternAnalyzer.DOS_ATTACK, detection.ruleId());
    assertEquals(Severity.HIGH, detection.severity());
  }

  @Test
  void portlessTrafficCountsTowardFloodVolume() {
    ConnectionPatternAnalyzer analyzer = new ConnectionPatternAnalyzer(
        new ConnectionPatternAnalyzer.Settings(1_000, Duration.ofSeconds(60), 10, 5));
    for (int i = 0; i < 5; i++) {
      assertTrue(analyzer.analyze(Packets.icmp(0L, "10.0.0.9", "192.0.2.10")).isEmpty());
    }
    assertEquals(5, analyzer.windowSize());

    Detection detection = analyzer.analyze(syn("10.0.0.9", 80, 0)).orElseThrow();

    assertEquals(ConnectionPatternAnalyzer.DOS_ATTACK, detection.ruleId());
    assertTrue(detection.description().contains("6 packets"));
  }

  @Test
  void portlessTrafficIsNotADistinctPort() {
    ConnectionPatternAnalyzer analyzer = new ConnectionPatternAnalyzer();
    for (int port = 1; port <= 10; port++) {
      analyzer.analyze(syn("10.0.0.5", port, 0));
    }
    analyzer.analyze(Packets.icmp(0L, "10.0.0.5", "192.0.2.10"));

    assertTrue(analyzer.analyze(syn("10.0.0.5", 10, 0)).isEmpty());
  }

  @Test
  void windowIsBoundedByPacketCount() {
    ConnectionPatternAnalyzer analyzer = new ConnectionPatternAnalyzer(
        new ConnectionPatternAnalyzer.Settings(3, Duration.ofSeconds(60), 10, 100));
    for (int i = 0; i < 10; i++) {
      analyzer.analyze(syn("10.0.0.8", 80, 0));
    }

    assertEquals(3, analyzer.windowSize());
  }

  @Test
  void settingsRejectNonPositiveWindow() {
    assertThrows(IllegalArgumentException.class,
        () -> new ConnectionPatternAnalyzer.Settings(10, Duration.ZERO, 10, 100));
  }

  private static PacketRecord syn(String src, int port, long seconds) {
    return Packets.tcp(seconds * 1_000_000L, src, "192.0.2.10", 40000, port, Frames.SYN, "");
  }
}
