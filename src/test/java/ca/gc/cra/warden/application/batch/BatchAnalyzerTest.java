package ca.gc.cra.warden.application.batch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.detect.AnomalyScorer;
import ca.gc.cra.warden.application.detect.ClassificationScorer;
import ca.gc.cra.warden.application.detect.ConfidenceTransform;
import ca.gc.cra.warden.application.detect.ConnectionPatternAnalyzer;
import ca.gc.cra.warden.application.detect.DetectionOrchestrator;
import ca.gc.cra.warden.application.detect.SignatureMatcher;
import ca.gc.cra.warden.application.detect.SignatureRuleLoader;
import ca.gc.cra.warden.application.detect.SignatureRuleSet;
import ca.gc.cra.warden.application.features.FeatureExtractor;
import ca.gc.cra.warden.application.port.AnomalyModel;
import ca.gc.cra.warden.application.port.AnomalyModelStore;
import ca.gc.cra.warden.application.port.SampleCollectorPort;
import ca.gc.cra.warden.application.tracking.ConnectionTracker;
import ca.gc.cra.warden.domain.detect.FeatureVector;
import ca.gc.cra.warden.domain.detect.WardenFailure;
import ca.gc.cra.warden.infrastructure.cache.InMemoryCacheAdapter;
import ca.gc.cra.warden.infrastructure.capture.PcapFilePacketSource;
import ca.gc.cra.warden.infrastructure.capture.PcapFormatException;
import ca.gc.cra.warden.infrastructure.model.StandardizedDistanceEstimator;
import ca.gc.cra.warden.infrastructure.model.UnavailableClassificationModel;
import ca.gc.cra.warden.infrastructure.net.PacketDecoder;
import ca.gc.cra.warden.testutil.Frames;
import ca.gc.cra.warden.testutil.ManualClock;
import ca.gc.cra.warden.testutil.PcapFixtures;
import ca.gc.cra.warden.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BatchAnalyzerTest {
  private final ManualClock clock = new ManualClock(0L);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private SignatureRuleSet rules;

  @TempDir Path tempDir;

  @BeforeEach
  void loadRules() throws IOException {
    rules = new SignatureRuleLoader().loadBuiltIn();
  }

  @Test
  void benignCaptureWithoutModelsHasNoInventedRisk() throws IOException {
    Path pcap = PcapFixtures.writePcap(tempDir.resolve("benign.pcap"), benignFrames(4));

    BatchReport report = analyzer(() -> null).analyze(pcap, 100);

    assertTrue(report.detections().isEmpty());
    assertEquals(0, report.risk().score());
    assertEquals("low", report.risk().level());
    assertEquals(RiskScorer.SOURCE_UNAVAILABLE, report.risk().riskSource());
    assertFalse(report.metadata().modelMetadata().mlEnabled());
    assertEquals(4, report.metadata().packetsProcessed());
    assertEquals(3d, report.metadata().durationSeconds());
    assertFalse(report.metadata().cached());
  }

  @Test
  void perPacketDetectionsJoinHeuristicFindings() throws IOException {
    List<byte[]> frames = benignFrames(2);
    frames.add(Frames.tcp("10.0.0.7", "192.0.2.10", 40000, 80, "GET /?id=1 union select * from users HTTP/1.1"));
    Path pcap = PcapFixtures.writePcapng(tempDir.resolve("sqli.pcapng"), frames);

    BatchReport report = analyzer(this::orchestrator).analyze(pcap, 100);

    assertEquals(1, report.detections().size());
    BatchReport.Finding finding = report.detections().get(0);
    assertEquals("ml_signature_0", finding.id());
    assertEquals("high", finding.severity());
    assertEquals("10.0.0.7", finding.evidence().get("source_ip"));
    assertEquals("signature_rules", finding.evidence().get("model_type"));
    assertEquals(RiskScorer.SOURCE_DETECTIONS, report.risk().riskSource());
    assertEquals(18, report.risk().score());
    assertTrue(report.metadata().modelMetadata().mlEnabled());
    assertEquals(1L, report.metadata().modelMetadata().detectionCounts().get("signature"));
    assertEquals(3L, report.metadata().modelMetadata().packetsAnalyzed());
    assertTrue(report.metadata().modelMetadata().confidenceScores().isEmpty());
  }

  @Test
  void repeatAnalysisIsServedFromCache() throws IOException {
    Path pcap = PcapFixtures.writePcap(tempDir.resolve("benign.pcap"), benignFrames(3));
    BatchAnalyzer analyzer = analyzer(() -> null);

    BatchReport first = analyzer.analyze(pcap, 100);
    BatchReport second = analyzer.analyze(pcap, 100);
    BatchReport otherBudget = analyzer.analyze(pcap, 2);

    assertFalse(first.metadata().cached());
    assertTrue(second.metadata().cached());
    assertEquals(first.summary(), second.summary());
    assertEquals(first.risk(), second.risk());
    assertFalse(otherBudget.metadata().cached());
    assertEquals(2, otherBudget.metadata().packetsProcessed());
    assertEquals(1, metrics.count("batch.cache.hit"));
    assertEquals(2, metrics.count("batch.reports"));
  }

  @Test
  void freshAnalyzersReplayingOneCaptureAgree() throws IOException {
    List<byte[]> frames = benignFrames(3);
    frames.add(Frames.tcp("10.0.0.9", "192.0.2.10", 41000, 8080, Frames.PSH | Frames.ACK, new byte[1_200]));
    frames.add(Frames.tcp("10.0.0.7", "192.0.2.10", 40000, 80, "GET /?id=1 union select * from users HTTP/1.1"));
    Path pcap = PcapFixtures.writePcap(tempDir.resolve("replay.pcap"), frames);
    AnomalyScorer trained = new AnomalyScorer(
        new AnomalyScorer.Settings(10, 1, 0.5),
        samples -> new OversizeModel(),
        AnomalyModelStore.NONE,
        ConfidenceTransform.ABS_CLAMP);
    trained.observe(FeatureVector.ZERO, 0L);

    BatchReport first = analyzer(() -> orchestrator(trained.frozenView())).analyze(pcap, 100);
    BatchReport second = analyzer(() -> orchestrator(trained.frozenView())).analyze(pcap, 100);

    assertFalse(second.metadata().cached());
    assertTrue(first.detections().stream().anyMatch(f -> "anomaly".equals(f.mlSource())));
    assertEquals(first.detections(), second.detections());
    assertEquals(first.risk().score(), second.risk().score());
    assertEquals(AnomalyScorer.State.TRAINED, trained.state());
    assertEquals(1, trained.modelInfo().trainingSamples());
  }

  @Test
  void cacheKeyTracksContentAndBudget() throws IOException {
    Path a = PcapFixtures.writePcap(tempDir.resolve("a.pcap"), benignFrames(2));
    Path b = PcapFixtures.writePcap(tempDir.resolve("b.pcap"), benignFrames(2));
    Path c = PcapFixtures.writePcap(tempDir.resolve("c.pcap"), benignFrames(3));

    assertEquals(BatchAnalyzer.cacheKey(a, 10), BatchAnalyzer.cacheKey(b, 10));
    assertNotEquals(BatchAnalyzer.cacheKey(a, 10), BatchAnalyzer.cacheKey(a, 11));
    assertNotEquals(BatchAnalyzer.cacheKey(a, 10), BatchAnalyzer.cacheKey(c, 10));
  }

  @Test
  void undecodableFramesAreSkippedAndCounted() throws IOException {
    List<byte[]> frames = benignFrames(2);
    frames.add(new byte[] {0x01, 0x02, 0x03, 0x04});
    Path pcap = PcapFixtures.writePcap(tempDir.resolve("mixed.pcap"), frames);

    BatchReport report = analyzer(() -> null).analyze(pcap, 100);

    assertEquals(2, report.metadata().packetsProcessed());
    assertEquals(List.of(1L), metrics.observed("batch.frames.undecodable"));
  }

  @Test
  void captureWithoutPacketsIsRejected() throws IOException {
    Path pcap = PcapFixtures.writePcap(tempDir.resolve("empty.pcap"), List.of());

    PcapFormatException ex =
        assertThrows(PcapFormatException.class, () -> analyzer(() -> null).analyze(pcap, 100));
    assertEquals(WardenFailure.Kind.PCAP_EMPTY, ex.failure().kind());
  }

  @Test
  void missingFileIsRejected() {
    Path missing = tempDir.resolve("missing.pcap");

    PcapFormatException ex =
        assertThrows(PcapFormatException.class, () -> analyzer(() -> null).analyze(missing, 100));
    assertEquals(WardenFailure.Kind.PCAP_INVALID, ex.failure().kind());
  }

  @Test
  void truncatedGarbageIsRejected() throws IOException {
    Path junk = Files.write(tempDir.resolve("junk.pcap"), new byte[] {1, 2, 3, 4, 5, 6, 7, 8});

    assertThrows(PcapFormatException.class, () -> analyzer(() -> null).analyze(junk, 100));
  }

  @Test
  void rejectsNonPositiveBudget() throws IOException {
    Path pcap = PcapFixtures.writePcap(tempDir.resolve("benign.pcap"), benignFrames(1));

    assertThrows(IllegalArgumentException.class, () -> analyzer(() -> null).analyze(pcap, 0));
  }

  private BatchAnalyzer analyzer(Supplier<DetectionOrchestrator> orchestrators) {
    return new BatchAnalyzer(
        new PacketDecoder(),
        PcapFilePacketSource::new,
        orchestrators,
        new InMemoryCacheAdapter(clock, 16),
        Duration.ofHours(1),
        metrics);
  }

  private DetectionOrchestrator orchestrator() {
    return orchestrator(new AnomalyScorer(
            AnomalyScorer.Settings.defaults(),
            new StandardizedDistanceEstimator(),
            AnomalyModelStore.NONE,
            ConfidenceTransform.ABS_CLAMP)
        .frozenView());
  }

  private DetectionOrchestrator orchestrator(AnomalyScorer anomaly) {
    return new DetectionOrchestrator(
        new FeatureExtractor(new ConnectionTracker(Duration.ofMinutes(5), clock)),
        new SignatureMatcher(rules, new ConnectionPatternAnalyzer()),
        anomaly,
        new ClassificationScorer(UnavailableClassificationModel.INSTANCE, 0.8),
        SampleCollectorPort.NONE,
        clock,
        Duration.ofDays(365),
        metrics);
  }

  private static List<byte[]> benignFrames(int count) {
    List<byte[]> frames = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      frames.add(Frames.tcp("10.0.0.5", "192.0.2.10", 40000 + i, 443, Frames.ACK, new byte[0]));
    }
    return frames;
  }

  /** Flags payloads above 1000 bytes. */
  private static final class OversizeModel implements AnomalyModel {
    @Override
    public double decisionScore(double[] features) {
      return features[0] > 1_000d ? -0.9 : 0.2;
    }

    @Override
    public boolean isAnomaly(double[] features) {
      return features[0] > 1_000d;
    }

    @Override
    public String modelType() {
      return "oversize";
    }
  }
}
