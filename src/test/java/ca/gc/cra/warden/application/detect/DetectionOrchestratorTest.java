package ca.gc.cra.warden.application.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.detect.DetectionOrchestrator.AnalysisResult;
import ca.gc.cra.warden.application.features.FeatureExtractor;
import ca.gc.cra.warden.application.port.AnomalyModel;
import ca.gc.cra.warden.application.port.AnomalyModelStore;
import ca.gc.cra.warden.application.port.ClassificationModel;
import ca.gc.cra.warden.application.port.SampleCollectorPort;
import ca.gc.cra.warden.application.tracking.ConnectionTracker;
import ca.gc.cra.warden.domain.detect.DetectionType;
import ca.gc.cra.warden.domain.detect.FeatureSchema;
import ca.gc.cra.warden.testutil.ManualClock;
import ca.gc.cra.warden.testutil.Packets;
import ca.gc.cra.warden.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DetectionOrchestratorTest {
  private final ManualClock clock = new ManualClock(0L);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void signatureHitIsReportedWithClassification() throws IOException {
    List<String> labels = new ArrayList<>();
    DetectionOrchestrator orchestrator =
        orchestrator(new StubClassifier(true, 0.9, 0.1), (f, p, label, by, c) -> labels.add(label));

    AnalysisResult result = orchestrator.analyze(
        Packets.tcp("10.0.0.5", "192.0.2.10", 40000, 80, "id=1 union select password from users"));

    assertEquals(1, result.detections().size());
    assertEquals("sql_injection", result.detections().get(0).ruleId());
    assertTrue(result.classification().classified());
    assertEquals(List.of("malicious"), labels);
    assertEquals(1, metrics.count("detect.packets"));
    assertEquals(1, metrics.count("detect.signature"));
  }

  @Test
  void benignPacketIsSampledAsBenign() throws IOException {
    List<String> labels = new ArrayList<>();
    DetectionOrchestrator orchestrator =
        orchestrator(new StubClassifier(true, 0.9, 0.1), (f, p, label, by, c) -> labels.add(label));

    AnalysisResult result = orchestrator.analyze(Packets.tcp("10.0.0.5", "192.0.2.10", 40000, 443, "hello"));

    assertTrue(result.detections().isEmpty());
    assertEquals(List.of("benign"), labels);
  }

  @Test
  void noSamplesWithoutClassifier() throws IOException {
    List<String> labels = new ArrayList<>();
    DetectionOrchestrator orchestrator =
        orchestrator(new StubClassifier(false, 0d, 0d), (f, p, label, by, c) -> labels.add(label));

    AnalysisResult result = orchestrator.analyze(Packets.tcp("10.0.0.5", "192.0.2.10", 40000, 443, "hello"));

    assertFalse(result.classification().classified());
    assertTrue(labels.isEmpty());
  }

  @Test
  void maliciousClassificationAddsDetection() throws IOException {
    DetectionOrchestrator orchestrator = orchestrator(new StubClassifier(true, 0.02, 0.98), SampleCollectorPort.NONE);

    AnalysisResult result = orchestrator.analyze(Packets.tcp("10.0.0.5", "192.0.2.10", 40000, 443, "hello"));

    assertEquals(1, result.detections().size());
    assertEquals(DetectionType.CLASSIFICATION, result.detections().get(0).type());
  }

  @Test
  void bruteForceSignatureFeedsFailedLoginFeature() throws IOException {
    DetectionOrchestrator orchestrator = orchestrator(new StubClassifier(false, 0d, 0d), SampleCollectorPort.NONE);

    orchestrator.analyze(Packets.tcp("10.0.0.5", "192.0.2.10", 40000, 22, "brute_force"));
    AnalysisResult next = orchestrator.analyze(Packets.tcp("10.0.0.5", "192.0.2.10", 40001, 22, "hello"));

    assertEquals(1d, next.features().failedLoginAttempts());
  }

  @Test
  void collectorFailureDoesNotInterruptAnalysis() throws IOException {
    DetectionOrchestrator orchestrator = orchestrator(new StubClassifier(true, 0.9, 0.1), (f, p, label, by, c) -> {
      throw new IOException("disk full");
    });

    AnalysisResult result = orchestrator.analyze(Packets.tcp("10.0.0.5", "192.0.2.10", 40000, 443, "hello"));

    assertTrue(result.detections().isEmpty());
    assertEquals(1, metrics.count("detect.samples.failed"));
  }

  @Test
  void retrainRunsOnlyAfterInterval() throws IOException {
    DetectionOrchestrator orchestrator = orchestrator(new StubClassifier(false, 0d, 0d), SampleCollectorPort.NONE);
    orchestrator.analyze(Packets.tcp("10.0.0.5", "192.0.2.10", 40000, 443, "hello"));

    assertFalse(orchestrator.retrainIfDue());
    clock.advance(Duration.ofHours(1));
    assertTrue(orchestrator.retrainIfDue());
    assertFalse(orchestrator.retrainIfDue());
    assertEquals(1, metrics.count("detect.anomaly.retrain"));
  }

  private DetectionOrchestrator orchestrator(ClassificationModel model, SampleCollectorPort samples)
      throws IOException {
    AnomalyScorer anomaly = new AnomalyScorer(
        new AnomalyScorer.Settings(100, 1, 0.5),
        vectors -> new QuietModel(),
        AnomalyModelStore.NONE,
        ConfidenceTransform.ABS_CLAMP);
    return new DetectionOrchestrator(
        new FeatureExtractor(new ConnectionTracker(Duration.ofMinutes(5), clock)),
        new SignatureMatcher(new SignatureRuleLoader().loadBuiltIn(), new ConnectionPatternAnalyzer()),
        anomaly,
        new ClassificationScorer(model, 0.8),
        samples,
        clock,
        Duration.ofHours(1),
        metrics);
  }

  private static final class QuietModel implements AnomalyModel {
    @Override
    public double decisionScore(double[] features) {
      return 0.1;
    }

    @Override
    public boolean isAnomaly(double[] features) {
      return false;
    }

    @Override
    public String modelType() {
      return "quiet";
    }
  }

  private static final class StubClassifier implements ClassificationModel {
    private final boolean trained;
    private final double benign;
    private final double malicious;

    StubClassifier(boolean trained, double benign, double malicious) {
      this.trained = trained;
      this.benign = benign;
      this.malicious = malicious;
    }

    @Override
    public boolean isTrained() {
      return trained;
    }

    @Override
    public FeatureSchema featureSchema() {
      return FeatureSchema.nativeSchema();
    }

    @Override
    public double[] predictProba(double[] vector) {
      return new double[] {benign, malicious};
    }

    @Override
    public String modelType() {
      return "stub";
    }
  }
}
