package ca.gc.cra.warden.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.batch.BatchAnalyzer;
import ca.gc.cra.warden.application.batch.BatchReport;
import ca.gc.cra.warden.application.pipeline.LiveEngine;
import ca.gc.cra.warden.testutil.Frames;
import ca.gc.cra.warden.testutil.ManualClock;
import ca.gc.cra.warden.testutil.PcapFixtures;
import ca.gc.cra.warden.testutil.RecordingMetricsPort;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path tempDir;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final ManualClock clock = new ManualClock(1_704_067_200_000L);

  @Test
  void unusableClassifierFileDisablesClassification() throws Exception {
    Path model = Files.writeString(tempDir.resolve("classifier.json"), "{\"weights\":[1.0],\"expected_features\":4}");
    try (CompositionRoot root = root(Map.of("classifierModelFile", model.toString()))) {
      assertEquals("none", root.classifier().modelInfo().modelType());
      assertFalse(root.classifier().modelInfo().trained());
    }
  }

  @Test
  void loadsConfiguredClassifier() throws Exception {
    Path model = Files.writeString(
        tempDir.resolve("classifier.json"), "{\"weights\":[0.1,0.1],\"bias\":0,\"expected_features\":2}");
    try (CompositionRoot root = root(Map.of("classifierModelFile", model.toString()))) {
      assertEquals("logistic_regression", root.classifier().modelInfo().modelType());
      assertSame(root.classifier(), root.classifier());
    }
  }

  @Test
  void customSignatureFileReplacesBuiltIns() throws Exception {
    Path rules = Files.writeString(tempDir.resolve("rules.yaml"),
        "version: 1\nrules:\n  - {id: beacon, severity: low, patterns: ['BEACON-[0-9]+']}\n");
    try (CompositionRoot root = root(Map.of("signatureFile", rules.toString()))) {
      assertEquals(1, root.rules().size());
    }
    try (CompositionRoot root = root(Map.of())) {
      assertEquals(7, root.rules().size());
    }
  }

  @Test
  void liveEngineWiringOpensAlertLog() throws Exception {
    Path alerts = tempDir.resolve("logs").resolve("alerts.ndjson");
    try (CompositionRoot root = root(Map.of("alertLogFile", alerts.toString(), "interface", "eth9"))) {
      LiveEngine engine = root.liveEngine((detection, packet, outcome) -> { });

      assertEquals(0L, engine.health().stats().totalPackets());
      assertTrue(Files.exists(alerts));
    }
  }

  @Test
  void batchAnalyzerCachesReports() throws Exception {
    Path pcap = PcapFixtures.writePcap(tempDir.resolve("one.pcap"),
        List.of(Frames.tcp("203.0.113.5", "198.51.100.10", 40000, 80, "hello")));
    try (CompositionRoot root = root(Map.of())) {
      BatchAnalyzer analyzer = root.batchAnalyzer(true);

      BatchReport first = analyzer.analyze(pcap, 10);
      BatchReport second = analyzer.analyze(pcap, 10);

      assertFalse(first.metadata().cached());
      assertTrue(second.metadata().cached());
      assertTrue(first.metadata().modelMetadata().mlEnabled());
    }
  }

  private CompositionRoot root(Map<String, String> overrides) {
    Map<String, String> values = new HashMap<>(overrides);
    values.put("anomalyModelFile", tempDir.resolve("anomaly.json").toString());
    return new CompositionRoot(EngineConfig.fromMap(values), metrics, clock, null);
  }
}
