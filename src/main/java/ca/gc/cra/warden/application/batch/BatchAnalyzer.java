package ca.gc.cra.warden.application.batch;

import ca.gc.cra.warden.application.batch.BatchReport.Finding;
import ca.gc.cra.warden.application.batch.BatchReport.Metadata;
import ca.gc.cra.warden.application.batch.BatchReport.ModelMetadata;
import ca.gc.cra.warden.application.batch.BatchReport.Risk;
import ca.gc.cra.warden.application.detect.AnomalyScorer;
import ca.gc.cra.warden.application.detect.ClassificationScorer;
import ca.gc.cra.warden.application.detect.DetectionOrchestrator;
import ca.gc.cra.warden.application.detect.DetectionOrchestrator.AnalysisResult;
import ca.gc.cra.warden.application.port.CachePort;
import ca.gc.cra.warden.application.port.FrameDecoder;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.PacketSource;
import ca.gc.cra.warden.domain.detect.Detection;
import ca.gc.cra.warden.domain.detect.DetectionType;
import ca.gc.cra.warden.domain.detect.WardenFailure;
import ca.gc.cra.warden.domain.net.PacketRecord;
import ca.gc.cra.warden.domain.net.RawFrame;
import ca.gc.cra.warden.infrastructure.capture.PcapFormatException;
import ca.gc.cra.warden.validation.Numbers;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Offline analysis of a capture file into a {@link BatchReport}.
 * <p><strong>Why:</strong> Replays recorded traffic through the same decoder and detectors as live capture, then adds
 * flow-level heuristics and a composite risk score that only make sense over a whole capture.</p>
 * <p><strong>Role:</strong> Application service behind {@code warden analyze}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read up to the packet budget from a {@link PacketSource} opened on the file.</li>
 *   <li>Build {@link FlowAggregates} in one pass and run a fresh {@link DetectionOrchestrator} per run.</li>
 *   <li>Merge heuristic and per-packet findings, deduplicate them and score risk.</li>
 *   <li>Cache reports by file digest and budget.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each call uses its own state; safe to share when the orchestrator supplier
 * returns a new instance per call.</p>
 * <p><strong>Observability:</strong> Sets MDC {@code pipeline=batch}; increments {@code batch.reports},
 * {@code batch.cache.hit}; observes {@code batch.packets} and {@code batch.frames.undecodable}.</p>
 *
 * @since 0.1.0
 */
public final class BatchAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(BatchAnalyzer.class);

  /** Default packet budget. */
  public static final int DEFAULT_MAX_PACKETS = 2_000;
  /** Cache prefix for reports. */
  public static final String CACHE_PREFIX = "pcap";

  private final FrameDecoder decoder;
  private final Function<Path, PacketSource> sources;
  private final Supplier<DetectionOrchestrator> orchestrators;
  private final CachePort cache;
  private final Duration cacheTtl;
  private final MetricsPort metrics;

  /**
   * Creates an analyzer.
   *
   * @param decoder frame decoder
   * @param sources opens a packet source on a capture file
   * @param orchestrators returns a fresh orchestrator with frozen models per run, or {@code null} to skip
   *     per-packet detectors
   * @param cache report cache
   * @param cacheTtl report TTL
   * @param metrics metrics sink
   */
  public BatchAnalyzer(
      FrameDecoder decoder,
      Function<Path, PacketSource> sources,
      Supplier<DetectionOrchestrator> orchestrators,
      CachePort cache,
      Duration cacheTtl,
      MetricsPort metrics) {
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.sources = Objects.requireNonNull(sources, "sources");
    this.orchestrators = Objects.requireNonNull(orchestrators, "orchestrators");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.cacheTtl = Objects.requireNonNull(cacheTtl, "cacheTtl");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Analyzes a capture file.
   *
   * @param pcap capture file
   * @param maxPackets frame budget; must be positive
   * @return report, flagged {@code cached} when served from the cache
   * @throws PcapFormatException if the file is missing, empty or malformed
   * @throws IOException if the file cannot be read
   */
  public BatchReport analyze(Path pcap, int maxPackets) throws IOException {
    Objects.requireNonNull(pcap, "pcap");
    Numbers.requireRange("maxPackets", maxPackets, 1, Integer.MAX_VALUE);
    String previous = MDC.get("pipeline");
    MDC.put("pipeline", "batch");
    try {
      String key = cacheKey(pcap, maxPackets);
      Optional<BatchReport> cached = cache.get(CACHE_PREFIX, key, BatchReport.class);
      if (cached.isPresent()) {
        metrics.increment("batch.cache.hit");
        log.info("Serving cached report for {} (budget {})", pcap, maxPackets);
        return cached.get().withCached(true);
      }
      BatchReport report = run(pcap, maxPackets);
      cache.set(CACHE_PREFIX, key, report, cacheTtl);
      metrics.increment("batch.reports");
      return report;
    } finally {
      if (previous == null) {
        MDC.remove("pipeline");
      } else {
        MDC.put("pipeline", previous);
      }
    }
  }

  private BatchReport run(Path pcap, int maxPackets) throws IOException {
    long startNanos = System.nanoTime();
    FlowAggregates aggregates = new FlowAggregates();
    DetectionOrchestrator orchestrator = orchestrators.get();
    MlPass ml = orchestrator == null ? null : new MlPass(orchestrator);

    long frames = 0;
    long undecodable = 0;
    try (PacketSource source = sources.apply(pcap)) {
      source.start();
      while (frames < maxPackets) {
        Optional<RawFrame> frame = source.poll();
        if (frame.isEmpty()) {
          break;
        }
        frames++;
        Optional<PacketRecord> packet = decoder.decode(frame.get());
        if (packet.isEmpty()) {
          undecodable++;
          continue;
        }
        aggregates.accept(packet.get());
        if (ml != null) {
          ml.accept(packet.get());
        }
      }
    } catch (IOException | RuntimeException ex) {
      throw ex;
    } catch (Exception ex) {
      throw new IOException("Reading " + pcap + " failed: " + ex.getMessage(), ex);
    }

    if (frames == 0) {
      throw new PcapFormatException(
          WardenFailure.Kind.PCAP_EMPTY,
          "Capture file contains no packets: " + pcap,
          "Provide a capture with at least one packet");
    }
    if (undecodable > 0) {
      metrics.observe("batch.frames.undecodable", undecodable);
      log.debug("Skipped {} undecodable frames in {}", undecodable, pcap);
    }
    metrics.observe("batch.packets", aggregates.packets());

    List<Finding> findings = new ArrayList<>(FlowHeuristics.evaluate(aggregates));
    ModelMetadata modelMetadata = ModelMetadata.disabled();
    if (ml != null) {
      findings.addAll(ml.findings);
      modelMetadata = ml.metadata();
    }
    List<Finding> deduplicated = FlowHeuristics.deduplicate(findings);
    Risk risk = RiskScorer.score(deduplicated, modelMetadata);

    long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000L;
    Metadata metadata = new Metadata(
        aggregates.packets(),
        aggregates.bytes(),
        elapsedMs,
        aggregates.durationSeconds(),
        aggregates.captureWindow(),
        false,
        modelMetadata);
    log.info(
        "Analyzed {}: {} packets, {} findings ({} before dedup), risk {} ({}) in {} ms",
        pcap,
        aggregates.packets(),
        deduplicated.size(),
        findings.size(),
        risk.score(),
        risk.riskSource(),
        elapsedMs);
    return new BatchReport(metadata, aggregates.summary(), deduplicated, risk, aggregates.evidence());
  }

  static String cacheKey(Path pcap, int maxPackets) throws IOException {
    MessageDigest digest;
    try {
      digest = MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
    if (!Files.isRegularFile(pcap)) {
      // The packet source reports the missing file with a structured failure.
      return "missing:" + pcap.toAbsolutePath() + ":" + maxPackets;
    }
    byte[] buffer = new byte[64 * 1024];
    try (InputStream in = new DigestInputStream(Files.newInputStream(pcap), digest)) {
      while (in.read(buffer) != -1) {
        // drain
      }
    }
    return HexFormat.of().formatHex(digest.digest()) + ":" + maxPackets;
  }

  /** Per-packet detector pass for one run. */
  private static final class MlPass {
    private final DetectionOrchestrator orchestrator;
    private final ClassificationScorer.ModelInfo classifierInfo;
    private final boolean classificationEnabled;
    private final String anomalyModelType;
    private final Map<String, Long> counts = new LinkedHashMap<>();
    private final List<Double> classifierScores = new ArrayList<>();
    private final List<Finding> findings = new ArrayList<>();
    private double confidenceSum;
    private long packetsAnalyzed;

    MlPass(DetectionOrchestrator orchestrator) {
      this.orchestrator = orchestrator;
      this.classifierInfo = orchestrator.classifier().modelInfo();
      this.classificationEnabled = !"none".equals(classifierInfo.modelType());
      this.anomalyModelType = orchestrator.anomaly().modelInfo().modelType();
      for (DetectionType type : DetectionType.values()) {
        counts.put(type.label(), 0L);
      }
    }

    void accept(PacketRecord packet) {
      AnalysisResult result = orchestrator.analyze(packet);
      packetsAnalyzed++;
      if (result.classification().classified()) {
        classifierScores.add(result.classification().maliciousProbability());
      }
      for (Detection detection : result.detections()) {
        String type = detection.type().label();
        counts.merge(type, 1L, Long::sum);
        confidenceSum += detection.confidence();
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("source_ip", packet.srcIp());
        evidence.put("dest_ip", packet.dstIp());
        evidence.put("protocol", packet.protocol().label());
        evidence.put("detection_type", type);
        evidence.put("model_type", modelType(detection.type()));
        findings.add(new Finding(
            "ml_" + type + "_" + findings.size(),
            detection.description().isEmpty() ? detection.ruleId() : detection.description(),
            detection.severity().label(),
            detection.confidence(),
            detection.description(),
            evidence,
            null,
            type));
      }
    }

    private String modelType(DetectionType type) {
      return switch (type) {
        case SIGNATURE -> "signature_rules";
        case ANOMALY -> anomalyModelType;
        case CLASSIFICATION -> classifierInfo.modelType();
      };
    }

    ModelMetadata metadata() {
      long detections = findings.size();
      double average = detections == 0 ? 0d : Math.round(confidenceSum / detections * 1_000d) / 1_000d;
      return new ModelMetadata(
          true,
          orchestrator.anomaly().state() == AnomalyScorer.State.TRAINED,
          classificationEnabled,
          classifierInfo.trained(),
          classifierInfo.modelType(),
          counts,
          classifierScores,
          average,
          packetsAnalyzed);
    }
  }
}
