package ca.gc.cra.warden.config;

import ca.gc.cra.warden.application.batch.BatchAnalyzer;
import ca.gc.cra.warden.application.detect.AlertDeduplicator;
import ca.gc.cra.warden.application.detect.AnomalyScorer;
import ca.gc.cra.warden.application.detect.ClassificationScorer;
import ca.gc.cra.warden.application.detect.ConnectionPatternAnalyzer;
import ca.gc.cra.warden.application.detect.DetectionOrchestrator;
import ca.gc.cra.warden.application.detect.SignatureMatcher;
import ca.gc.cra.warden.application.detect.SignatureRuleLoader;
import ca.gc.cra.warden.application.detect.SignatureRuleSet;
import ca.gc.cra.warden.application.features.FeatureExtractor;
import ca.gc.cra.warden.application.pipeline.AlertListener;
import ca.gc.cra.warden.application.pipeline.LiveEngine;
import ca.gc.cra.warden.application.port.AlertStorePort;
import ca.gc.cra.warden.application.port.CachePort;
import ca.gc.cra.warden.application.port.ClassificationModel;
import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.FrameDecoder;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.PacketSource;
import ca.gc.cra.warden.application.port.SampleCollectorPort;
import ca.gc.cra.warden.application.port.StatsStorePort;
import ca.gc.cra.warden.application.tracking.ConnectionTracker;
import ca.gc.cra.warden.infrastructure.cache.FallbackCache;
import ca.gc.cra.warden.infrastructure.cache.InMemoryCacheAdapter;
import ca.gc.cra.warden.infrastructure.capture.Pcap4jPacketSource;
import ca.gc.cra.warden.infrastructure.capture.PcapFilePacketSource;
import ca.gc.cra.warden.infrastructure.model.JsonAnomalyModelStore;
import ca.gc.cra.warden.infrastructure.model.LogisticClassificationModel;
import ca.gc.cra.warden.infrastructure.model.StandardizedDistanceEstimator;
import ca.gc.cra.warden.infrastructure.model.UnavailableClassificationModel;
import ca.gc.cra.warden.infrastructure.net.PacketDecoder;
import ca.gc.cra.warden.infrastructure.persistence.InMemoryAlertStore;
import ca.gc.cra.warden.infrastructure.persistence.InMemoryStatsStore;
import ca.gc.cra.warden.infrastructure.persistence.LoggingStatsStore;
import ca.gc.cra.warden.infrastructure.persistence.NdjsonAlertStore;
import ca.gc.cra.warden.infrastructure.persistence.NdjsonSampleCollector;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires WARDEN use cases to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate {@link EngineConfig} into runnable pipelines.</p>
 * <p><strong>Role:</strong> Adapter composition root for the live engine and the batch analyzer.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load signature rules and the classifier model, degrading to "no model" when the file is unusable.</li>
 *   <li>Restore the persisted anomaly model and hand frozen views to batch runs.</li>
 *   <li>Choose alert, stats, sample and cache adapters from configuration.</li>
 *   <li>Close file-backed adapters on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Build on one thread during startup; built components document their own
 * thread-safety.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final int CACHE_MAX_ENTRIES = 256;
  private static final Duration CACHE_RETRY_INTERVAL = Duration.ofSeconds(30);
  // Batch runs never retrain; the interval only has to outlast the run.
  private static final Duration BATCH_RETRAIN_INTERVAL = Duration.ofDays(365);

  private final EngineConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final CachePort primaryCache;
  private final FrameDecoder decoder = new PacketDecoder();
  private final InMemoryStatsStore statsHistory = new InMemoryStatsStore();
  private final Deque<Closeable> closeables = new ArrayDeque<>();

  private SignatureRuleSet rules;
  private ClassificationScorer classifier;
  private AnomalyScorer anomaly;

  /**
   * Creates a composition root on the system clock with only the in-process cache.
   *
   * @param config validated configuration
   * @param metrics metrics adapter shared by built components
   */
  public CompositionRoot(EngineConfig config, MetricsPort metrics) {
    this(config, metrics, ClockPort.SYSTEM, null);
  }

  /**
   * Creates a composition root with explicit clock and cache backend.
   *
   * @param config validated configuration
   * @param metrics metrics adapter shared by built components
   * @param clock wall clock
   * @param primaryCache external cache backend; {@code null} uses only the in-process cache
   */
  public CompositionRoot(EngineConfig config, MetricsPort metrics, ClockPort clock, CachePort primaryCache) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.primaryCache = primaryCache;
  }

  /**
   * Returns the configuration this root was built from.
   *
   * @return configuration
   */
  public EngineConfig config() {
    return config;
  }

  /**
   * Returns the retained stats snapshots recorded by the live engine.
   *
   * @return in-memory stats history
   */
  public InMemoryStatsStore statsHistory() {
    return statsHistory;
  }

  /**
   * Builds the live engine with its own trackers, deduplicator and stores.
   *
   * @param alerts receives emitted alerts
   * @return unstarted engine
   * @throws IOException if a configured rule, model or output file cannot be opened
   */
  public LiveEngine liveEngine(AlertListener alerts) throws IOException {
    SampleCollectorPort samples = SampleCollectorPort.NONE;
    if (config.sampleFile() != null) {
      NdjsonSampleCollector collector = new NdjsonSampleCollector(config.sampleFile());
      closeables.push(collector);
      samples = collector;
    }
    ConnectionTracker connections = new ConnectionTracker(config.idleTimeout(), clock);
    DetectionOrchestrator orchestrator = new DetectionOrchestrator(
        new FeatureExtractor(connections),
        new SignatureMatcher(rules(), new ConnectionPatternAnalyzer(config.connectionSettings())),
        anomaly(),
        classifier(),
        samples,
        clock,
        config.retrainInterval(),
        metrics);
    AlertDeduplicator dedup = new AlertDeduplicator(alertStore(), config.dedupWindow(), clock, metrics);

    LoggingStatsStore logging = new LoggingStatsStore();
    StatsStorePort stats = snapshot -> {
      statsHistory.record(snapshot);
      logging.record(snapshot);
    };
    Supplier<PacketSource> sources = () -> new Pcap4jPacketSource(
        config.iface(), config.snaplen(), config.promiscuous(), config.captureTimeoutMillis(), config.bpf(), metrics);
    log.info(
        "Live engine wired: interface={}, rules={}, classifier={}, whitelist={}",
        config.iface(),
        rules().size(),
        classifier().modelInfo().modelType(),
        config.whitelist());
    return new LiveEngine(
        sources,
        decoder,
        config.whitelist(),
        orchestrator,
        dedup,
        stats,
        alerts,
        metrics,
        clock,
        config.liveSettings());
  }

  /**
   * Builds the batch analyzer.
   *
   * @param mlEnabled whether per-packet detectors run alongside the flow heuristics
   * @return analyzer
   * @throws IOException if a configured rule or model file cannot be read
   */
  public BatchAnalyzer batchAnalyzer(boolean mlEnabled) throws IOException {
    Supplier<DetectionOrchestrator> orchestrators = () -> null;
    if (mlEnabled) {
      SignatureRuleSet ruleSet = rules();
      ClassificationScorer classification = classifier();
      AnomalyScorer frozen = anomaly().frozenView();
      orchestrators = () -> new DetectionOrchestrator(
          new FeatureExtractor(new ConnectionTracker(config.idleTimeout(), clock)),
          new SignatureMatcher(ruleSet, new ConnectionPatternAnalyzer(config.connectionSettings())),
          frozen,
          classification,
          SampleCollectorPort.NONE,
          clock,
          BATCH_RETRAIN_INTERVAL,
          metrics);
    }
    Function<Path, PacketSource> sources = PcapFilePacketSource::new;
    return new BatchAnalyzer(decoder, sources, orchestrators, cache(), config.cacheTtl(), metrics);
  }

  SignatureRuleSet rules() throws IOException {
    if (rules == null) {
      SignatureRuleLoader loader = new SignatureRuleLoader();
      rules = config.signatureFile() == null ? loader.loadBuiltIn() : loader.load(config.signatureFile());
    }
    return rules;
  }

  ClassificationScorer classifier() {
    if (classifier == null) {
      classifier = new ClassificationScorer(
          loadClassifier(config.classifierModelFile()), config.classificationThreshold());
    }
    return classifier;
  }

  AnomalyScorer anomaly() {
    if (anomaly == null) {
      anomaly = new AnomalyScorer(
          config.anomalySettings(),
          new StandardizedDistanceEstimator(),
          new JsonAnomalyModelStore(config.anomalyModelFile()),
          config.confidenceTransform());
      anomaly.restore();
    }
    return anomaly;
  }

  private AlertStorePort alertStore() throws IOException {
    if (config.alertLogFile() == null) {
      return new InMemoryAlertStore();
    }
    NdjsonAlertStore store = new NdjsonAlertStore(config.alertLogFile());
    closeables.push(store);
    return store;
  }

  private CachePort cache() {
    InMemoryCacheAdapter local = new InMemoryCacheAdapter(clock, CACHE_MAX_ENTRIES);
    if (primaryCache == null) {
      return local;
    }
    return new FallbackCache(primaryCache, local, CACHE_RETRY_INTERVAL);
  }

  private static ClassificationModel loadClassifier(Path file) {
    if (file == null) {
      log.info("No classifier model configured; classification disabled");
      return UnavailableClassificationModel.INSTANCE;
    }
    try {
      LogisticClassificationModel model = LogisticClassificationModel.load(file);
      log.info("Loaded classifier model {} ({} features)", file, model.featureSchema().expectedLength());
      return model;
    } catch (IOException | IllegalArgumentException ex) {
      log.warn("Classifier model {} unusable; classification disabled: {}", file, ex.getMessage());
      return UnavailableClassificationModel.INSTANCE;
    }
  }

  /**
   * Closes file-backed adapters in reverse creation order.
   */
  @Override
  public void close() {
    while (!closeables.isEmpty()) {
      Closeable closeable = closeables.pop();
      try {
        closeable.close();
      } catch (IOException ex) {
        log.warn("Failed to close {}", closeable, ex);
      }
    }
  }
}
