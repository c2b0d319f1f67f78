package ca.gc.cra.warden.application.pipeline;

import ca.gc.cra.warden.application.detect.AlertDeduplicator;
import ca.gc.cra.warden.application.detect.AnomalyScorer;
import ca.gc.cra.warden.application.detect.ClassificationScorer;
import ca.gc.cra.warden.application.detect.DetectionOrchestrator;
import ca.gc.cra.warden.application.detect.TrafficWhitelist;
import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.FrameDecoder;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.PacketSource;
import ca.gc.cra.warden.application.port.StatsStorePort;
import ca.gc.cra.warden.application.tracking.ConnectionTracker;
import ca.gc.cra.warden.domain.detect.Detection;
import ca.gc.cra.warden.domain.detect.WardenFailure;
import ca.gc.cra.warden.domain.net.PacketRecord;
import ca.gc.cra.warden.domain.net.RawFrame;
import ca.gc.cra.warden.domain.stats.CaptureStatsSnapshot;
import ca.gc.cra.warden.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.warden.logging.Logs;
import ca.gc.cra.warden.validation.Numbers;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs live capture and detection: capture thread, bounded ingest queue, processing worker and maintenance timer.
 * <p>The capture thread never blocks on the queue; when it is full the newest packet is dropped and counted.
 * The single processing worker polls with a timeout so it notices shutdown while idle. A scheduler runs the
 * eviction sweep, the capture liveness check and the periodic retrain. Instances are not reusable; call
 * {@link #start()} at most once.</p>
 * <p>All threads are non-daemon and carry an uncaught-exception handler; {@link #stop()} drains them with a
 * bounded wait.</p>
 *
 * @since 0.1.0
 */
public final class LiveEngine implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LiveEngine.class);

  private static final long WORKER_IDLE_POLL_MILLIS = 25L;
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final int SATURATION_LOG_THRESHOLD = 1_000;
  private static final int ERROR_LOG_THRESHOLD = 1_000;
  private static final int MAX_LOGGED_DESCRIPTION_BYTES = 256;

  private final FrameDecoder decoder;
  private final TrafficWhitelist whitelist;
  private final DetectionOrchestrator orchestrator;
  private final AlertDeduplicator dedup;
  private final StatsStorePort statsStore;
  private final AlertListener alerts;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Settings settings;

  private final BlockingQueue<PacketRecord> queue;
  private final CaptureStats stats;
  private final CaptureSupervisor supervisor;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicLong dropLogLimiter = new AtomicLong();
  private final AtomicLong errorLogLimiter = new AtomicLong();
  private final AtomicLong statsLogLimiter = new AtomicLong();
  private final AtomicLong alertsEmitted = new AtomicLong();
  private final CountDownLatch terminated = new CountDownLatch(1);
  private final UncaughtExceptionHandler uncaughtHandler = this::handleWorkerCrash;

  private volatile ExecutorService processingExecutor;
  private volatile ScheduledExecutorService scheduler;

  /**
   * Wires the live engine.
   *
   * @param sources creates a packet source per capture attempt
   * @param decoder frame decoder
   * @param whitelist trusted traffic that skips deep analysis
   * @param orchestrator detection pipeline
   * @param dedup alert deduplicator
   * @param statsStore receives periodic stats snapshots
   * @param alerts receives emitted alerts
   * @param metrics metrics sink
   * @param clock wall clock
   * @param settings queue and timer settings
   */
  public LiveEngine(
      Supplier<PacketSource> sources,
      FrameDecoder decoder,
      TrafficWhitelist whitelist,
      DetectionOrchestrator orchestrator,
      AlertDeduplicator dedup,
      StatsStorePort statsStore,
      AlertListener alerts,
      MetricsPort metrics,
      ClockPort clock,
      Settings settings) {
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.whitelist = Objects.requireNonNull(whitelist, "whitelist");
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    this.dedup = Objects.requireNonNull(dedup, "dedup");
    this.statsStore = Objects.requireNonNull(statsStore, "statsStore");
    this.alerts = Objects.requireNonNull(alerts, "alerts");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.queue = new ArrayBlockingQueue<>(settings.queueCapacity());
    this.stats = new CaptureStats(settings.healthCheckInterval());
    this.supervisor = new CaptureSupervisor(
        Objects.requireNonNull(sources, "sources"), this::onFrame, settings.capture(), clock, metrics);
  }

  /**
   * Starts the processing worker, the maintenance timer and the capture worker.
   *
   * @throws IllegalStateException if already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Live engine already started");
    }
    MDC.put("pipeline", "live");
    try {
      stats.markStarted(clock.nowMillis());
      processingExecutor = ExecutorFactories.newWorkerPool(1, "warden-process", uncaughtHandler);
      processingExecutor.execute(this::processLoop);

      scheduler = ExecutorFactories.newScheduler("warden-sweep", uncaughtHandler);
      long sweepMillis = settings.sweepInterval().toMillis();
      long checkMillis = settings.statusCheckInterval().toMillis();
      scheduler.scheduleWithFixedDelay(this::sweep, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS);
      scheduler.scheduleWithFixedDelay(this::checkCapture, checkMillis, checkMillis, TimeUnit.MILLISECONDS);

      supervisor.start(scheduler);
      log.info("Live engine started with queue capacity {}, sweep every {} s, whitelist {}",
          settings.queueCapacity(), settings.sweepInterval().toSeconds(), whitelist);
    } finally {
      MDC.remove("pipeline");
    }
  }

  /**
   * Stops capture, the timer and the processing worker. Packets still queued are discarded.
   */
  public void stop() {
    if (!stopRequested.compareAndSet(false, true)) {
      return;
    }
    MDC.put("pipeline", "live");
    try {
      log.info("Stopping live engine");
      supervisor.stop();
      shutdown(scheduler, "maintenance");
      shutdown(processingExecutor, "processing");
      int discarded = queue.size();
      queue.clear();
      if (discarded > 0) {
        log.info("Discarded {} queued packets at shutdown", discarded);
      }
      flushStats();
      log.info("Live engine stopped; {} packets, {} dropped, {} alerts",
          health().stats().totalPackets(), stats.dropped(), alertsEmitted.get());
    } finally {
      terminated.countDown();
      MDC.remove("pipeline");
    }
  }

  /**
   * Blocks until {@link #stop()} completes.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void awaitTermination() throws InterruptedException {
    terminated.await();
  }

  @Override
  public void close() {
    stop();
  }

  /**
   * Reports capture stats, model info and capture failure, for health endpoints and the CLI.
   *
   * @return health snapshot
   */
  public Health health() {
    CaptureStatsSnapshot snapshot = snapshot();
    return new Health(
        snapshot,
        orchestrator.anomaly().modelInfo(),
        orchestrator.classifier().modelInfo(),
        dedup.size(),
        supervisor.restarts(),
        supervisor.lastFailure());
  }

  /**
   * Returns the current ingest queue occupancy.
   *
   * @return queued packets
   */
  public int queueSize() {
    return queue.size();
  }

  void onFrame(RawFrame frame) {
    long now = clock.nowMillis();
    stats.recordPacket(frame.data().length, now);
    Optional<PacketRecord> decoded = decoder.decode(frame);
    if (decoded.isEmpty()) {
      stats.recordDropped();
      metrics.increment("live.decode.skipped");
      return;
    }
    if (!queue.offer(decoded.get())) {
      stats.recordDropped();
      metrics.increment("live.packets.dropped");
      long count = dropLogLimiter.incrementAndGet();
      if (count == 1 || count % SATURATION_LOG_THRESHOLD == 0) {
        log.warn("Ingest queue saturated at {} packets; {} packets dropped so far",
            settings.queueCapacity(), count);
      }
      return;
    }
    metrics.increment("live.packets.enqueued");
  }

  void process(PacketRecord packet) {
    if (whitelist.matches(packet)) {
      connections().startOrTouch(packet.flowKey(), packet.timestampMillis(), packet.rawSize());
      metrics.increment("live.packets.whitelisted");
      return;
    }
    DetectionOrchestrator.AnalysisResult result = orchestrator.analyze(packet);
    for (Detection detection : result.detections()) {
      AlertDeduplicator.Outcome outcome = dedup.submit(detection, packet);
      if (!outcome.emitted()) {
        metrics.increment("live.detections.suppressed");
        continue;
      }
      alertsEmitted.incrementAndGet();
      metrics.increment("live.detections.emitted");
      log.warn("ALERT {} severity={} confidence={} {}:{} -> {}:{} source={} {}",
          detection.ruleId(),
          detection.severity().label(),
          String.format(Locale.ROOT, "%.2f", detection.confidence()),
          packet.srcIp(), packet.srcPort(), packet.dstIp(), packet.dstPort(),
          detection.source(),
          Logs.sanitize(detection.description(), MAX_LOGGED_DESCRIPTION_BYTES));
      alerts.onAlert(detection, packet, outcome);
    }
  }

  private void processLoop() {
    MDC.put("pipeline", "live");
    try {
      while (!stopRequested.get()) {
        PacketRecord packet = queue.poll(WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (packet == null) {
          continue;
        }
        try {
          process(packet);
        } catch (RuntimeException ex) {
          metrics.increment("live.process.error");
          long count = errorLogLimiter.incrementAndGet();
          if (count == 1 || count % ERROR_LOG_THRESHOLD == 0) {
            log.warn("Packet processing failed ({} failures so far); skipping packet", count, ex);
          }
        }
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      if (!stopRequested.get()) {
        metrics.increment("live.process.interrupted");
      }
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void sweep() {
    MDC.put("pipeline", "live");
    try {
      long now = clock.nowMillis();
      int flows = connections().evictIdle(now);
      int windows = orchestrator.extractor().evictIdle(now);
      int keys = dedup.prune(now);
      if (flows + windows + keys > 0) {
        log.debug("Sweep evicted {} flows, {} tracker windows, {} dedup keys", flows, windows, keys);
      }
      metrics.observe("live.connections.active", connections().size());
      orchestrator.retrainIfDue();
      flushStats();
    } catch (RuntimeException ex) {
      // A throwing periodic task would be cancelled by the scheduler.
      metrics.increment("live.sweep.error");
      log.warn("Maintenance sweep failed", ex);
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void checkCapture() {
    MDC.put("pipeline", "live");
    try {
      supervisor.check(clock.nowMillis());
    } catch (RuntimeException ex) {
      metrics.increment("live.supervisor.error");
      log.warn("Capture liveness check failed", ex);
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void flushStats() {
    CaptureStatsSnapshot snapshot = snapshot();
    try {
      statsStore.record(snapshot);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } catch (Exception ex) {
      metrics.increment("live.stats.store.error");
      long count = statsLogLimiter.incrementAndGet();
      if (count == 1 || count % ERROR_LOG_THRESHOLD == 0) {
        log.warn("Stats store unavailable; keeping local stats only", ex);
      }
    }
  }

  private CaptureStatsSnapshot snapshot() {
    return stats.snapshot(clock.nowMillis(), queue.size(), connections().size(), supervisor.state());
  }

  private ConnectionTracker connections() {
    return orchestrator.extractor().connections();
  }

  private void shutdown(ExecutorService executor, String name) {
    if (executor == null) {
      return;
    }
    executor.shutdown();
    boolean done = false;
    try {
      done = executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      if (!done) {
        metrics.increment("live.shutdown.force");
        log.warn("{} workers active after {} ms; forcing shutdown", name, SHUTDOWN_TIMEOUT.toMillis());
        executor.shutdownNow();
        done = executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ie) {
      metrics.increment("live.shutdown.interrupted");
      Thread.currentThread().interrupt();
    }
    if (!done) {
      log.error("{} workers failed to terminate cleanly", name);
    }
  }

  private void handleWorkerCrash(Thread thread, Throwable error) {
    metrics.increment("live.worker.uncaught");
    log.error("Live worker {} terminated unexpectedly", thread.getName(), error);
  }

  /**
   * Engine health snapshot.
   *
   * @param stats capture counters
   * @param anomalyModel anomaly model info
   * @param classifierModel classifier model info
   * @param dedupCacheSize keys held by the deduplicator
   * @param captureRestarts capture restarts performed
   * @param captureFailure failure that last ended capture, if any
   */
  public record Health(
      CaptureStatsSnapshot stats,
      AnomalyScorer.ModelInfo anomalyModel,
      ClassificationScorer.ModelInfo classifierModel,
      int dedupCacheSize,
      int captureRestarts,
      Optional<WardenFailure> captureFailure) {}

  /**
   * Queue, timer and capture retry settings.
   *
   * @param queueCapacity ingest queue slots
   * @param sweepInterval eviction sweep interval
   * @param statusCheckInterval capture liveness check interval
   * @param healthCheckInterval silence tolerated before health degrades
   * @param capture capture restart policy
   */
  public record Settings(
      int queueCapacity,
      Duration sweepInterval,
      Duration statusCheckInterval,
      Duration healthCheckInterval,
      CaptureSupervisor.Settings capture) {
    /**
     * Validates bounds.
     */
    public Settings {
      Numbers.requireRange("queueCapacity", queueCapacity, 1, 10_000_000);
      requirePositive("sweepInterval", sweepInterval);
      requirePositive("statusCheckInterval", statusCheckInterval);
      requirePositive("healthCheckInterval", healthCheckInterval);
      Objects.requireNonNull(capture, "capture");
    }

    /**
     * Returns the stock settings: 10,000 slots, 30 s sweep, check and health intervals.
     *
     * @return defaults
     */
    public static Settings defaults() {
      return new Settings(
          10_000,
          Duration.ofSeconds(30),
          Duration.ofSeconds(30),
          Duration.ofSeconds(30),
          CaptureSupervisor.Settings.defaults());
    }

    private static void requirePositive(String name, Duration value) {
      Objects.requireNonNull(value, name);
      if (value.isNegative() || value.isZero()) {
        throw new IllegalArgumentException(name + " must be positive");
      }
    }
  }
}
