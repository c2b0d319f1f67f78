package ca.gc.cra.warden.application.pipeline;

import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.PacketSource;
import ca.gc.cra.warden.domain.detect.StructuredFailure;
import ca.gc.cra.warden.domain.detect.WardenFailure;
import ca.gc.cra.warden.domain.net.RawFrame;
import ca.gc.cra.warden.domain.stats.CaptureStatsSnapshot.CaptureState;
import ca.gc.cra.warden.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.warden.validation.Numbers;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Owns the capture worker thread and restarts it after unexpected deaths.
 * <p><strong>Why:</strong> Native capture fails transiently (interfaces bounce, drivers reset); the engine keeps
 * detecting on whatever it has while capture recovers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run a cooperative capture loop that checks the stop flag once per frame.</li>
 *   <li>Classify exits: stop request, drained source, permission or interface failure, crash.</li>
 *   <li>Schedule restarts with exponential backoff, up to {@link Settings#maxRetries()}; then switch to
 *       analysis-only mode for good. The restart fires when its backoff elapses; the periodic
 *       {@link #check(long)} only detects dead workers and retries a restart the timer could not run.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #check(long)} and timed restarts run on the scheduler thread while the
 * capture loop runs on its own thread; shared fields are atomics and relaunches are serialized.</p>
 * <p><strong>Observability:</strong> Emits {@code capture.restart}, {@code capture.crash} and logs actionable
 * remediation for permission and interface failures.</p>
 *
 * @implNote Stopping cannot preempt a native read already in progress; the worker observes the flag when the
 *     current read returns, bounded by the capture timeout.
 * @since 0.1.0
 */
public final class CaptureSupervisor {
  private static final Logger log = LoggerFactory.getLogger(CaptureSupervisor.class);
  private static final long JOIN_TIMEOUT_MILLIS = 5_000L;

  private final Supplier<PacketSource> sources;
  private final Consumer<RawFrame> sink;
  private final Settings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final ThreadFactory threads;

  private final AtomicReference<CaptureState> state = new AtomicReference<>(CaptureState.STOPPED);
  private final AtomicReference<Thread> worker = new AtomicReference<>();
  private final AtomicReference<PacketSource> activeSource = new AtomicReference<>();
  private final AtomicReference<WardenFailure> lastFailure = new AtomicReference<>();
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicInteger consecutiveFailures = new AtomicInteger();
  private final AtomicInteger restarts = new AtomicInteger();
  private final AtomicLong nextAttemptAtMillis = new AtomicLong();
  private volatile ScheduledExecutorService restartTimer;

  /**
   * Creates a supervisor.
   *
   * @param sources creates a fresh packet source for each attempt
   * @param sink receives every captured frame on the capture thread
   * @param settings retry policy
   * @param clock wall clock for backoff scheduling
   * @param metrics metrics sink
   */
  public CaptureSupervisor(
      Supplier<PacketSource> sources,
      Consumer<RawFrame> sink,
      Settings settings,
      ClockPort clock,
      MetricsPort metrics) {
    this.sources = Objects.requireNonNull(sources, "sources");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.threads = ExecutorFactories.newThreadFactory("warden-capture", this::onUncaught);
  }

  /**
   * Launches the first capture attempt; restarts then happen on the {@link #check(long)} tick only.
   *
   * @throws IllegalStateException if already started
   */
  public void start() {
    start(null);
  }

  /**
   * Launches the first capture attempt and schedules each restart on {@code restartTimer} once its backoff
   * elapses.
   *
   * @param restartTimer timer for backoff restarts, or {@code null} to rely on {@link #check(long)}
   * @throws IllegalStateException if already started
   */
  public synchronized void start(ScheduledExecutorService restartTimer) {
    this.restartTimer = restartTimer;
    if (!state.compareAndSet(CaptureState.STOPPED, CaptureState.RESTARTING) || stopRequested.get()) {
      throw new IllegalStateException("Capture supervisor already started");
    }
    launch();
  }

  /**
   * Liveness check, run every status-check interval. Detects a worker that died without bookkeeping and restarts a
   * dead worker whose backoff has elapsed but whose timed restart did not run.
   *
   * @param nowMillis current wall-clock time
   */
  public synchronized void check(long nowMillis) {
    if (stopRequested.get()) {
      return;
    }
    Thread current = worker.get();
    if (state.get() == CaptureState.RUNNING && (current == null || !current.isAlive())) {
      // Worker vanished without running its exit bookkeeping.
      onWorkerExit(Optional.empty(), false, false);
    }
    if (nowMillis >= nextAttemptAtMillis.get()) {
      relaunch("status check");
    }
  }

  private void restartAfterBackoff(Thread exited) {
    try {
      exited.join(JOIN_TIMEOUT_MILLIS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return;
    }
    synchronized (this) {
      if (!stopRequested.get() && worker.get() == exited) {
        relaunch("backoff elapsed");
      }
    }
  }

  // Callers hold the monitor.
  private void relaunch(String trigger) {
    Thread current = worker.get();
    if (state.get() != CaptureState.RESTARTING || (current != null && current.isAlive())) {
      return;
    }
    restarts.incrementAndGet();
    metrics.increment("capture.restart");
    log.info("Restarting capture worker ({}; attempt {} of {})",
        trigger, consecutiveFailures.get(), settings.maxRetries());
    launch();
  }

  /**
   * Requests the capture loop to stop, closes the active source and waits briefly for the worker.
   */
  public void stop() {
    if (!stopRequested.compareAndSet(false, true)) {
      return;
    }
    PacketSource source = activeSource.get();
    if (source != null) {
      try {
        source.close();
      } catch (Exception ex) {
        log.debug("Packet source close during stop failed", ex);
      }
    }
    Thread current = worker.get();
    if (current != null && current != Thread.currentThread()) {
      current.interrupt();
      try {
        current.join(JOIN_TIMEOUT_MILLIS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      if (current.isAlive()) {
        log.warn("Capture worker still blocked in a native read after {} ms", JOIN_TIMEOUT_MILLIS);
      }
    }
    CaptureState previous = state.get();
    if (previous != CaptureState.ANALYSIS_ONLY && previous != CaptureState.FINISHED) {
      state.set(CaptureState.STOPPED);
    }
  }

  /**
   * Returns the capture state.
   *
   * @return state
   */
  public CaptureState state() {
    return state.get();
  }

  /**
   * Returns the number of restarts performed.
   *
   * @return restart count
   */
  public int restarts() {
    return restarts.get();
  }

  /**
   * Returns the failure that most recently ended a capture attempt.
   *
   * @return structured failure, if any
   */
  public Optional<WardenFailure> lastFailure() {
    return Optional.ofNullable(lastFailure.get());
  }

  /**
   * Waits for the current worker to exit.
   *
   * @param timeout maximum wait
   * @return {@code true} if no worker is alive
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitWorker(Duration timeout) throws InterruptedException {
    Thread current = worker.get();
    if (current == null) {
      return true;
    }
    current.join(Math.max(1L, timeout.toMillis()));
    return !current.isAlive();
  }

  private void launch() {
    Thread thread = threads.newThread(this::captureLoop);
    worker.set(thread);
    state.set(CaptureState.RUNNING);
    thread.start();
  }

  private void scheduleRestart(Duration delay) {
    ScheduledExecutorService timer = restartTimer;
    Thread exited = worker.get();
    if (timer == null || exited == null) {
      return;
    }
    try {
      timer.schedule(() -> restartAfterBackoff(exited), delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      log.debug("Restart timer unavailable; the status check will restart capture", ex);
    }
  }

  private void captureLoop() {
    MDC.put("pipeline", "live");
    Exception failure = null;
    boolean exhausted = false;
    boolean delivered = false;
    PacketSource source = null;
    try {
      source = sources.get();
      activeSource.set(source);
      source.start();
      log.info("Capture started on {}", source.describe());
      while (!stopRequested.get() && !Thread.currentThread().isInterrupted()) {
        Optional<RawFrame> frame = source.poll();
        if (frame.isEmpty()) {
          if (source.isExhausted()) {
            exhausted = true;
            break;
          }
          continue;
        }
        delivered = true;
        sink.accept(frame.get());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } catch (Exception ex) {
      failure = ex;
    } finally {
      activeSource.set(null);
      if (source != null) {
        try {
          source.close();
        } catch (Exception closeFailure) {
          log.debug("Packet source close failed", closeFailure);
        }
      }
      if (delivered) {
        consecutiveFailures.set(0);
      }
      onWorkerExit(Optional.ofNullable(failure), exhausted, true);
      MDC.remove("pipeline");
    }
  }

  private void onWorkerExit(Optional<Exception> failure, boolean exhausted, boolean fromWorker) {
    if (stopRequested.get()) {
      return;
    }
    if (exhausted) {
      state.set(CaptureState.FINISHED);
      log.info("Capture source drained");
      return;
    }

    WardenFailure structured = failure
        .filter(StructuredFailure.class::isInstance)
        .map(ex -> ((StructuredFailure) ex).failure())
        .orElse(null);
    if (structured != null
        && (structured.kind() == WardenFailure.Kind.PERMISSION_DENIED
            || structured.kind() == WardenFailure.Kind.INTERFACE_NOT_FOUND)) {
      lastFailure.set(structured);
      state.set(CaptureState.ANALYSIS_ONLY);
      log.error("Capture disabled, continuing in analysis-only mode: {}", structured.render());
      return;
    }

    metrics.increment("capture.crash");
    String detail = failure.map(Throwable::toString).orElse(fromWorker ? "capture loop ended" : "worker died");
    lastFailure.set(structured != null
        ? structured
        : new WardenFailure(WardenFailure.Kind.CAPTURE_IO, detail, "Check interface state and capture privileges"));
    int attempt = consecutiveFailures.incrementAndGet();
    if (attempt > settings.maxRetries()) {
      lastFailure.set(new WardenFailure(
          WardenFailure.Kind.CAPTURE_RETRIES_EXHAUSTED,
          "Capture failed " + (attempt - 1) + " times in a row; last error: " + detail,
          "Fix the capture interface and restart WARDEN; detection continues in analysis-only mode"));
      state.set(CaptureState.ANALYSIS_ONLY);
      log.error("Capture retries exhausted; analysis-only mode", failure.orElse(null));
      return;
    }
    Duration delay = Backoff.delay(attempt, settings.retryBase(), settings.retryCap());
    nextAttemptAtMillis.set(clock.nowMillis() + delay.toMillis());
    state.set(CaptureState.RESTARTING);
    log.warn("Capture worker exited unexpectedly; restart {} of {} in {} ms",
        attempt, settings.maxRetries(), delay.toMillis(), failure.orElse(null));
    scheduleRestart(delay);
  }

  private void onUncaught(Thread thread, Throwable error) {
    log.error("Capture thread {} terminated by uncaught error", thread.getName(), error);
  }

  /**
   * Restart policy.
   *
   * @param maxRetries consecutive failures tolerated before capture is disabled
   * @param retryBase backoff of the first restart
   * @param retryCap maximum backoff
   */
  public record Settings(int maxRetries, Duration retryBase, Duration retryCap) {
    /**
     * Validates bounds.
     */
    public Settings {
      Numbers.requireRange("maxRetries", maxRetries, 0, 1_000);
      Objects.requireNonNull(retryBase, "retryBase");
      Objects.requireNonNull(retryCap, "retryCap");
      if (retryBase.isNegative() || retryCap.compareTo(retryBase) < 0) {
        throw new IllegalArgumentException("retryCap must be >= retryBase >= 0");
      }
    }

    /**
     * Returns the stock policy: 10 retries, 5 s base, 60 s cap.
     *
     * @return defaults
     */
    public static Settings defaults() {
      return new Settings(10, Duration.ofSeconds(5), Duration.ofSeconds(60));
    }
  }
}
