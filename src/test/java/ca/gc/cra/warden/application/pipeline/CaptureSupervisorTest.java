package ca.gc.cra.warden.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.pipeline.StubSources.FailingSource;
import ca.gc.cra.warden.application.pipeline.StubSources.IdleSource;
import ca.gc.cra.warden.application.pipeline.StubSources.ListSource;
import ca.gc.cra.warden.domain.detect.WardenFailure;
import ca.gc.cra.warden.domain.net.RawFrame;
import ca.gc.cra.warden.domain.stats.CaptureStatsSnapshot.CaptureState;
import ca.gc.cra.warden.infrastructure.capture.CaptureException;
import ca.gc.cra.warden.testutil.Frames;
import ca.gc.cra.warden.testutil.ManualClock;
import ca.gc.cra.warden.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CaptureSupervisorTest {
  private static final Duration WAIT = Duration.ofSeconds(5);

  private final ManualClock clock = new ManualClock(0L);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void drainedSourceFinishesAfterDeliveringFrames() throws InterruptedException {
    List<RawFrame> received = new CopyOnWriteArrayList<>();
    ListSource source = new ListSource(List.of(
        Frames.tcp("10.0.0.5", "192.0.2.10", 40000, 80, "a"),
        Frames.tcp("10.0.0.5", "192.0.2.10", 40000, 80, "b")));
    CaptureSupervisor supervisor = new CaptureSupervisor(
        () -> source, received::add, CaptureSupervisor.Settings.defaults(), clock, metrics);

    supervisor.start();

    assertTrue(supervisor.awaitWorker(WAIT));
    assertEquals(2, received.size());
    assertEquals(CaptureState.FINISHED, supervisor.state());
    assertTrue(source.closed);
  }

  @Test
  void permissionFailureSwitchesToAnalysisOnly() throws InterruptedException {
    CaptureException denied = new CaptureException(
        WardenFailure.Kind.PERMISSION_DENIED, "eth0 requires root", "Run with CAP_NET_RAW", null);
    CaptureSupervisor supervisor = new CaptureSupervisor(
        () -> new FailingSource(denied), frame -> {}, CaptureSupervisor.Settings.defaults(), clock, metrics);

    supervisor.start();
    assertTrue(supervisor.awaitWorker(WAIT));
    supervisor.check(Long.MAX_VALUE);

    assertEquals(CaptureState.ANALYSIS_ONLY, supervisor.state());
    assertEquals(WardenFailure.Kind.PERMISSION_DENIED, supervisor.lastFailure().orElseThrow().kind());
    assertEquals(0, supervisor.restarts());
  }

  @Test
  void transientFailureRestartsAfterBackoff() throws InterruptedException {
    AtomicInteger opened = new AtomicInteger();
    CaptureSupervisor supervisor = new CaptureSupervisor(
        () -> opened.incrementAndGet() == 1
            ? new FailingSource(new IOException("link flapped"))
            : new IdleSource(),
        frame -> {},
        new CaptureSupervisor.Settings(3, Duration.ofSeconds(5), Duration.ofSeconds(60)),
        clock,
        metrics);

    supervisor.start();
    assertTrue(supervisor.awaitWorker(WAIT));
    assertEquals(CaptureState.RESTARTING, supervisor.state());
    assertEquals(WardenFailure.Kind.CAPTURE_IO, supervisor.lastFailure().orElseThrow().kind());

    supervisor.check(4_999L);
    assertEquals(0, supervisor.restarts());

    supervisor.check(5_000L);
    assertEquals(1, supervisor.restarts());
    assertEquals(CaptureState.RUNNING, supervisor.state());
    assertEquals(1, metrics.count("capture.crash"));

    supervisor.stop();
    assertEquals(CaptureState.STOPPED, supervisor.state());
    assertEquals(2, opened.get());
  }

  @Test
  void timedRestartFiresAtBackoffWithoutStatusCheck() throws InterruptedException {
    AtomicInteger opened = new AtomicInteger();
    ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
    CaptureSupervisor supervisor = new CaptureSupervisor(
        () -> opened.incrementAndGet() == 1
            ? new FailingSource(new IOException("driver reset"))
            : new IdleSource(),
        frame -> {},
        new CaptureSupervisor.Settings(3, Duration.ofMillis(50), Duration.ofSeconds(1)),
        clock,
        metrics);
    try {
      supervisor.start(timer);

      long deadline = System.nanoTime() + WAIT.toNanos();
      while (supervisor.restarts() == 0 && System.nanoTime() < deadline) {
        Thread.sleep(10);
      }

      assertEquals(1, supervisor.restarts());
      assertEquals(CaptureState.RUNNING, supervisor.state());
      assertEquals(2, opened.get());
      assertEquals(0L, clock.nowMillis());
    } finally {
      supervisor.stop();
      timer.shutdownNow();
    }
  }

  @Test
  void exhaustedRetriesSwitchToAnalysisOnly() throws InterruptedException {
    CaptureSupervisor supervisor = new CaptureSupervisor(
        () -> new FailingSource(new IOException("gone")),
        frame -> {},
        new CaptureSupervisor.Settings(0, Duration.ofSeconds(1), Duration.ofSeconds(1)),
        clock,
        metrics);

    supervisor.start();
    assertTrue(supervisor.awaitWorker(WAIT));

    assertEquals(CaptureState.ANALYSIS_ONLY, supervisor.state());
    assertEquals(WardenFailure.Kind.CAPTURE_RETRIES_EXHAUSTED, supervisor.lastFailure().orElseThrow().kind());
  }

  @Test
  void cannotStartTwice() {
    CaptureSupervisor supervisor = new CaptureSupervisor(
        IdleSource::new, frame -> {}, CaptureSupervisor.Settings.defaults(), clock, metrics);
    supervisor.start();
    try {
      assertThrows(IllegalStateException.class, supervisor::start);
    } finally {
      supervisor.stop();
    }
  }
}
