package ca.gc.cra.warden.application.tracking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.net.FlowKey;
import ca.gc.cra.warden.testutil.ManualClock;
import java.time.Duration;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;

class ConnectionTrackerTest {
  private static final FlowKey FLOW = new FlowKey("10.0.0.5", "192.0.2.10", 443);

  @Test
  void durationGrowsFromFirstPacket() {
    ManualClock clock = new ManualClock(1_000_000L);
    ConnectionTracker tracker = new ConnectionTracker(Duration.ofSeconds(300), clock);

    tracker.startOrTouch(FLOW);
    clock.advance(Duration.ofMillis(2_500));
    tracker.startOrTouch(FLOW);

    assertEquals(2.5d, tracker.duration(FLOW), 1e-9);
    assertEquals(0d, tracker.duration(new FlowKey("10.9.9.9", "192.0.2.10", 443)));
  }

  @Test
  void sweepEvictsFlowsIdleBeyondTimeout() {
    ManualClock clock = new ManualClock(0L);
    ConnectionTracker tracker = new ConnectionTracker(Duration.ofSeconds(300), clock);
    FlowKey busy = new FlowKey("10.0.0.6", "192.0.2.10", 80);
    tracker.startOrTouch(FLOW);
    tracker.startOrTouch(busy);

    clock.advance(Duration.ofSeconds(200));
    tracker.startOrTouch(busy);
    clock.advance(Duration.ofSeconds(101));

    assertEquals(1, tracker.evictIdle());
    assertFalse(tracker.get(FLOW).isPresent());
    assertTrue(tracker.get(busy).isPresent());
    assertEquals(1, tracker.size());
  }

  @Test
  void flowAtExactlyTimeoutSurvives() {
    ConnectionTracker tracker = new ConnectionTracker(Duration.ofSeconds(10), new ManualClock(0L));
    tracker.startOrTouch(FLOW, 0L, 100);

    assertEquals(0, tracker.evictIdle(10_000L));
    assertEquals(1, tracker.evictIdle(10_001L));
  }

  @Test
  void endRemovesFlowAndReportsDuration() {
    ConnectionTracker tracker = new ConnectionTracker(Duration.ofSeconds(10), new ManualClock(0L));
    tracker.startOrTouch(FLOW, 1_000L, 10);

    OptionalDouble ended = tracker.end(FLOW, 4_000L);

    assertEquals(3d, ended.orElseThrow(), 1e-9);
    assertTrue(tracker.end(FLOW, 5_000L).isEmpty());
  }

  @Test
  void rejectsNonPositiveTimeout() {
    assertThrows(IllegalArgumentException.class, () -> new ConnectionTracker(Duration.ZERO, new ManualClock(0L)));
  }
}
