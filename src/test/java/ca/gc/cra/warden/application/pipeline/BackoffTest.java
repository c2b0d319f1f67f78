package ca.gc.cra.warden.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class BackoffTest {

  @Test
  void doublesFromBaseUntilCap() {
    Duration base = Duration.ofSeconds(5);
    Duration cap = Duration.ofSeconds(60);

    assertEquals(Duration.ofSeconds(5), Backoff.delay(1, base, cap));
    assertEquals(Duration.ofSeconds(10), Backoff.delay(2, base, cap));
    assertEquals(Duration.ofSeconds(40), Backoff.delay(4, base, cap));
    assertEquals(cap, Backoff.delay(5, base, cap));
    assertEquals(cap, Backoff.delay(64, base, cap));
  }

  @Test
  void nonPositiveAttemptUsesBase() {
    assertEquals(Duration.ofSeconds(1), Backoff.delay(0, Duration.ofSeconds(1), Duration.ofSeconds(10)));
  }
}
