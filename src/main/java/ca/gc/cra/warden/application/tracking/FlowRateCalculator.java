package ca.gc.cra.warden.application.tracking;

import ca.gc.cra.warden.domain.net.FlowKey;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Accumulates bytes per flow within a rolling window (default 60 seconds) and reports bytes per second.
 *
 * <p>When a flow's window expires the accumulator restarts at the current packet. The rate is the accumulated
 * bytes divided by the time since the window's first byte, or {@code 0} when no time has elapsed.</p>
 *
 * @since 0.1.0
 */
public final class FlowRateCalculator {
  /** Default rolling window. */
  public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

  private final ConcurrentMap<FlowKey, Accumulator> flows = new ConcurrentHashMap<>();
  private final long windowMillis;

  public FlowRateCalculator() {
    this(DEFAULT_WINDOW);
  }

  public FlowRateCalculator(Duration window) {
    this.windowMillis = window.toMillis();
  }

  /**
   * Adds bytes to the flow and returns the updated rate.
   *
   * @param key flow identity
   * @param bytes bytes carried by the packet
   * @param nowMillis packet time
   * @return bytes per second within the window
   */
  public double addAndRate(FlowKey key, long bytes, long nowMillis) {
    Accumulator updated = flows.compute(key, (k, acc) -> {
      if (acc == null || nowMillis - acc.startMillis() > windowMillis) {
        return new Accumulator(nowMillis, bytes);
      }
      return new Accumulator(acc.startMillis(), acc.bytes() + bytes);
    });
    long elapsedMillis = nowMillis - updated.startMillis();
    if (elapsedMillis <= 0) {
      return 0d;
    }
    return updated.bytes() / (elapsedMillis / 1_000d);
  }

  /**
   * Drops flows whose window has expired.
   *
   * @param nowMillis reference time
   * @return number of flows dropped
   */
  public int evictIdle(long nowMillis) {
    int before = flows.size();
    flows.entrySet().removeIf(e -> nowMillis - e.getValue().startMillis() > windowMillis);
    return before - flows.size();
  }

  private record Accumulator(long startMillis, long bytes) {}
}
