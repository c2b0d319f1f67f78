package ca.gc.cra.warden.application.tracking;

import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.domain.net.FlowKey;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Tracks {@link ConnectionState} per {@link FlowKey} with idle-timeout eviction.
 * <p><strong>Why:</strong> Connection duration feeds the feature vector; eviction bounds memory under
 * long-running capture.</p>
 * <p><strong>Role:</strong> Shared state touched by the processing worker (updates) and the sweep
 * (eviction).</p>
 * <p><strong>Thread-safety:</strong> Backed by {@link ConcurrentHashMap}; each update is an atomic per-bucket
 * {@code compute} that swaps an immutable state, so no global lock is held.</p>
 * <p><strong>Performance:</strong> O(1) updates; eviction is O(n) over tracked flows.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionTracker {
  private static final Logger log = LoggerFactory.getLogger(ConnectionTracker.class);

  /** Default idle timeout after which a flow is evicted. */
  public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofMinutes(5);

  private final ConcurrentMap<FlowKey, ConnectionState> connections = new ConcurrentHashMap<>();
  private final long idleTimeoutMillis;
  private final ClockPort clock;

  /**
   * Creates a tracker using the system clock and the default idle timeout.
   */
  public ConnectionTracker() {
    this(DEFAULT_IDLE_TIMEOUT, ClockPort.SYSTEM);
  }

  /**
   * Creates a tracker.
   *
   * @param idleTimeout idle time after which the sweep evicts a flow; must be positive
   * @param clock wall clock used by the no-argument time overloads
   */
  public ConnectionTracker(Duration idleTimeout, ClockPort clock) {
    Objects.requireNonNull(idleTimeout, "idleTimeout");
    if (idleTimeout.isZero() || idleTimeout.isNegative()) {
      throw new IllegalArgumentException("idleTimeout must be positive");
    }
    this.idleTimeoutMillis = idleTimeout.toMillis();
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Opens or refreshes the flow at the current wall-clock time.
   *
   * @param key flow identity
   * @return state after the update
   */
  public ConnectionState startOrTouch(FlowKey key) {
    return startOrTouch(key, clock.nowMillis(), 0);
  }

  /**
   * Opens or refreshes the flow at {@code nowMillis}.
   *
   * @param key flow identity
   * @param nowMillis packet time in epoch milliseconds
   * @param bytes bytes carried by the packet
   * @return state after the update
   */
  public ConnectionState startOrTouch(FlowKey key, long nowMillis, long bytes) {
    Objects.requireNonNull(key, "key");
    return connections.compute(
        key, (k, state) -> state == null ? ConnectionState.open(nowMillis, bytes) : state.touch(nowMillis, bytes));
  }

  /**
   * Returns the flow duration at the current wall-clock time.
   *
   * @param key flow identity
   * @return seconds since the first packet; {@code 0} when the flow is unknown
   */
  public double duration(FlowKey key) {
    return duration(key, clock.nowMillis());
  }

  /**
   * Returns the flow duration at {@code nowMillis}.
   *
   * @param key flow identity
   * @param nowMillis reference time
   * @return seconds since the first packet; {@code 0} when the flow is unknown
   */
  public double duration(FlowKey key, long nowMillis) {
    ConnectionState state = connections.get(key);
    return state == null ? 0d : state.durationSeconds(nowMillis);
  }

  /**
   * Closes the flow and returns its final duration at the current wall-clock time.
   *
   * @param key flow identity
   * @return final duration in seconds, or empty when the flow is unknown
   */
  public OptionalDouble end(FlowKey key) {
    return end(key, clock.nowMillis());
  }

  /**
   * Closes the flow and returns its final duration at {@code nowMillis}.
   *
   * @param key flow identity
   * @param nowMillis reference time
   * @return final duration in seconds, or empty when the flow is unknown
   */
  public OptionalDouble end(FlowKey key, long nowMillis) {
    ConnectionState removed = connections.remove(key);
    return removed == null ? OptionalDouble.empty() : OptionalDouble.of(removed.durationSeconds(nowMillis));
  }

  /**
   * Returns the current state of a flow.
   *
   * @param key flow identity
   * @return state, or empty when the flow is not tracked
   */
  public Optional<ConnectionState> get(FlowKey key) {
    return Optional.ofNullable(connections.get(key));
  }

  /**
   * Evicts flows idle for longer than the timeout at the current wall-clock time.
   *
   * @return number of evicted flows
   */
  public int evictIdle() {
    return evictIdle(clock.nowMillis());
  }

  /**
   * Evicts flows whose last packet is older than the idle timeout relative to {@code nowMillis}.
   *
   * <p>Removal is conditional on the state still being the one inspected, so a flow touched concurrently
   * survives.</p>
   *
   * @param nowMillis reference time
   * @return number of evicted flows
   */
  public int evictIdle(long nowMillis) {
    int evicted = 0;
    for (var entry : connections.entrySet()) {
      ConnectionState state = entry.getValue();
      if (nowMillis - state.lastSeenMillis() > idleTimeoutMillis
          && connections.remove(entry.getKey(), state)) {
        evicted++;
      }
    }
    if (evicted > 0) {
      log.debug("Evicted {} idle connections; {} remain", evicted, connections.size());
    }
    return evicted;
  }

  /**
   * Returns the number of tracked flows.
   *
   * @return active connection count
   */
  public int size() {
    return connections.size();
  }
}
