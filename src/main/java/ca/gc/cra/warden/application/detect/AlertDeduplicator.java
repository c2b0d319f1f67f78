package ca.gc.cra.warden.application.detect;

import ca.gc.cra.warden.application.pipeline.Backoff;
import ca.gc.cra.warden.application.port.AlertStorePort;
import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.domain.detect.Detection;
import ca.gc.cra.warden.domain.net.PacketRecord;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Suppresses repeated detections for the same source, rule and destination port.
 * <p><strong>Why:</strong> A single attack produces a detection per packet; operators want one alert per window.
 * </p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reserve the key atomically in an in-memory cache keyed by {@link DedupKey}.</li>
 *   <li>Consult the alert store for records written by other processes, then insert.</li>
 *   <li>Degrade to in-memory dedup while the store is failing; retry it after a bounded backoff.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Check-and-reserve is a per-key {@link ConcurrentHashMap#compute}. Store I/O
 * happens outside any lock.</p>
 * <p><strong>Observability:</strong> Emits {@code dedup.persisted}, {@code dedup.suppressed} and
 * {@code dedup.store.unavailable}; store failures log at WARN, rate limited.</p>
 *
 * @since 0.1.0
 */
public final class AlertDeduplicator {
  private static final Logger log = LoggerFactory.getLogger(AlertDeduplicator.class);

  static final Duration STORE_RETRY_BASE = Duration.ofSeconds(1);
  static final Duration STORE_RETRY_CAP = Duration.ofSeconds(60);
  private static final int STORE_WARN_EVERY = 100;

  private final AlertStorePort store;
  private final long windowMillis;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final ConcurrentHashMap<DedupKey, Long> recent = new ConcurrentHashMap<>();
  private final AtomicInteger consecutiveStoreFailures = new AtomicInteger();
  private final AtomicLong storeRetryAtMillis = new AtomicLong();
  private final AtomicLong storeFailureCount = new AtomicLong();

  /**
   * Creates a deduplicator.
   *
   * @param store alert store receiving first occurrences
   * @param window suppression window
   * @param clock wall clock driving store retry backoff
   * @param metrics metrics sink
   */
  public AlertDeduplicator(AlertStorePort store, Duration window, ClockPort clock, MetricsPort metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.windowMillis = Objects.requireNonNull(window, "window").toMillis();
    if (windowMillis <= 0) {
      throw new IllegalArgumentException("dedup window must be positive");
    }
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Deduplicates and, for first occurrences, persists a detection.
   *
   * @param detection detection to submit
   * @param context packet that produced it
   * @return outcome; {@link Status#STORE_UNAVAILABLE} still counts as a first occurrence
   */
  public Outcome submit(Detection detection, PacketRecord context) {
    DedupKey key = new DedupKey(context.srcIp(), detection.ruleId(), context.dstPort());
    long created = detection.createdAtMillis();
    boolean[] reserved = new boolean[1];
    recent.compute(key, (k, previous) -> {
      if (previous != null && created - previous < windowMillis) {
        return previous;
      }
      reserved[0] = true;
      return created;
    });
    if (!reserved[0]) {
      metrics.increment("dedup.suppressed");
      return Outcome.DEDUPLICATED;
    }

    long now = clock.nowMillis();
    if (now < storeRetryAtMillis.get()) {
      metrics.increment("dedup.store.unavailable");
      return Outcome.STORE_UNAVAILABLE;
    }
    try {
      if (store.existsRecent(key.sourceIp(), key.ruleId(), key.destPort(), created - windowMillis)) {
        consecutiveStoreFailures.set(0);
        metrics.increment("dedup.suppressed");
        return Outcome.DEDUPLICATED;
      }
      String alertId = store.insert(detection, context);
      consecutiveStoreFailures.set(0);
      metrics.increment("dedup.persisted");
      return Outcome.persisted(alertId);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return Outcome.STORE_UNAVAILABLE;
    } catch (Exception ex) {
      int attempt = consecutiveStoreFailures.incrementAndGet();
      Duration delay = Backoff.delay(attempt, STORE_RETRY_BASE, STORE_RETRY_CAP);
      storeRetryAtMillis.set(now + delay.toMillis());
      metrics.increment("dedup.store.unavailable");
      long failures = storeFailureCount.incrementAndGet();
      if (failures == 1 || failures % STORE_WARN_EVERY == 0) {
        log.warn("Alert store unavailable (failure {}); in-memory dedup only, retrying in {} ms",
            failures, delay.toMillis(), ex);
      }
      return Outcome.STORE_UNAVAILABLE;
    }
  }

  /**
   * Drops cache entries older than twice the window.
   *
   * @param nowMillis reference time
   * @return entries removed
   */
  public int prune(long nowMillis) {
    long cutoff = nowMillis - 2 * windowMillis;
    int before = recent.size();
    recent.values().removeIf(timestamp -> timestamp < cutoff);
    return Math.max(0, before - recent.size());
  }

  /**
   * Returns the number of cached keys.
   *
   * @return cache size
   */
  public int size() {
    return recent.size();
  }

  /**
   * Identity of a repeated finding.
   *
   * @param sourceIp source address of the packet
   * @param ruleId signature or rule id
   * @param destPort destination port of the packet
   */
  public record DedupKey(String sourceIp, String ruleId, int destPort) {
    /**
     * Validates identifiers.
     */
    public DedupKey {
      Objects.requireNonNull(sourceIp, "sourceIp");
      Objects.requireNonNull(ruleId, "ruleId");
    }
  }

  /** Dedup decision. */
  public enum Status {
    /** First occurrence, written to the alert store. */
    PERSISTED,
    /** Repeat within the window; suppressed. */
    DEDUPLICATED,
    /** First occurrence, but the store is failing; deduplicated in memory only. */
    STORE_UNAVAILABLE
  }

  /**
   * Dedup outcome.
   *
   * @param status decision
   * @param alertId store id for {@link Status#PERSISTED}; empty otherwise
   */
  public record Outcome(Status status, String alertId) {
    /** Shared suppressed outcome. */
    public static final Outcome DEDUPLICATED = new Outcome(Status.DEDUPLICATED, "");
    /** Shared store-unavailable outcome. */
    public static final Outcome STORE_UNAVAILABLE = new Outcome(Status.STORE_UNAVAILABLE, "");

    /**
     * Normalizes the alert id.
     */
    public Outcome {
      Objects.requireNonNull(status, "status");
      alertId = Objects.requireNonNullElse(alertId, "");
    }

    /**
     * Creates a persisted outcome.
     *
     * @param alertId store id
     * @return outcome
     */
    public static Outcome persisted(String alertId) {
      return new Outcome(Status.PERSISTED, alertId);
    }

    /**
     * Indicates whether the detection should be reported as a new alert.
     *
     * @return {@code false} only for {@link Status#DEDUPLICATED}
     */
    public boolean emitted() {
      return status != Status.DEDUPLICATED;
    }
  }
}
