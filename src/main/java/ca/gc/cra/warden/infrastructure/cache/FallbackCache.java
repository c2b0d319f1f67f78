package ca.gc.cra.warden.infrastructure.cache;

import ca.gc.cra.warden.application.port.CachePort;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CachePort} decorator that degrades to an in-process cache when the primary backend
 * fails.
 * <p><strong>Why:</strong> A cache outage must never fail a read path; callers only lose sharing across
 * processes.</p>
 * <p>Any {@link RuntimeException} from the primary switches every operation to the fallback; the primary is probed
 * again once per {@code retryInterval}.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe if both delegates are.</p>
 *
 * @since 0.1.0
 */
public final class FallbackCache implements CachePort {
  private static final Logger log = LoggerFactory.getLogger(FallbackCache.class);

  private final CachePort primary;
  private final CachePort fallback;
  private final long retryIntervalMillis;
  private final AtomicBoolean degraded = new AtomicBoolean();
  private final AtomicLong degradedSinceNanos = new AtomicLong();

  /**
   * Creates the decorator.
   *
   * @param primary preferred backend
   * @param fallback in-process backend used while the primary is failing
   * @param retryInterval how long to stay on the fallback before probing the primary
   */
  public FallbackCache(CachePort primary, CachePort fallback, Duration retryInterval) {
    this.primary = Objects.requireNonNull(primary, "primary");
    this.fallback = Objects.requireNonNull(fallback, "fallback");
    this.retryIntervalMillis = Objects.requireNonNull(retryInterval, "retryInterval").toMillis();
  }

  @Override
  public <T> Optional<T> get(String prefix, String key, Class<T> type) {
    if (usePrimary()) {
      try {
        return primary.get(prefix, key, type);
      } catch (RuntimeException ex) {
        degrade("get", ex);
      }
    }
    return fallback.get(prefix, key, type);
  }

  @Override
  public void set(String prefix, String key, Object value, Duration ttl) {
    if (usePrimary()) {
      try {
        primary.set(prefix, key, value, ttl);
        return;
      } catch (RuntimeException ex) {
        degrade("set", ex);
      }
    }
    fallback.set(prefix, key, value, ttl);
  }

  @Override
  public boolean delete(String prefix, String key) {
    boolean removed = fallback.delete(prefix, key);
    if (usePrimary()) {
      try {
        removed |= primary.delete(prefix, key);
      } catch (RuntimeException ex) {
        degrade("delete", ex);
      }
    }
    return removed;
  }

  @Override
  public int clearPrefix(String prefix) {
    int removed = fallback.clearPrefix(prefix);
    if (usePrimary()) {
      try {
        removed += primary.clearPrefix(prefix);
      } catch (RuntimeException ex) {
        degrade("clearPrefix", ex);
      }
    }
    return removed;
  }

  @Override
  public CacheStats stats() {
    return isDegraded() ? fallback.stats() : primary.stats();
  }

  /**
   * Reports whether operations are currently served by the fallback.
   *
   * @return {@code true} while degraded
   */
  public boolean isDegraded() {
    return degraded.get();
  }

  private boolean usePrimary() {
    if (!degraded.get()) {
      return true;
    }
    long elapsedMillis = (System.nanoTime() - degradedSinceNanos.get()) / 1_000_000L;
    if (elapsedMillis >= retryIntervalMillis && degraded.compareAndSet(true, false)) {
      log.info("Retrying primary cache backend after {} ms", elapsedMillis);
      return true;
    }
    return false;
  }

  private void degrade(String operation, RuntimeException ex) {
    degradedSinceNanos.set(System.nanoTime());
    if (degraded.compareAndSet(false, true)) {
      log.warn("Primary cache backend failed during {}; using in-memory fallback", operation, ex);
    }
  }
}
