package ca.gc.cra.warden.application.port;

import java.time.Duration;
import java.util.Optional;

/**
 * <strong>What:</strong> Pluggable key/value cache contract with per-entry TTL.
 * <p><strong>Why:</strong> Read summaries (such as batch reports) are cached by an external backend when one is
 * available and by an in-process map otherwise.</p>
 * <p><strong>Role:</strong> Implemented by {@code InMemoryCacheAdapter} and the {@code FallbackCache}
 * decorator.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public interface CachePort {
  /** TTL applied by {@link #set(String, String, Object)}. */
  Duration DEFAULT_TTL = Duration.ofSeconds(300);

  /**
   * Looks up a live entry.
   *
   * @param prefix key namespace
   * @param key key within the namespace
   * @param type expected value type
   * @param <T> value type
   * @return value when present, unexpired and of the requested type
   */
  <T> Optional<T> get(String prefix, String key, Class<T> type);

  /**
   * Stores an entry.
   *
   * @param prefix key namespace
   * @param key key within the namespace
   * @param value value to store; must not be {@code null}
   * @param ttl time to live; must be positive
   */
  void set(String prefix, String key, Object value, Duration ttl);

  /**
   * Stores an entry with {@link #DEFAULT_TTL}.
   *
   * @param prefix key namespace
   * @param key key within the namespace
   * @param value value to store
   */
  default void set(String prefix, String key, Object value) {
    set(prefix, key, value, DEFAULT_TTL);
  }

  /**
   * Removes an entry.
   *
   * @param prefix key namespace
   * @param key key within the namespace
   * @return {@code true} if an entry was removed
   */
  boolean delete(String prefix, String key);

  /**
   * Removes every entry in a namespace.
   *
   * @param prefix key namespace
   * @return number of entries removed
   */
  int clearPrefix(String prefix);

  /**
   * Returns operation counters.
   *
   * @return cache statistics
   */
  CacheStats stats();

  /**
   * Cache operation counters.
   *
   * @param hits successful lookups
   * @param misses lookups that found nothing
   * @param sets stores
   * @param deletes removals
   * @param backend backend name (e.g. {@code memory})
   */
  record CacheStats(long hits, long misses, long sets, long deletes, String backend) {
    /**
     * Returns the share of lookups that hit.
     *
     * @return hit rate in {@code [0,1]}; {@code 0} before any lookup
     */
    public double hitRate() {
      long total = hits + misses;
      return total == 0 ? 0d : (double) hits / total;
    }
  }
}
