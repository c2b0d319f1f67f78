package ca.gc.cra.warden.infrastructure.cache;

import ca.gc.cra.warden.application.port.CachePort;
import ca.gc.cra.warden.application.port.ClockPort;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * <strong>What:</strong> In-process TTL cache implementing {@link CachePort}.
 * <p><strong>Why:</strong> Serves as the default cache and as the fallback when an external backend fails.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Store values under {@code prefix:key} with an absolute expiry.</li>
 *   <li>Drop expired entries lazily on read and in bulk through {@link #evictExpired()}.</li>
 *   <li>Bound the entry count, evicting expired entries first and then the entry closest to expiry.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Backed by {@link ConcurrentHashMap}; counters use {@link LongAdder}.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryCacheAdapter implements CachePort {
  /** Default maximum number of entries. */
  public static final int DEFAULT_MAX_ENTRIES = 1_000;
  private static final String BACKEND = "memory";

  private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
  private final ClockPort clock;
  private final int maxEntries;
  private final LongAdder hits = new LongAdder();
  private final LongAdder misses = new LongAdder();
  private final LongAdder sets = new LongAdder();
  private final LongAdder deletes = new LongAdder();

  /**
   * Creates a cache on the system clock with {@link #DEFAULT_MAX_ENTRIES}.
   */
  public InMemoryCacheAdapter() {
    this(ClockPort.SYSTEM, DEFAULT_MAX_ENTRIES);
  }

  /**
   * Creates a cache.
   *
   * @param clock time source for expiry
   * @param maxEntries entry bound; at least 1
   */
  public InMemoryCacheAdapter(ClockPort clock, int maxEntries) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.maxEntries = Math.max(1, maxEntries);
  }

  @Override
  public <T> Optional<T> get(String prefix, String key, Class<T> type) {
    String composite = compose(prefix, key);
    Entry entry = entries.get(composite);
    long now = clock.nowMillis();
    if (entry == null || entry.expired(now)) {
      if (entry != null) {
        entries.remove(composite, entry);
      }
      misses.increment();
      return Optional.empty();
    }
    if (!type.isInstance(entry.value())) {
      misses.increment();
      return Optional.empty();
    }
    hits.increment();
    return Optional.of(type.cast(entry.value()));
  }

  @Override
  public void set(String prefix, String key, Object value, Duration ttl) {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    String composite = compose(prefix, key);
    if (!entries.containsKey(composite) && entries.size() >= maxEntries) {
      makeRoom();
    }
    entries.put(composite, new Entry(value, clock.nowMillis() + ttl.toMillis()));
    sets.increment();
  }

  @Override
  public boolean delete(String prefix, String key) {
    boolean removed = entries.remove(compose(prefix, key)) != null;
    if (removed) {
      deletes.increment();
    }
    return removed;
  }

  @Override
  public int clearPrefix(String prefix) {
    String start = Objects.requireNonNull(prefix, "prefix") + ':';
    int removed = 0;
    for (String key : entries.keySet()) {
      if (key.startsWith(start) && entries.remove(key) != null) {
        removed++;
      }
    }
    deletes.add(removed);
    return removed;
  }

  @Override
  public CacheStats stats() {
    return new CacheStats(hits.sum(), misses.sum(), sets.sum(), deletes.sum(), BACKEND);
  }

  /**
   * Removes all expired entries.
   *
   * @return number removed
   */
  public int evictExpired() {
    long now = clock.nowMillis();
    int before = entries.size();
    entries.entrySet().removeIf(e -> e.getValue().expired(now));
    return Math.max(0, before - entries.size());
  }

  /**
   * Returns the live entry count, including entries not yet evicted.
   *
   * @return entry count
   */
  public int size() {
    return entries.size();
  }

  private void makeRoom() {
    if (evictExpired() > 0) {
      return;
    }
    entries.entrySet().stream()
        .min(Map.Entry.comparingByValue((a, b) -> Long.compare(a.expiresAtMillis(), b.expiresAtMillis())))
        .ifPresent(oldest -> entries.remove(oldest.getKey(), oldest.getValue()));
  }

  private static String compose(String prefix, String key) {
    return Objects.requireNonNull(prefix, "prefix") + ':' + Objects.requireNonNull(key, "key");
  }

  private record Entry(Object value, long expiresAtMillis) {
    boolean expired(long now) {
      return now >= expiresAtMillis;
    }
  }
}
