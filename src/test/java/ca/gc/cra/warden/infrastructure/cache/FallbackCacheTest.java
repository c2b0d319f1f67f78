package ca.gc.cra.warden.infrastructure.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.port.CachePort;
import ca.gc.cra.warden.testutil.ManualClock;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FallbackCacheTest {
  private final ManualClock clock = new ManualClock(0L);

  @Test
  void usesPrimaryWhileHealthy() {
    InMemoryCacheAdapter primary = new InMemoryCacheAdapter(clock, 10);
    InMemoryCacheAdapter local = new InMemoryCacheAdapter(clock, 10);
    FallbackCache cache = new FallbackCache(primary, local, Duration.ofSeconds(30));

    cache.set("pcap", "k", "v");

    assertEquals(1, primary.size());
    assertEquals(0, local.size());
    assertEquals("v", cache.get("pcap", "k", String.class).orElseThrow());
    assertFalse(cache.isDegraded());
  }

  @Test
  void degradesToFallbackWhenPrimaryFails() {
    FlakyCache primary = new FlakyCache();
    InMemoryCacheAdapter local = new InMemoryCacheAdapter(clock, 10);
    FallbackCache cache = new FallbackCache(primary, local, Duration.ofHours(1));

    cache.set("pcap", "k", "v");

    assertTrue(cache.isDegraded());
    assertEquals("v", cache.get("pcap", "k", String.class).orElseThrow());
    assertEquals(1, primary.calls);
    assertEquals("memory", cache.stats().backend());
  }

  @Test
  void retriesPrimaryAfterInterval() {
    FlakyCache primary = new FlakyCache();
    InMemoryCacheAdapter local = new InMemoryCacheAdapter(clock, 10);
    FallbackCache cache = new FallbackCache(primary, local, Duration.ZERO);

    cache.set("pcap", "k", "v");
    assertTrue(cache.isDegraded());
    primary.failing = false;

    cache.get("pcap", "k", String.class);

    assertFalse(cache.isDegraded());
    assertEquals(2, primary.calls);
  }

  /** Primary backend that throws until told otherwise. */
  private static final class FlakyCache implements CachePort {
    boolean failing = true;
    int calls;

    private void call() {
      calls++;
      if (failing) {
        throw new IllegalStateException("backend unreachable");
      }
    }

    @Override
    public <T> Optional<T> get(String prefix, String key, Class<T> type) {
      call();
      return Optional.empty();
    }

    @Override
    public void set(String prefix, String key, Object value, Duration ttl) {
      call();
    }

    @Override
    public boolean delete(String prefix, String key) {
      call();
      return false;
    }

    @Override
    public int clearPrefix(String prefix) {
      call();
      return 0;
    }

    @Override
    public CacheStats stats() {
      return new CacheStats(0, 0, 0, 0, "flaky");
    }
  }
}
