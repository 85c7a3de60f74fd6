package io.invoicemart.marketplace.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.invoicemart.marketplace.config.CacheProperties;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

class ReadThroughCacheTest {

  private static final Duration TTL = Duration.ofMinutes(5);

  record Listing(String invoiceNumber, int offerCount) {}

  private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
  private final AtomicInteger loads = new AtomicInteger();

  private InMemoryMarketplaceCache store;
  private ReadThroughCache cache;

  @BeforeEach
  void setUp() {
    store = new InMemoryMarketplaceCache();
    cache = readThrough(store, CacheProperties.defaults());
  }

  @Test
  void get_missThenHit_loadsOnce() {
    var first = cache.get("marketplace:listings:a", TTL, Listing.class, this::load);
    var second = cache.get("marketplace:listings:a", TTL, Listing.class, this::load);

    assertThat(first).isEqualTo(new Listing("INV-1", 1));
    assertThat(second).isEqualTo(first);
    assertThat(loads).hasValue(1);
    assertThat(store.get("marketplace:listings:a")).isPresent();
  }

  @Test
  void get_genericType_roundTripsThroughCache() {
    var type = new TypeReference<List<Listing>>() {};
    cache.get("k", TTL, type, () -> List.of(load(), load()));

    var cached = cache.get("k", TTL, type, List::of);

    assertThat(cached).containsExactly(new Listing("INV-1", 1), new Listing("INV-1", 2));
  }

  @Test
  void get_disabled_alwaysLoads() {
    var disabled =
        readThrough(
            store, new CacheProperties(false, "memory", null, null, null, null, null, null));

    disabled.get("k", TTL, Listing.class, this::load);
    disabled.get("k", TTL, Listing.class, this::load);

    assertThat(loads).hasValue(2);
    assertThat(store.get("k")).isEmpty();
  }

  @Test
  void get_unreadableEntry_isEvictedAndRecomputed() {
    store.set("k", "{not json", TTL);

    var value = cache.get("k", TTL, Listing.class, this::load);

    assertThat(value).isEqualTo(new Listing("INV-1", 1));
    assertThat(store.get("k")).hasValueSatisfying(json -> assertThat(json).contains("INV-1"));
  }

  @Test
  void get_storeUnavailable_fallsThroughToLoader() {
    var broken = mock(MarketplaceCache.class);
    when(broken.get(any())).thenThrow(new RedisConnectionFailureException("down"));
    when(broken.setIfAbsent(any(), any(), any()))
        .thenThrow(new RedisConnectionFailureException("down"));
    var degraded = readThrough(broken, CacheProperties.defaults());

    var value = degraded.get("k", TTL, Listing.class, this::load);

    assertThat(value).isEqualTo(new Listing("INV-1", 1));
  }

  @Test
  void get_recomputeLockHeld_computesAfterWaitWithoutPopulating() {
    new DistributedLockService(store, CacheProperties.defaults())
        .tryAcquire(CacheKeys.recomputeLock("k"));

    var value = cache.get("k", TTL, Listing.class, this::load);

    assertThat(value).isEqualTo(new Listing("INV-1", 1));
    assertThat(store.get("k")).isEmpty();
  }

  @Test
  void get_nullResult_isNotCached() {
    cache.get("k", TTL, Listing.class, () -> null);

    assertThat(store.get("k")).isEmpty();
  }

  private Listing load() {
    return new Listing("INV-1", loads.incrementAndGet());
  }

  private ReadThroughCache readThrough(MarketplaceCache backing, CacheProperties properties) {
    return new ReadThroughCache(
        backing, new DistributedLockService(backing, properties), objectMapper, properties);
  }
}
