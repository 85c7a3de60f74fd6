package io.invoicemart.marketplace.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.invoicemart.marketplace.config.CacheProperties;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

class DistributedLockServiceTest {

  private final AtomicLong nanos = new AtomicLong();
  private DistributedLockService lockService;

  @BeforeEach
  void setUp() {
    lockService =
        new DistributedLockService(
            new InMemoryMarketplaceCache(nanos::get), CacheProperties.defaults());
  }

  @Test
  void tryAcquire_heldLock_isRefused() {
    var first = lockService.tryAcquire("invoice:lock:1:accept-offer");
    var second = lockService.tryAcquire("invoice:lock:1:accept-offer");

    assertThat(first).isPresent();
    assertThat(first.get().degraded()).isFalse();
    assertThat(second).isEmpty();
  }

  @Test
  void release_makesLockAvailableAgain() {
    var lock = lockService.tryAcquire("invoice:lock:1:accept-offer").orElseThrow();

    assertThat(lockService.release(lock)).isTrue();
    assertThat(lockService.tryAcquire("invoice:lock:1:accept-offer")).isPresent();
  }

  @Test
  void release_afterExpiryAndTakeover_leavesNewHolderAlone() {
    var stale = lockService.tryAcquire("k", Duration.ofSeconds(1)).orElseThrow();
    nanos.addAndGet(Duration.ofSeconds(2).toNanos());
    var current = lockService.tryAcquire("k", Duration.ofSeconds(10)).orElseThrow();

    assertThat(lockService.release(stale)).isFalse();
    assertThat(lockService.tryAcquire("k")).isEmpty();
    assertThat(lockService.release(current)).isTrue();
  }

  @Test
  void tryAcquire_storeUnavailable_grantsDegradedLock() {
    var cache = mock(MarketplaceCache.class);
    when(cache.setIfAbsent(any(), any(), any()))
        .thenThrow(new RedisConnectionFailureException("down"));
    var degradedService = new DistributedLockService(cache, CacheProperties.defaults());

    var lock = degradedService.tryAcquire("k");

    assertThat(lock).isPresent();
    assertThat(lock.get().degraded()).isTrue();
    assertThat(degradedService.release(lock.get())).isFalse();
    verify(cache, never()).compareAndDelete(any(), any());
  }
}
