package io.invoicemart.marketplace.cache;

import io.invoicemart.marketplace.config.CacheProperties;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Short-TTL named locks over {@link MarketplaceCache}: acquire with set-if-not-exists, release with
 * compare-and-delete on the holder's token.
 *
 * <p>When the cache store itself is unreachable the lock degrades to "granted" so writes keep
 * flowing; the authoritative store's row locks and version checks still guard correctness.
 */
@Service
public class DistributedLockService {

  private static final Logger log = LoggerFactory.getLogger(DistributedLockService.class);

  private final MarketplaceCache cache;
  private final Duration defaultTtl;

  public DistributedLockService(MarketplaceCache cache, CacheProperties cacheProperties) {
    this.cache = cache;
    this.defaultTtl = cacheProperties.lockTtl();
  }

  public Optional<DistributedLock> tryAcquire(String key) {
    return tryAcquire(key, defaultTtl);
  }

  public Optional<DistributedLock> tryAcquire(String key, Duration ttl) {
    String token = UUID.randomUUID().toString();
    try {
      if (cache.setIfAbsent(key, token, ttl)) {
        log.debug("Lock acquired: {}", key);
        return Optional.of(new DistributedLock(key, token, false));
      }
      log.debug("Lock busy: {}", key);
      return Optional.empty();
    } catch (RuntimeException e) {
      log.warn("Lock store unavailable, proceeding without lock for {}: {}", key, e.getMessage());
      return Optional.of(DistributedLock.degraded(key));
    }
  }

  public boolean release(DistributedLock lock) {
    if (lock == null || lock.degraded()) {
      return false;
    }
    try {
      boolean released = cache.compareAndDelete(lock.key(), lock.token());
      if (!released) {
        log.warn("Lock {} was not held at release (expired or taken over)", lock.key());
      }
      return released;
    } catch (RuntimeException e) {
      log.warn("Failed to release lock {}: {}", lock.key(), e.getMessage());
      return false;
    }
  }
}
