package io.invoicemart.marketplace.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.invoicemart.marketplace.config.CacheProperties;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Read-through access to cached projections with stampede protection.
 *
 * <p>On a miss the first caller takes a short recompute lock for the key, computes from source and
 * populates the cache. Concurrent callers that lose the lock poll the cache for up to the
 * configured wait before computing themselves without populating. Entries are written with the
 * caller's TTL and the store expires them, so nothing is served past its TTL. With caching
 * disabled every call goes straight to the loader.
 */
@Component
public class ReadThroughCache {

  private static final Logger log = LoggerFactory.getLogger(ReadThroughCache.class);

  private static final long POLL_INTERVAL_MILLIS = 25;

  private final MarketplaceCache cache;
  private final DistributedLockService lockService;
  private final ObjectMapper objectMapper;
  private final CacheProperties properties;

  public ReadThroughCache(
      MarketplaceCache cache,
      DistributedLockService lockService,
      ObjectMapper objectMapper,
      CacheProperties properties) {
    this.cache = cache;
    this.lockService = lockService;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  public <T> T get(String key, Duration ttl, Class<T> type, Supplier<T> loader) {
    return get(key, ttl, objectMapper.getTypeFactory().constructType(type), loader);
  }

  public <T> T get(String key, Duration ttl, TypeReference<T> type, Supplier<T> loader) {
    return get(key, ttl, objectMapper.getTypeFactory().constructType(type), loader);
  }

  private <T> T get(String key, Duration ttl, JavaType type, Supplier<T> loader) {
    if (!properties.enabled()) {
      return loader.get();
    }
    Optional<T> cached = read(key, type);
    if (cached.isPresent()) {
      return cached.get();
    }

    Optional<DistributedLock> lock = lockService.tryAcquire(CacheKeys.recomputeLock(key));
    if (lock.isPresent()) {
      try {
        Optional<T> populatedMeanwhile = read(key, type);
        if (populatedMeanwhile.isPresent()) {
          return populatedMeanwhile.get();
        }
        T value = loader.get();
        write(key, value, ttl);
        return value;
      } finally {
        lockService.release(lock.get());
      }
    }

    return this.<T>awaitPopulated(key, type).orElseGet(loader);
  }

  private <T> Optional<T> awaitPopulated(String key, JavaType type) {
    long deadline = System.nanoTime() + properties.lockWait().toNanos();
    while (System.nanoTime() < deadline) {
      try {
        Thread.sleep(POLL_INTERVAL_MILLIS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
      Optional<T> value = read(key, type);
      if (value.isPresent()) {
        return value;
      }
    }
    log.debug("Cache key {} not populated within wait; computing directly", key);
    return Optional.empty();
  }

  private <T> Optional<T> read(String key, JavaType type) {
    Optional<String> json;
    try {
      json = cache.get(key);
    } catch (RuntimeException e) {
      log.warn("Cache read failed for {}: {}", key, e.getMessage());
      return Optional.empty();
    }
    if (json.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(json.get(), type));
    } catch (JsonProcessingException e) {
      log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
      evictQuietly(key);
      return Optional.empty();
    }
  }

  private void write(String key, Object value, Duration ttl) {
    if (value == null) {
      return;
    }
    try {
      cache.set(key, objectMapper.writeValueAsString(value), ttl);
    } catch (JsonProcessingException e) {
      log.warn("Cannot serialize value for cache key {}: {}", key, e.getOriginalMessage());
    } catch (RuntimeException e) {
      log.warn("Cache write failed for {}: {}", key, e.getMessage());
    }
  }

  private void evictQuietly(String key) {
    try {
      cache.delete(key);
    } catch (RuntimeException e) {
      log.warn("Cache delete failed for {}: {}", key, e.getMessage());
    }
  }
}
