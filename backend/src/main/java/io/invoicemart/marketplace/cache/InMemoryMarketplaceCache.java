package io.invoicemart.marketplace.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Policy.VarExpiration;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Single-process {@link MarketplaceCache} backed by a Caffeine cache with per-entry expiry. Used
 * for local runs without Redis and as the cache fabric in tests. Pub/sub delivers synchronously on
 * the publishing thread.
 */
@Component
@ConditionalOnProperty(name = "marketplace.cache.provider", havingValue = "memory")
public class InMemoryMarketplaceCache implements MarketplaceCache {

  private static final Logger log = LoggerFactory.getLogger(InMemoryMarketplaceCache.class);

  private static final long NO_EXPIRY = Long.MAX_VALUE;
  private static final Duration PERSISTENT_THRESHOLD = Duration.ofDays(36_500);

  private final Cache<String, Entry> store;
  private final VarExpiration<String, Entry> expiration;
  private final Map<String, List<Consumer<String>>> subscribers = new ConcurrentHashMap<>();

  public InMemoryMarketplaceCache() {
    this(Ticker.systemTicker());
  }

  public InMemoryMarketplaceCache(Ticker ticker) {
    this.store =
        Caffeine.newBuilder()
            .maximumSize(100_000)
            .ticker(ticker)
            .executor(Runnable::run)
            .expireAfter(new EntryExpiry())
            .build();
    this.expiration = store.policy().expireVariably().orElseThrow();
  }

  @Override
  public Optional<String> get(String key) {
    Entry entry = store.getIfPresent(key);
    return entry == null ? Optional.empty() : Optional.of(entry.as(String.class));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    store.put(key, new Entry(value, ttl));
  }

  @Override
  public boolean delete(String key) {
    return store.asMap().remove(key) != null;
  }

  @Override
  public long deleteByPattern(String pattern) {
    List<String> keys = matching(pattern);
    keys.forEach(store::invalidate);
    return keys.size();
  }

  @Override
  public boolean expire(String key, Duration ttl) {
    if (store.getIfPresent(key) == null) {
      return false;
    }
    expiration.setExpiresAfter(key, ttl);
    return true;
  }

  @Override
  public long ensureExpiry(String pattern, Duration ttl) {
    long updated = 0;
    for (String key : matching(pattern)) {
      Optional<Duration> remaining = expiration.getExpiresAfter(key);
      if (remaining.isPresent() && remaining.get().compareTo(PERSISTENT_THRESHOLD) > 0) {
        expiration.setExpiresAfter(key, ttl);
        updated++;
      }
    }
    return updated;
  }

  @Override
  public boolean setIfAbsent(String key, String value, Duration ttl) {
    return store.asMap().putIfAbsent(key, new Entry(value, ttl)) == null;
  }

  @Override
  public boolean compareAndDelete(String key, String expectedValue) {
    var removed = new AtomicBoolean(false);
    store
        .asMap()
        .computeIfPresent(
            key,
            (k, entry) -> {
              if (expectedValue.equals(entry.value)) {
                removed.set(true);
                return null;
              }
              return entry;
            });
    return removed.get();
  }

  @Override
  public void zAdd(String key, String member, double score) {
    sortedSet(key).put(member, score);
  }

  @Override
  public double zIncrBy(String key, String member, double delta) {
    return sortedSet(key).merge(member, delta, Double::sum);
  }

  @Override
  public boolean zRemove(String key, String member) {
    Entry entry = store.getIfPresent(key);
    return entry != null && entry.asSortedSet().remove(member) != null;
  }

  @Override
  public long zCount(String key, double min, double max) {
    Entry entry = store.getIfPresent(key);
    if (entry == null) {
      return 0;
    }
    return entry.asSortedSet().values().stream().filter(s -> s >= min && s <= max).count();
  }

  @Override
  public long zCard(String key) {
    Entry entry = store.getIfPresent(key);
    return entry == null ? 0 : entry.asSortedSet().size();
  }

  @Override
  public List<ScoredMember> zTop(String key, int limit) {
    Entry entry = store.getIfPresent(key);
    if (entry == null) {
      return List.of();
    }
    return entry.asSortedSet().entrySet().stream()
        .map(e -> new ScoredMember(e.getKey(), e.getValue()))
        .sorted(
            Comparator.comparingDouble(ScoredMember::score)
                .reversed()
                .thenComparing(ScoredMember::member, Comparator.reverseOrder()))
        .limit(limit)
        .toList();
  }

  @Override
  public void pushCapped(String key, String value, int maxLength, Duration ttl) {
    Deque<String> list = store.get(key, k -> new Entry(new ConcurrentLinkedDeque<String>(), null))
        .asList();
    list.addFirst(value);
    while (list.size() > maxLength) {
      list.pollLast();
    }
    expire(key, ttl);
  }

  @Override
  public List<String> listRange(String key, int limit) {
    Entry entry = store.getIfPresent(key);
    if (entry == null) {
      return List.of();
    }
    return entry.asList().stream().limit(limit).toList();
  }

  @Override
  public void publish(String channel, String message) {
    for (Consumer<String> listener : subscribers.getOrDefault(channel, List.of())) {
      try {
        listener.accept(message);
      } catch (RuntimeException e) {
        log.warn("Subscriber on channel {} failed: {}", channel, e.getMessage());
      }
    }
  }

  @Override
  public CacheSubscription subscribe(String channel, Consumer<String> listener) {
    subscribers.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>()).add(listener);
    return () -> subscribers.getOrDefault(channel, List.of()).remove(listener);
  }

  private Map<String, Double> sortedSet(String key) {
    return store.get(key, k -> new Entry(new ConcurrentHashMap<String, Double>(), null))
        .asSortedSet();
  }

  private List<String> matching(String pattern) {
    var regex = KeyPatterns.compile(pattern);
    var keys = new ArrayList<String>();
    for (String key : store.asMap().keySet()) {
      if (regex.matcher(key).matches()) {
        keys.add(key);
      }
    }
    return keys;
  }

  private static final class Entry {

    private final Object value;
    private final long ttlNanos;

    private Entry(Object value, Duration ttl) {
      this.value = value;
      this.ttlNanos = ttl == null ? NO_EXPIRY : ttl.toNanos();
    }

    <T> T as(Class<T> type) {
      if (!type.isInstance(value)) {
        throw new IllegalStateException("WRONGTYPE: key holds " + value.getClass().getSimpleName());
      }
      return type.cast(value);
    }

    @SuppressWarnings("unchecked")
    Map<String, Double> asSortedSet() {
      return as(Map.class);
    }

    @SuppressWarnings("unchecked")
    Deque<String> asList() {
      return as(Deque.class);
    }
  }

  private static final class EntryExpiry implements Expiry<String, Entry> {

    @Override
    public long expireAfterCreate(String key, Entry entry, long currentTime) {
      return entry.ttlNanos;
    }

    @Override
    public long expireAfterUpdate(
        String key, Entry entry, long currentTime, long currentDuration) {
      return entry.ttlNanos;
    }

    @Override
    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
