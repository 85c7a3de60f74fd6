package io.invoicemart.marketplace.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Key-value, sorted-set, list and pub/sub primitives backing the read model and realtime fan-out.
 * Holds no business logic. Implementations may throw unchecked exceptions when the backing store is
 * unreachable; callers treat those failures as non-fatal.
 *
 * <p>Key patterns use glob syntax where {@code *} matches any run of characters.
 */
public interface MarketplaceCache {

  Optional<String> get(String key);

  void set(String key, String value, Duration ttl);

  boolean delete(String key);

  /** Deletes every key matching the glob pattern and returns the number removed. */
  long deleteByPattern(String pattern);

  boolean expire(String key, Duration ttl);

  /** Applies {@code ttl} to every key matching the pattern that currently has no expiry. */
  long ensureExpiry(String pattern, Duration ttl);

  /** Set-if-not-exists with expiry; the lock primitive. */
  boolean setIfAbsent(String key, String value, Duration ttl);

  /** Deletes {@code key} only if it still holds {@code expectedValue}. */
  boolean compareAndDelete(String key, String expectedValue);

  void zAdd(String key, String member, double score);

  double zIncrBy(String key, String member, double delta);

  boolean zRemove(String key, String member);

  /** Number of members whose score lies in {@code [min, max]}. */
  long zCount(String key, double min, double max);

  long zCard(String key);

  /** Highest-scored members first. */
  List<ScoredMember> zTop(String key, int limit);

  /** Pushes to the head of a list, trims it to {@code maxLength} and refreshes its expiry. */
  void pushCapped(String key, String value, int maxLength, Duration ttl);

  List<String> listRange(String key, int limit);

  void publish(String channel, String message);

  CacheSubscription subscribe(String channel, Consumer<String> listener);
}
