package io.invoicemart.marketplace.cache;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations.TypedTuple;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

/** Redis implementation of {@link MarketplaceCache}. All Redis types are confined to this class. */
@Component
@ConditionalOnProperty(
    name = "marketplace.cache.provider",
    havingValue = "redis",
    matchIfMissing = true)
public class RedisMarketplaceCache implements MarketplaceCache {

  private static final Logger log = LoggerFactory.getLogger(RedisMarketplaceCache.class);

  private static final int SCAN_BATCH = 500;

  private static final RedisScript<Long> COMPARE_AND_DELETE =
      new DefaultRedisScript<>(
          """
          if redis.call('GET', KEYS[1]) == ARGV[1] then
            return redis.call('DEL', KEYS[1])
          else
            return 0
          end
          """,
          Long.class);

  private final StringRedisTemplate redis;
  private final RedisMessageListenerContainer listenerContainer;

  public RedisMarketplaceCache(
      StringRedisTemplate redis, RedisMessageListenerContainer listenerContainer) {
    this.redis = redis;
    this.listenerContainer = listenerContainer;
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(redis.opsForValue().get(key));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    redis.opsForValue().set(key, value, ttl);
  }

  @Override
  public boolean delete(String key) {
    return Boolean.TRUE.equals(redis.delete(key));
  }

  @Override
  public long deleteByPattern(String pattern) {
    List<String> keys = scan(pattern);
    long deleted = 0;
    for (int i = 0; i < keys.size(); i += SCAN_BATCH) {
      Long count = redis.delete(keys.subList(i, Math.min(i + SCAN_BATCH, keys.size())));
      deleted += count != null ? count : 0;
    }
    if (deleted > 0) {
      log.debug("Deleted {} keys matching {}", deleted, pattern);
    }
    return deleted;
  }

  @Override
  public boolean expire(String key, Duration ttl) {
    return Boolean.TRUE.equals(redis.expire(key, ttl));
  }

  @Override
  public long ensureExpiry(String pattern, Duration ttl) {
    long updated = 0;
    for (String key : scan(pattern)) {
      Long current = redis.getExpire(key);
      // -1: key exists without expiry
      if (current != null && current == -1 && expire(key, ttl)) {
        updated++;
      }
    }
    return updated;
  }

  @Override
  public boolean setIfAbsent(String key, String value, Duration ttl) {
    return Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(key, value, ttl));
  }

  @Override
  public boolean compareAndDelete(String key, String expectedValue) {
    Long result = redis.execute(COMPARE_AND_DELETE, Collections.singletonList(key), expectedValue);
    return result != null && result > 0;
  }

  @Override
  public void zAdd(String key, String member, double score) {
    redis.opsForZSet().add(key, member, score);
  }

  @Override
  public double zIncrBy(String key, String member, double delta) {
    Double score = redis.opsForZSet().incrementScore(key, member, delta);
    return score != null ? score : 0;
  }

  @Override
  public boolean zRemove(String key, String member) {
    Long removed = redis.opsForZSet().remove(key, member);
    return removed != null && removed > 0;
  }

  @Override
  public long zCount(String key, double min, double max) {
    Long count = redis.opsForZSet().count(key, min, max);
    return count != null ? count : 0;
  }

  @Override
  public long zCard(String key) {
    Long size = redis.opsForZSet().zCard(key);
    return size != null ? size : 0;
  }

  @Override
  public List<ScoredMember> zTop(String key, int limit) {
    Set<TypedTuple<String>> tuples = redis.opsForZSet().reverseRangeWithScores(key, 0, limit - 1);
    if (tuples == null) {
      return List.of();
    }
    return tuples.stream()
        .map(t -> new ScoredMember(t.getValue(), t.getScore() != null ? t.getScore() : 0))
        .toList();
  }

  @Override
  public void pushCapped(String key, String value, int maxLength, Duration ttl) {
    redis.opsForList().leftPush(key, value);
    redis.opsForList().trim(key, 0, maxLength - 1);
    redis.expire(key, ttl);
  }

  @Override
  public List<String> listRange(String key, int limit) {
    List<String> values = redis.opsForList().range(key, 0, limit - 1);
    return values != null ? values : List.of();
  }

  @Override
  public void publish(String channel, String message) {
    redis.convertAndSend(channel, message);
  }

  @Override
  public CacheSubscription subscribe(String channel, Consumer<String> listener) {
    var topic = new ChannelTopic(channel);
    MessageListener messageListener =
        (message, pattern) ->
            listener.accept(new String(message.getBody(), StandardCharsets.UTF_8));
    listenerContainer.addMessageListener(messageListener, topic);
    return () -> listenerContainer.removeMessageListener(messageListener, topic);
  }

  private List<String> scan(String pattern) {
    var options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
    var keys = new ArrayList<String>();
    try (Cursor<String> cursor = redis.scan(options)) {
      cursor.forEachRemaining(keys::add);
    }
    return keys;
  }
}
