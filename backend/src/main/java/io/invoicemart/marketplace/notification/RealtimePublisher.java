package io.invoicemart.marketplace.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.invoicemart.marketplace.cache.MarketplaceCache;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Best-effort broadcast of entity updates to pub/sub channels. Failures are logged per channel and
 * never propagate.
 */
@Component
public class RealtimePublisher {

  private static final Logger log = LoggerFactory.getLogger(RealtimePublisher.class);

  private final MarketplaceCache cache;
  private final ObjectMapper objectMapper;

  public RealtimePublisher(MarketplaceCache cache, ObjectMapper objectMapper) {
    this.cache = cache;
    this.objectMapper = objectMapper;
  }

  public void publish(
      String type, UUID entityId, Map<String, Object> data, Collection<String> channels) {
    String message;
    try {
      message =
          objectMapper.writeValueAsString(new RealtimeEvent(type, entityId, data, Instant.now()));
    } catch (JsonProcessingException e) {
      log.warn("Cannot serialize realtime event {} for {}: {}", type, entityId, e.getMessage());
      return;
    }
    for (String channel : channels) {
      try {
        cache.publish(channel, message);
      } catch (RuntimeException e) {
        log.warn("Publish of {} to {} failed: {}", type, channel, e.getMessage());
      }
    }
  }
}
