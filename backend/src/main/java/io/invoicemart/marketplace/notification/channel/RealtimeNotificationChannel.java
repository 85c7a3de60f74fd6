package io.invoicemart.marketplace.notification.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.invoicemart.marketplace.cache.CacheKeys;
import io.invoicemart.marketplace.cache.Channels;
import io.invoicemart.marketplace.cache.MarketplaceCache;
import io.invoicemart.marketplace.notification.Notification;
import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Publishes the notification on the recipient's pub/sub channel and keeps it in their recent
 * notifications list (last 100, kept 7 days).
 */
@Component
public class RealtimeNotificationChannel implements NotificationChannel {

  static final int RECENT_LIMIT = 100;
  static final Duration RECENT_TTL = Duration.ofDays(7);

  private final MarketplaceCache cache;
  private final ObjectMapper objectMapper;

  public RealtimeNotificationChannel(MarketplaceCache cache, ObjectMapper objectMapper) {
    this.cache = cache;
    this.objectMapper = objectMapper;
  }

  @Override
  public String channelId() {
    return "realtime";
  }

  @Override
  public void deliver(Notification notification) {
    String json;
    try {
      json = objectMapper.writeValueAsString(notification);
    } catch (JsonProcessingException e) {
      throw new NotificationDeliveryException("Cannot serialize notification", e);
    }
    cache.pushCapped(
        CacheKeys.userNotifications(notification.recipientId()), json, RECENT_LIMIT, RECENT_TTL);
    cache.publish(Channels.userNotifications(notification.recipientId()), json);
  }

  @Override
  public boolean isEnabled() {
    return true;
  }
}
