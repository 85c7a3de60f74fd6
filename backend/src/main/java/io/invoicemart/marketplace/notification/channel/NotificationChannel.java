package io.invoicemart.marketplace.notification.channel;

import io.invoicemart.marketplace.notification.Notification;

/**
 * Abstraction for notification delivery channels. Each channel handles one delivery mechanism
 * (realtime pub/sub, email).
 */
public interface NotificationChannel {

  /** Unique identifier for this channel (e.g., "realtime", "email"). */
  String channelId();

  /**
   * Delivers a notification via this channel.
   *
   * @throws NotificationDeliveryException if delivery failed and should be retried
   */
  void deliver(Notification notification);

  /** Whether this channel is currently enabled/available. */
  boolean isEnabled();
}
