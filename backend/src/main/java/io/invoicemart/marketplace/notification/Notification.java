package io.invoicemart.marketplace.notification;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** A notification as handed to delivery channels. */
public record Notification(
    UUID id,
    NotificationType type,
    UUID recipientId,
    String subject,
    String body,
    Map<String, Object> data,
    Instant createdAt) {}
