package io.invoicemart.marketplace.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A notification work item written in the same transaction as the state change that caused it,
 * then delivered asynchronously. Failed attempts back off exponentially (2^attempt minutes) until
 * {@code maxRetries} is reached. Channels that already succeeded are not repeated on retry.
 */
@Entity
@Table(name = "notification_outbox")
public class NotificationOutbox {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 40)
  private NotificationType type;

  @Column(name = "recipient_id", nullable = false)
  private UUID recipientId;

  @Column(name = "subject", nullable = false, length = 255)
  private String subject;

  @Column(name = "body", nullable = false, columnDefinition = "TEXT")
  private String body;

  @Column(name = "payload", columnDefinition = "TEXT")
  private String payload;

  @Column(name = "reference_type", length = 30)
  private String referenceType;

  @Column(name = "reference_id")
  private UUID referenceId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private OutboxStatus status = OutboxStatus.PENDING;

  @Column(name = "retry_count", nullable = false)
  private int retryCount;

  @Column(name = "max_retries", nullable = false)
  private int maxRetries;

  @Column(name = "next_retry_at")
  private Instant nextRetryAt;

  @Column(name = "delivered_channels", length = 100)
  private String deliveredChannels;

  @Column(name = "last_error", length = 1000)
  private String lastError;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "sent_at")
  private Instant sentAt;

  protected NotificationOutbox() {}

  public NotificationOutbox(
      NotificationType type,
      UUID recipientId,
      String subject,
      String body,
      String payload,
      String referenceType,
      UUID referenceId,
      int maxRetries) {
    this.type = type;
    this.recipientId = recipientId;
    this.subject = subject;
    this.body = body;
    this.payload = payload;
    this.referenceType = referenceType;
    this.referenceId = referenceId;
    this.maxRetries = maxRetries;
    this.createdAt = Instant.now();
  }

  public void markSent(Instant now) {
    this.status = OutboxStatus.SENT;
    this.sentAt = now;
    this.nextRetryAt = null;
    this.lastError = null;
  }

  public void markAttemptFailed(String error, Instant now) {
    this.retryCount++;
    this.lastError = error != null && error.length() > 1000 ? error.substring(0, 1000) : error;
    if (retryCount >= maxRetries) {
      this.status = OutboxStatus.FAILED;
      this.nextRetryAt = null;
    } else {
      this.status = OutboxStatus.RETRY_SCHEDULED;
      this.nextRetryAt = now.plus(backoff(retryCount));
    }
  }

  /** Permanent failure; the item is not retried. */
  public void markFailed(String error) {
    this.status = OutboxStatus.FAILED;
    this.lastError = error;
    this.nextRetryAt = null;
  }

  public void recordDelivered(String channelId) {
    var channels = deliveredChannelIds();
    channels.add(channelId);
    this.deliveredChannels = String.join(",", channels);
  }

  public Set<String> deliveredChannelIds() {
    var channels = new LinkedHashSet<String>();
    if (deliveredChannels != null && !deliveredChannels.isBlank()) {
      channels.addAll(Arrays.asList(deliveredChannels.split(",")));
    }
    return channels;
  }

  static Duration backoff(int attempt) {
    return Duration.ofMinutes(1L << Math.min(attempt, 10));
  }

  public UUID getId() {
    return id;
  }

  public NotificationType getType() {
    return type;
  }

  public UUID getRecipientId() {
    return recipientId;
  }

  public String getSubject() {
    return subject;
  }

  public String getBody() {
    return body;
  }

  public String getPayload() {
    return payload;
  }

  public String getReferenceType() {
    return referenceType;
  }

  public UUID getReferenceId() {
    return referenceId;
  }

  public OutboxStatus getStatus() {
    return status;
  }

  public int getRetryCount() {
    return retryCount;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public Instant getNextRetryAt() {
    return nextRetryAt;
  }

  public String getLastError() {
    return lastError;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getSentAt() {
    return sentAt;
  }
}
