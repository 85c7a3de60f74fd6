package io.invoicemart.marketplace.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.invoicemart.marketplace.config.OutboxProperties;
import io.invoicemart.marketplace.notification.channel.NotificationDispatcher;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Delivers due outbox items. Runs independently of the transactions that wrote them, so delivery
 * failures never affect invoice or offer state.
 */
@Component
public class OutboxDispatcher {

  private static final Logger log = LoggerFactory.getLogger(OutboxDispatcher.class);

  private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

  private final NotificationOutboxRepository repository;
  private final NotificationDispatcher dispatcher;
  private final TransactionTemplate transactionTemplate;
  private final ObjectMapper objectMapper;
  private final OutboxProperties properties;
  private final Clock clock;

  public OutboxDispatcher(
      NotificationOutboxRepository repository,
      NotificationDispatcher dispatcher,
      TransactionTemplate transactionTemplate,
      ObjectMapper objectMapper,
      OutboxProperties properties,
      Clock clock) {
    this.repository = repository;
    this.dispatcher = dispatcher;
    this.transactionTemplate = transactionTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${marketplace.outbox.dispatch-interval:10000}")
  public void dispatchDue() {
    Integer processed =
        transactionTemplate.execute(
            status -> {
              var now = clock.instant();
              var due = repository.claimDue(now, PageRequest.of(0, properties.batchSize()));
              due.forEach(item -> deliver(item, now));
              return due.size();
            });
    if (processed != null && processed > 0) {
      log.info("Outbox dispatch processed {} notifications", processed);
    }
  }

  void deliver(NotificationOutbox item, Instant now) {
    Notification notification;
    try {
      notification = toNotification(item);
    } catch (JsonProcessingException e) {
      log.error("Outbox item {} has an unreadable payload; marking failed", item.getId());
      item.markFailed("Unreadable payload: " + e.getOriginalMessage());
      return;
    }
    var outcome = dispatcher.dispatch(notification, item.deliveredChannelIds());
    outcome.delivered().forEach(item::recordDelivered);
    if (outcome.isComplete()) {
      item.markSent(now);
    } else {
      item.markAttemptFailed(String.valueOf(outcome.failures()), now);
      if (item.getStatus() == OutboxStatus.FAILED) {
        log.error(
            "Outbox item {} ({}) failed permanently after {} attempts: {}",
            item.getId(),
            item.getType(),
            item.getRetryCount(),
            item.getLastError());
      }
    }
  }

  @Scheduled(cron = "${marketplace.outbox.purge-cron:0 30 3 * * *}")
  public void purgeSent() {
    var cutoff = clock.instant().minus(Duration.ofDays(properties.retentionDays()));
    Integer purged =
        transactionTemplate.execute(
            status -> repository.deleteByStatusAndSentAtBefore(OutboxStatus.SENT, cutoff));
    if (purged != null && purged > 0) {
      log.info("Purged {} sent outbox items older than {}", purged, cutoff);
    }
  }

  private Notification toNotification(NotificationOutbox item) throws JsonProcessingException {
    Map<String, Object> data =
        item.getPayload() == null
            ? Map.of()
            : objectMapper.readValue(item.getPayload(), PAYLOAD_TYPE);
    return new Notification(
        item.getId(),
        item.getType(),
        item.getRecipientId(),
        item.getSubject(),
        item.getBody(),
        data,
        item.getCreatedAt());
  }
}
