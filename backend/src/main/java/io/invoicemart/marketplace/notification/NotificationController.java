package io.invoicemart.marketplace.notification;

import io.invoicemart.marketplace.web.Actor;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** The caller's own notifications, newest first, with their delivery state. */
@RestController
public class NotificationController {

  private static final int MAX_LIMIT = 100;

  private final NotificationOutboxRepository outboxRepository;

  public NotificationController(NotificationOutboxRepository outboxRepository) {
    this.outboxRepository = outboxRepository;
  }

  @GetMapping("/api/notifications")
  @Transactional(readOnly = true)
  public ResponseEntity<List<NotificationResponse>> myNotifications(
      Actor actor, @RequestParam(defaultValue = "20") int limit) {
    int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
    var items =
        outboxRepository.findByRecipientIdOrderByCreatedAtDesc(
            actor.id(), PageRequest.of(0, bounded));
    return ResponseEntity.ok(items.stream().map(NotificationResponse::from).toList());
  }

  public record NotificationResponse(
      UUID id,
      NotificationType type,
      String subject,
      String body,
      String referenceType,
      UUID referenceId,
      OutboxStatus status,
      Instant createdAt,
      Instant sentAt) {

    static NotificationResponse from(NotificationOutbox item) {
      return new NotificationResponse(
          item.getId(),
          item.getType(),
          item.getSubject(),
          item.getBody(),
          item.getReferenceType(),
          item.getReferenceId(),
          item.getStatus(),
          item.getCreatedAt(),
          item.getSentAt());
    }
  }
}
