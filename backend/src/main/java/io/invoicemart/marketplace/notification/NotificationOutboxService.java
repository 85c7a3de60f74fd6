package io.invoicemart.marketplace.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.invoicemart.marketplace.config.OutboxProperties;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes notification work items. Must join the caller's transaction so an item exists if and
 * only if the state change that produced it committed.
 */
@Service
public class NotificationOutboxService {

  private final NotificationOutboxRepository repository;
  private final ObjectMapper objectMapper;
  private final OutboxProperties properties;

  public NotificationOutboxService(
      NotificationOutboxRepository repository,
      ObjectMapper objectMapper,
      OutboxProperties properties) {
    this.repository = repository;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public NotificationOutbox enqueue(
      NotificationType type,
      UUID recipientId,
      String subject,
      String body,
      Map<String, Object> data,
      String referenceType,
      UUID referenceId) {
    return repository.save(
        new NotificationOutbox(
            type,
            recipientId,
            subject,
            body,
            toJson(data),
            referenceType,
            referenceId,
            properties.maxRetries()));
  }

  private String toJson(Map<String, Object> data) {
    if (data == null || data.isEmpty()) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(data);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Notification payload is not serializable", e);
    }
  }
}
