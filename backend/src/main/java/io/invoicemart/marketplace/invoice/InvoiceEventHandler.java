package io.invoicemart.marketplace.invoice;

import io.invoicemart.marketplace.cache.CacheInvalidator;
import io.invoicemart.marketplace.cache.Channels;
import io.invoicemart.marketplace.document.DocumentStage;
import io.invoicemart.marketplace.document.DocumentStorage;
import io.invoicemart.marketplace.notification.RealtimePublisher;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Post-commit side effects of invoice changes: cache invalidation, document visibility and
 * realtime broadcasts. Failures are logged; the committed lifecycle state stands.
 */
@Component
public class InvoiceEventHandler {

  private static final Logger log = LoggerFactory.getLogger(InvoiceEventHandler.class);

  private final CacheInvalidator cacheInvalidator;
  private final DocumentStorage documentStorage;
  private final RealtimePublisher realtimePublisher;

  public InvoiceEventHandler(
      CacheInvalidator cacheInvalidator,
      DocumentStorage documentStorage,
      RealtimePublisher realtimePublisher) {
    this.cacheInvalidator = cacheInvalidator;
    this.documentStorage = documentStorage;
    this.realtimePublisher = realtimePublisher;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onInvoiceChanged(InvoiceStatusChangedEvent event) {
    try {
      cacheInvalidator.invoiceChanged(
          event.invoiceId(), event.sellerId(), event.anchorId(), event.listingsAffected());

      if (event.from() == event.to()) {
        return;
      }

      stageFor(event.to())
          .ifPresent(stage -> event.documentKeys().forEach(k -> updateVisibility(k, stage)));

      var data = new LinkedHashMap<String, Object>();
      data.put("invoiceNumber", event.invoiceNumber());
      data.put("from", event.from().name());
      data.put("status", event.to().name());
      data.put("changedBy", event.actorId());
      realtimePublisher.publish(
          "invoice_status_changed",
          event.invoiceId(),
          data,
          List.of(Channels.invoiceUpdates(event.invoiceId())));

      if (event.to() == InvoiceStatus.LISTED) {
        realtimePublisher.publish(
            "new_listing", event.invoiceId(), data, List.of(Channels.MARKETPLACE_UPDATES));
      }
    } catch (Exception e) {
      log.error(
          "Failed to process post-commit actions for invoice {} ({} -> {})",
          event.invoiceId(),
          event.from(),
          event.to(),
          e);
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onDocumentsDiscarded(DocumentsDiscardedEvent event) {
    for (String key : event.storageKeys()) {
      try {
        documentStorage.delete(key);
      } catch (Exception e) {
        log.error("Failed to delete document {} of invoice {}", key, event.invoiceId(), e);
      }
    }
  }

  static Optional<DocumentStage> stageFor(InvoiceStatus status) {
    return switch (status) {
      case SUBMITTED -> Optional.of(DocumentStage.SUBMITTED);
      case ANCHOR_APPROVED -> Optional.of(DocumentStage.APPROVED);
      case ADMIN_VERIFIED -> Optional.of(DocumentStage.VERIFIED);
      case LISTED -> Optional.of(DocumentStage.LISTED);
      case FUNDED -> Optional.of(DocumentStage.FUNDED);
      default -> Optional.empty();
    };
  }

  private void updateVisibility(String key, DocumentStage stage) {
    try {
      documentStorage.updateVisibility(key, stage);
    } catch (Exception e) {
      log.warn("Visibility update to {} failed for {}: {}", stage, key, e.getMessage());
    }
  }
}
