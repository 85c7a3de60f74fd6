package io.invoicemart.marketplace.offer;

import io.invoicemart.marketplace.notification.MarketplaceNotifier;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Scheduled sweep that physically marks pending offers past their expiry as EXPIRED. Guards already
 * treat such offers as inert, so the sweep only makes the state visible to queries and notifies the
 * lenders. Each batch commits on its own; a batch that loses a race with a concurrent accept or
 * withdraw is retried on the next run.
 */
@Component
public class OfferExpiryProcessor {

  private static final Logger log = LoggerFactory.getLogger(OfferExpiryProcessor.class);

  private final OfferRepository offerRepository;
  private final MarketplaceNotifier notifier;
  private final ApplicationEventPublisher eventPublisher;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;
  private final int batchSize;

  public OfferExpiryProcessor(
      OfferRepository offerRepository,
      MarketplaceNotifier notifier,
      ApplicationEventPublisher eventPublisher,
      TransactionTemplate transactionTemplate,
      Clock clock,
      @Value("${marketplace.offer.expiry-batch-size:200}") int batchSize) {
    this.offerRepository = offerRepository;
    this.notifier = notifier;
    this.eventPublisher = eventPublisher;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
    this.batchSize = batchSize;
  }

  @Scheduled(fixedRateString = "${marketplace.offer.expiry-interval:300000}")
  public void expireOverdueOffers() {
    Instant now = clock.instant();
    int total = 0;
    while (true) {
      Integer expired;
      try {
        expired = transactionTemplate.execute(status -> expireBatch(now));
      } catch (RuntimeException e) {
        log.error("Offer expiry batch failed after {} offers expired", total, e);
        break;
      }
      if (expired == null || expired == 0) {
        break;
      }
      total += expired;
      if (expired < batchSize) {
        break;
      }
    }
    if (total > 0) {
      log.info("Offer expiry sweep completed: {} offers expired", total);
    } else {
      log.debug("Offer expiry sweep completed: no offers expired");
    }
  }

  int expireBatch(Instant now) {
    var overdue =
        offerRepository.findByStatusAndExpiresAtBefore(
            OfferStatus.PENDING, now, PageRequest.of(0, batchSize));
    if (overdue.isEmpty()) {
      return 0;
    }

    var byInvoice = new LinkedHashMap<UUID, List<OfferSnapshot>>();
    var sellers = new LinkedHashMap<UUID, UUID>();
    for (Offer offer : overdue) {
      offer.markExpired(now);
      notifier.offerExpired(offer);
      byInvoice
          .computeIfAbsent(offer.getInvoiceId(), id -> new ArrayList<>())
          .add(OfferSnapshot.of(offer));
      sellers.putIfAbsent(offer.getInvoiceId(), offer.getSellerId());
    }
    offerRepository.saveAll(overdue);

    byInvoice.forEach(
        (invoiceId, offers) ->
            eventPublisher.publishEvent(
                new OfferChangedEvent(
                    OfferEventType.EXPIRED, invoiceId, sellers.get(invoiceId), offers)));
    return overdue.size();
  }
}
