package io.invoicemart.marketplace.offer;

import io.invoicemart.marketplace.cache.CacheInvalidator;
import io.invoicemart.marketplace.cache.Channels;
import io.invoicemart.marketplace.notification.RealtimePublisher;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Post-commit side effects of offer changes: read-model invalidation, the competition sorted set
 * and realtime broadcasts. None of these can undo the committed change.
 */
@Component
public class OfferEventHandler {

  private static final Logger log = LoggerFactory.getLogger(OfferEventHandler.class);

  private final CacheInvalidator cacheInvalidator;
  private final OfferCompetitionTracker competitionTracker;
  private final RealtimePublisher realtimePublisher;

  public OfferEventHandler(
      CacheInvalidator cacheInvalidator,
      OfferCompetitionTracker competitionTracker,
      RealtimePublisher realtimePublisher) {
    this.cacheInvalidator = cacheInvalidator;
    this.competitionTracker = competitionTracker;
    this.realtimePublisher = realtimePublisher;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onOfferChanged(OfferChangedEvent event) {
    try {
      cacheInvalidator.offersChanged(
          event.invoiceId(),
          event.offers().stream().map(OfferSnapshot::offerId).toList(),
          event.offers().stream().map(OfferSnapshot::lenderId).distinct().toList());

      updateCompetition(event);

      String type = "offer_" + event.type().name().toLowerCase(Locale.ROOT);
      for (OfferSnapshot offer : event.offers()) {
        realtimePublisher.publish(
            type,
            offer.offerId(),
            payload(offer),
            List.of(
                Channels.offerUpdates(offer.offerId()),
                Channels.invoiceOffers(event.invoiceId()),
                Channels.lenderOffers(offer.lenderId()),
                Channels.MARKETPLACE_OFFERS));
      }
      log.debug(
          "Post-commit actions completed for {} of {} offers on invoice {}",
          event.type(),
          event.offers().size(),
          event.invoiceId());
    } catch (Exception e) {
      log.error(
          "Failed to process post-commit actions for {} on invoice {}",
          event.type(),
          event.invoiceId(),
          e);
    }
  }

  private void updateCompetition(OfferChangedEvent event) {
    switch (event.type()) {
      case CREATED -> event.offers().forEach(competitionTracker::track);
      case ACCEPTED -> competitionTracker.clear(event.invoiceId());
      default ->
          event.offers().forEach(o -> competitionTracker.remove(event.invoiceId(), o.offerId()));
    }
  }

  private static Map<String, Object> payload(OfferSnapshot offer) {
    var data = new LinkedHashMap<String, Object>();
    data.put("invoiceId", offer.invoiceId());
    data.put("lenderId", offer.lenderId());
    data.put("status", offer.status().name());
    data.put("amount", offer.amount());
    data.put("interestRate", offer.interestRate());
    data.put("tenure", offer.tenure());
    return data;
  }
}
