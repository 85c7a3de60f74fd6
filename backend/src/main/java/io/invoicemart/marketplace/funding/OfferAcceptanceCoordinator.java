package io.invoicemart.marketplace.funding;

import io.invoicemart.marketplace.cache.CacheKeys;
import io.invoicemart.marketplace.cache.DistributedLockService;
import io.invoicemart.marketplace.exception.ForbiddenException;
import io.invoicemart.marketplace.exception.InvalidStateException;
import io.invoicemart.marketplace.exception.OfferNotActionableException;
import io.invoicemart.marketplace.exception.ResourceConflictException;
import io.invoicemart.marketplace.exception.ResourceNotFoundException;
import io.invoicemart.marketplace.invoice.Invoice;
import io.invoicemart.marketplace.invoice.InvoiceRepository;
import io.invoicemart.marketplace.invoice.InvoiceStatusChangedEvent;
import io.invoicemart.marketplace.notification.MarketplaceNotifier;
import io.invoicemart.marketplace.offer.Offer;
import io.invoicemart.marketplace.offer.OfferChangedEvent;
import io.invoicemart.marketplace.offer.OfferEventType;
import io.invoicemart.marketplace.offer.OfferRepository;
import io.invoicemart.marketplace.offer.OfferSnapshot;
import io.invoicemart.marketplace.offer.OfferStatus;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Accepts an offer and funds its invoice as one unit of work.
 *
 * <p>Within a single transaction the coordinator:
 *
 * <ol>
 *   <li>locks the invoice row and re-checks ownership and the offer's guards against the database
 *   <li>moves the offer to ACCEPTED; its version check fails the write if a concurrent withdraw
 *       got there first
 *   <li>funds the invoice from the offer's amount and rate
 *   <li>rejects every other pending offer on the invoice in one statement, then verifies none
 *       remain
 *   <li>enqueues notifications to the outbox
 * </ol>
 *
 * Any failure rolls all of it back, so no sibling is rejected and no notification is queued for an
 * acceptance that did not happen. A named cache lock on {@code {invoiceId, accept-offer}} keeps two
 * acceptances for the same invoice from queueing on the row lock.
 */
@Service
public class OfferAcceptanceCoordinator {

  private static final Logger log = LoggerFactory.getLogger(OfferAcceptanceCoordinator.class);

  static final String OPERATION = "accept-offer";
  public static final String SIBLING_REJECTION_REASON = "Another offer was accepted";

  private final OfferRepository offerRepository;
  private final InvoiceRepository invoiceRepository;
  private final DistributedLockService lockService;
  private final MarketplaceNotifier notifier;
  private final ApplicationEventPublisher eventPublisher;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public OfferAcceptanceCoordinator(
      OfferRepository offerRepository,
      InvoiceRepository invoiceRepository,
      DistributedLockService lockService,
      MarketplaceNotifier notifier,
      ApplicationEventPublisher eventPublisher,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.offerRepository = offerRepository;
    this.invoiceRepository = invoiceRepository;
    this.lockService = lockService;
    this.notifier = notifier;
    this.eventPublisher = eventPublisher;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  public AcceptanceResult acceptOffer(UUID sellerId, UUID offerId, String notes) {
    UUID invoiceId =
        offerRepository
            .findById(offerId)
            .map(Offer::getInvoiceId)
            .orElseThrow(() -> new ResourceNotFoundException("Offer", offerId));

    var lock =
        lockService
            .tryAcquire(CacheKeys.invoiceLock(invoiceId, OPERATION))
            .orElseThrow(() -> ResourceConflictException.operationInProgress("offer acceptance"));
    try {
      var result = transactionTemplate.execute(status -> accept(sellerId, offerId, notes));
      log.info(
          "Seller {} accepted offer {} on invoice {}; {} competing offers rejected",
          sellerId,
          offerId,
          invoiceId,
          result.autoRejectedOffers());
      return result;
    } finally {
      lockService.release(lock);
    }
  }

  private AcceptanceResult accept(UUID sellerId, UUID offerId, String notes) {
    Instant now = clock.instant();

    Offer offer =
        offerRepository
            .findById(offerId)
            .orElseThrow(() -> new ResourceNotFoundException("Offer", offerId));
    Invoice invoice =
        invoiceRepository
            .findByIdForUpdate(offer.getInvoiceId())
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", offer.getInvoiceId()));

    if (!invoice.getSellerId().equals(sellerId)) {
      throw new ForbiddenException(
          "Cannot accept offer", "Only the seller who owns the invoice can accept its offers");
    }
    if (!offer.canBeAccepted(now)) {
      throw new OfferNotActionableException(offerId, "accepted", offer.describeState(now));
    }
    if (!invoice.canBeFunded()) {
      throw new InvalidStateException(
          "Invoice not open for funding",
          "Invoice " + invoice.getId() + " is " + invoice.getStatus() + ", not LISTED");
    }

    var from = invoice.getStatus();
    offer.accept(notes, now);
    invoice.fund(
        offer.getLenderId(), offer.getId(), offer.getAmount(), offer.getInterestRate(), now);
    offerRepository.save(offer);
    invoiceRepository.save(invoice);

    List<OfferSnapshot> siblings =
        offerRepository.findByInvoiceIdAndStatus(invoice.getId(), OfferStatus.PENDING).stream()
            .filter(o -> !o.getId().equals(offerId))
            .map(o -> OfferSnapshot.of(o).withStatus(OfferStatus.REJECTED))
            .toList();
    int rejected =
        offerRepository.rejectPendingSiblings(
            invoice.getId(), offerId, SIBLING_REJECTION_REASON, now);
    long stillPending =
        offerRepository.countByInvoiceIdAndStatus(invoice.getId(), OfferStatus.PENDING);
    if (stillPending > 0) {
      throw new IllegalStateException(
          stillPending
              + " offers on invoice "
              + invoice.getId()
              + " still pending after acceptance");
    }
    if (rejected != siblings.size()) {
      log.warn(
          "Rejected {} sibling offers on invoice {}, expected {}",
          rejected,
          invoice.getId(),
          siblings.size());
    }

    notifier.offerAccepted(invoice, offer);
    siblings.forEach(s -> notifier.offerRejected(invoice, s, SIBLING_REJECTION_REASON));
    notifier.invoiceStatusChanged(
        invoice, "Funded with " + invoice.getCurrency() + " " + offer.getAmount().toPlainString());

    eventPublisher.publishEvent(
        new OfferChangedEvent(
            OfferEventType.ACCEPTED,
            invoice.getId(),
            sellerId,
            List.of(OfferSnapshot.of(offer))));
    if (!siblings.isEmpty()) {
      eventPublisher.publishEvent(
          new OfferChangedEvent(
              OfferEventType.AUTO_REJECTED, invoice.getId(), sellerId, siblings));
    }
    eventPublisher.publishEvent(InvoiceStatusChangedEvent.of(invoice, from, sellerId));

    return new AcceptanceResult(offer, invoice, rejected);
  }
}
