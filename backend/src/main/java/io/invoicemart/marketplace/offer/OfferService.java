package io.invoicemart.marketplace.offer;

import io.invoicemart.marketplace.exception.ForbiddenException;
import io.invoicemart.marketplace.exception.InvalidRequestException;
import io.invoicemart.marketplace.exception.ResourceConflictException;
import io.invoicemart.marketplace.exception.ResourceNotFoundException;
import io.invoicemart.marketplace.invoice.Invoice;
import io.invoicemart.marketplace.invoice.InvoiceRepository;
import io.invoicemart.marketplace.notification.MarketplaceNotifier;
import io.invoicemart.marketplace.party.PartyRole;
import io.invoicemart.marketplace.web.Actor;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class OfferService {

  private static final Logger log = LoggerFactory.getLogger(OfferService.class);

  private final OfferRepository offerRepository;
  private final InvoiceRepository invoiceRepository;
  private final OfferCompetitionTracker competitionTracker;
  private final MarketplaceNotifier notifier;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public OfferService(
      OfferRepository offerRepository,
      InvoiceRepository invoiceRepository,
      OfferCompetitionTracker competitionTracker,
      MarketplaceNotifier notifier,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.offerRepository = offerRepository;
    this.invoiceRepository = invoiceRepository;
    this.competitionTracker = competitionTracker;
    this.notifier = notifier;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /**
   * Places a lender's bid on a listed invoice. The invoice row is share-locked so that an
   * acceptance committing concurrently either completes first (and this call sees FUNDED) or waits
   * for this offer to commit (and rejects it as a sibling).
   */
  @Transactional
  public Offer createOffer(
      UUID lenderId,
      UUID invoiceId,
      BigDecimal interestRate,
      BigDecimal fundingPercentage,
      int tenure,
      String terms,
      String lenderNotes,
      Instant requestedExpiry) {
    Instant now = clock.instant();
    LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);

    Invoice invoice =
        invoiceRepository
            .findByIdForShare(invoiceId)
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));

    BidQuote quote =
        BiddingRules.evaluate(invoice, interestRate, fundingPercentage, tenure, today);

    Instant expiresAt =
        requestedExpiry != null ? requestedExpiry : now.plus(BiddingRules.DEFAULT_OFFER_EXPIRY);
    if (!expiresAt.isAfter(now)) {
      throw new InvalidRequestException(
          "Invalid offer expiry", "Offer expiry " + expiresAt + " must be in the future");
    }

    var ownPending =
        offerRepository.findByInvoiceIdAndLenderIdAndStatus(
            invoiceId, lenderId, OfferStatus.PENDING);
    if (ownPending.stream().anyMatch(o -> o.isActive(now))) {
      throw ResourceConflictException.duplicateActiveOffer();
    }
    var lazilyExpired = new ArrayList<OfferSnapshot>();
    for (Offer stale : ownPending) {
      stale.markExpired(now);
      lazilyExpired.add(OfferSnapshot.of(stale));
    }
    if (!lazilyExpired.isEmpty()) {
      offerRepository.saveAll(ownPending);
      eventPublisher.publishEvent(
          new OfferChangedEvent(
              OfferEventType.EXPIRED, invoiceId, invoice.getSellerId(), lazilyExpired));
    }

    var competitors =
        offerRepository.findByInvoiceIdAndStatus(invoiceId, OfferStatus.PENDING).stream()
            .filter(o -> o.isActive(now))
            .toList();

    Offer offer =
        offerRepository.saveAndFlush(
            new Offer(
                invoiceId,
                invoice.getSellerId(),
                lenderId,
                quote,
                terms,
                lenderNotes,
                expiresAt,
                now));

    notifier.newOffer(invoice, offer);
    long pendingCount = competitors.size() + 1L;
    if (pendingCount > 1) {
      notifier.multipleOffers(invoice, pendingCount);
    }
    for (Offer competitor : competitors) {
      if (OfferRanking.isBetter(
          offer.getInterestRate(),
          offer.getAmount(),
          competitor.getInterestRate(),
          competitor.getAmount())) {
        notifier.competitiveAlert(invoice, OfferSnapshot.of(competitor), offer);
      }
    }

    eventPublisher.publishEvent(
        new OfferChangedEvent(
            OfferEventType.CREATED,
            invoiceId,
            invoice.getSellerId(),
            List.of(OfferSnapshot.of(offer))));

    log.info(
        "Lender {} offered {} at {}% for {} days on invoice {} (offer {})",
        lenderId,
        offer.getAmount(),
        offer.getInterestRate(),
        tenure,
        invoiceId,
        offer.getId());
    return offer;
  }

  @Transactional
  public Offer withdrawOffer(UUID lenderId, UUID offerId, String reason) {
    Offer offer = requireOffer(offerId);
    if (!offer.getLenderId().equals(lenderId)) {
      throw new ForbiddenException(
          "Cannot withdraw offer", "Only the lender who placed the offer can withdraw it");
    }
    offer.withdraw(reason, clock.instant());
    offer = offerRepository.save(offer);

    Invoice invoice = requireInvoice(offer.getInvoiceId());
    notifier.offerWithdrawn(invoice, offer);
    eventPublisher.publishEvent(
        new OfferChangedEvent(
            OfferEventType.WITHDRAWN,
            offer.getInvoiceId(),
            offer.getSellerId(),
            List.of(OfferSnapshot.of(offer))));

    log.info("Lender {} withdrew offer {}", lenderId, offerId);
    return offer;
  }

  /** Seller declines a single offer; the other offers on the invoice are untouched. */
  @Transactional
  public Offer rejectOffer(UUID sellerId, UUID offerId, String reason) {
    Offer offer = requireOffer(offerId);
    Invoice invoice = requireInvoice(offer.getInvoiceId());
    if (!invoice.getSellerId().equals(sellerId)) {
      throw new ForbiddenException(
          "Cannot reject offer", "Only the seller who owns the invoice can reject its offers");
    }
    offer.reject(reason, clock.instant());
    offer = offerRepository.save(offer);

    var snapshot = OfferSnapshot.of(offer);
    notifier.offerRejected(invoice, snapshot, reason);
    eventPublisher.publishEvent(
        new OfferChangedEvent(
            OfferEventType.REJECTED, offer.getInvoiceId(), sellerId, List.of(snapshot)));

    log.info("Seller {} rejected offer {}", sellerId, offerId);
    return offer;
  }

  /** Visible to the lender who placed it, the seller it was made to, and admins. */
  @Transactional(readOnly = true)
  public Offer getOffer(Actor actor, UUID offerId) {
    Offer offer = requireOffer(offerId);
    boolean visible =
        actor.is(PartyRole.ADMIN)
            || offer.getLenderId().equals(actor.id())
            || offer.getSellerId().equals(actor.id());
    if (!visible) {
      throw new ForbiddenException("Cannot view offer", "Offer " + offerId + " is not yours");
    }
    return offer;
  }

  /**
   * Where an offer stands among the active offers on its invoice. The sorted set answers the
   * "outbid by" count when it is populated; the total always comes from the database.
   */
  @Transactional(readOnly = true)
  public OfferRanking.MarketPosition position(Offer offer) {
    Instant now = clock.instant();
    var active =
        offerRepository.findByInvoiceIdAndStatus(offer.getInvoiceId(), OfferStatus.PENDING).stream()
            .filter(o -> o.isActive(now))
            .map(OfferSnapshot::of)
            .toList();
    var tracked =
        competitionTracker.outbidBy(
            offer.getInvoiceId(), offer.getInterestRate(), offer.getAmount());
    if (tracked.isPresent() && offer.isActive(now)) {
      long better = Math.min(tracked.getAsLong(), Math.max(0, active.size() - 1));
      return OfferRanking.MarketPosition.of(better, active.size());
    }
    var competitors = new ArrayList<OfferSnapshot>(active);
    if (!offer.isActive(now)) {
      competitors.add(OfferSnapshot.of(offer));
    }
    return OfferRanking.position(offer.getInterestRate(), offer.getAmount(), competitors);
  }

  private Offer requireOffer(UUID offerId) {
    return offerRepository
        .findById(offerId)
        .orElseThrow(() -> new ResourceNotFoundException("Offer", offerId));
  }

  private Invoice requireInvoice(UUID invoiceId) {
    return invoiceRepository
        .findById(invoiceId)
        .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
  }
}
