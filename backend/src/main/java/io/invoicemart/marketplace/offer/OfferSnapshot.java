package io.invoicemart.marketplace.offer;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** Immutable copy of an offer's state carried by events past the end of its transaction. */
public record OfferSnapshot(
    UUID offerId,
    UUID invoiceId,
    UUID lenderId,
    OfferStatus status,
    BigDecimal amount,
    BigDecimal interestRate,
    BigDecimal fundingPercentage,
    int tenure,
    Instant expiresAt,
    Instant createdAt)
    implements OfferRanking.RankedBid {

  public static OfferSnapshot of(Offer offer) {
    return new OfferSnapshot(
        offer.getId(),
        offer.getInvoiceId(),
        offer.getLenderId(),
        offer.getStatus(),
        offer.getAmount(),
        offer.getInterestRate(),
        offer.getFundingPercentage(),
        offer.getTenure(),
        offer.getExpiresAt(),
        offer.getCreatedAt());
  }

  /** The same offer after a bulk transition applied outside the persistence context. */
  public OfferSnapshot withStatus(OfferStatus newStatus) {
    return new OfferSnapshot(
        offerId,
        invoiceId,
        lenderId,
        newStatus,
        amount,
        interestRate,
        fundingPercentage,
        tenure,
        expiresAt,
        createdAt);
  }
}
