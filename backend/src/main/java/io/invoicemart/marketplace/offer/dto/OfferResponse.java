package io.invoicemart.marketplace.offer.dto;

import io.invoicemart.marketplace.offer.Offer;
import io.invoicemart.marketplace.offer.OfferStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record OfferResponse(
    UUID id,
    UUID invoiceId,
    UUID sellerId,
    UUID lenderId,
    BigDecimal amount,
    BigDecimal interestRate,
    BigDecimal fundingPercentage,
    int tenure,
    BigDecimal dailyInterestRate,
    BigDecimal totalInterestAmount,
    BigDecimal totalRepaymentAmount,
    BigDecimal effectiveAnnualRate,
    String terms,
    String lenderNotes,
    OfferStatus status,
    boolean active,
    Instant expiresAt,
    long timeUntilExpiryMinutes,
    Instant acceptedAt,
    String acceptanceNotes,
    Instant rejectedAt,
    String rejectionReason,
    Instant withdrawnAt,
    String withdrawalReason,
    Instant expiredAt,
    Instant createdAt,
    Instant updatedAt) {

  public static OfferResponse from(Offer offer, Instant now) {
    return new OfferResponse(
        offer.getId(),
        offer.getInvoiceId(),
        offer.getSellerId(),
        offer.getLenderId(),
        offer.getAmount(),
        offer.getInterestRate(),
        offer.getFundingPercentage(),
        offer.getTenure(),
        offer.getDailyInterestRate(),
        offer.getTotalInterestAmount(),
        offer.getTotalRepaymentAmount(),
        offer.effectiveAnnualRate(),
        offer.getTerms(),
        offer.getLenderNotes(),
        offer.getStatus(),
        offer.isActive(now),
        offer.getExpiresAt(),
        offer.timeUntilExpiryMinutes(now),
        offer.getAcceptedAt(),
        offer.getAcceptanceNotes(),
        offer.getRejectedAt(),
        offer.getRejectionReason(),
        offer.getWithdrawnAt(),
        offer.getWithdrawalReason(),
        offer.getExpiredAt(),
        offer.getCreatedAt(),
        offer.getUpdatedAt());
  }
}
