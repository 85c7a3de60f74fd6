package io.invoicemart.marketplace.marketplace.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Aggregate view of the active offers on one invoice. Rate and amount statistics are null when
 * there are no offers.
 */
public record CompetitiveAnalysis(
    UUID invoiceId,
    long totalOffers,
    BigDecimal minInterestRate,
    BigDecimal maxInterestRate,
    BigDecimal averageInterestRate,
    BigDecimal minAmount,
    BigDecimal maxAmount,
    BigDecimal averageAmount,
    BigDecimal averageFundingPercentage,
    BigDecimal maxFundingPercentage,
    List<TopOffer> topOffers) {

  /** An offer in the leaderboard. Lender identity is withheld from competitors. */
  public record TopOffer(
      int rank,
      UUID offerId,
      BigDecimal amount,
      BigDecimal interestRate,
      BigDecimal fundingPercentage,
      int tenure,
      Instant createdAt) {}
}
