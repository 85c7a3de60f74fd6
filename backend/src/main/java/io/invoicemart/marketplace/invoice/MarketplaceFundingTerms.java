package io.invoicemart.marketplace.invoice;

import io.invoicemart.marketplace.exception.InvalidRequestException;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Admin-controlled caps that bound every bid on an invoice: the maximum amount a lender may
 * advance, the fixed (non-negotiable) interest rate, and the longest tenure in days.
 */
@Embeddable
public class MarketplaceFundingTerms {

  static final BigDecimal MAX_INTEREST_RATE = new BigDecimal("50");
  static final int MAX_TENURE_DAYS = 365;

  @Column(name = "max_funding_amount", precision = 14, scale = 2)
  private BigDecimal maxFundingAmount;

  @Column(name = "recommended_interest_rate", precision = 5, scale = 2)
  private BigDecimal recommendedInterestRate;

  @Column(name = "max_tenure")
  private Integer maxTenure;

  protected MarketplaceFundingTerms() {}

  public MarketplaceFundingTerms(
      BigDecimal maxFundingAmount, BigDecimal recommendedInterestRate, Integer maxTenure) {
    this.maxFundingAmount = maxFundingAmount;
    this.recommendedInterestRate = recommendedInterestRate;
    this.maxTenure = maxTenure;
  }

  /** Bidding requires at least the amount cap and the fixed rate. */
  public boolean isComplete() {
    return maxFundingAmount != null && recommendedInterestRate != null;
  }

  /**
   * Checks the terms against the invoice they are attached to.
   *
   * @throws InvalidRequestException if a cap is out of range
   */
  void validateFor(BigDecimal invoiceAmount, long daysUntilDue) {
    violationFor(invoiceAmount, daysUntilDue)
        .ifPresent(
            detail -> {
              throw new InvalidRequestException("Invalid funding terms", detail);
            });
  }

  /** Whether the caps still hold for an invoice of this amount and remaining term. */
  boolean fits(BigDecimal invoiceAmount, long daysUntilDue) {
    return violationFor(invoiceAmount, daysUntilDue).isEmpty();
  }

  private Optional<String> violationFor(BigDecimal invoiceAmount, long daysUntilDue) {
    if (maxFundingAmount != null
        && (maxFundingAmount.signum() <= 0 || maxFundingAmount.compareTo(invoiceAmount) > 0)) {
      return Optional.of(
          "Maximum funding amount must be positive and cannot exceed the invoice amount of "
              + invoiceAmount.toPlainString());
    }
    if (recommendedInterestRate != null
        && (recommendedInterestRate.signum() < 0
            || recommendedInterestRate.compareTo(MAX_INTEREST_RATE) > 0)) {
      return Optional.of("Recommended interest rate must be between 0 and 50");
    }
    if (maxTenure != null) {
      if (maxTenure < 1 || maxTenure > MAX_TENURE_DAYS) {
        return Optional.of("Maximum tenure must be between 1 and 365 days");
      }
      if (maxTenure > daysUntilDue) {
        return Optional.of(
            "Maximum tenure cannot exceed the " + daysUntilDue + " days until the invoice is due");
      }
    }
    return Optional.empty();
  }

  public BigDecimal getMaxFundingAmount() {
    return maxFundingAmount;
  }

  public BigDecimal getRecommendedInterestRate() {
    return recommendedInterestRate;
  }

  public Integer getMaxTenure() {
    return maxTenure;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MarketplaceFundingTerms other)) {
      return false;
    }
    return Objects.equals(maxFundingAmount, other.maxFundingAmount)
        && Objects.equals(recommendedInterestRate, other.recommendedInterestRate)
        && Objects.equals(maxTenure, other.maxTenure);
  }

  @Override
  public int hashCode() {
    return Objects.hash(maxFundingAmount, recommendedInterestRate, maxTenure);
  }
}
