package io.invoicemart.marketplace.offer;

import io.invoicemart.marketplace.exception.BiddingConstraintException;
import io.invoicemart.marketplace.invoice.Invoice;
import io.invoicemart.marketplace.invoice.InvoiceStatus;
import io.invoicemart.marketplace.invoice.MarketplaceFundingTerms;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDate;

/**
 * Constraints an offer must satisfy against its invoice's marketplace funding terms. Checks run in
 * a fixed order and the first violation is reported: availability, terms present, exact rate,
 * tenure, then amount.
 */
public final class BiddingRules {

  /** Days required between the end of a loan and the invoice's due date to collect payment. */
  public static final int COLLECTION_BUFFER_DAYS = 14;

  /** Offer lifetime when the lender does not choose one. */
  public static final Duration DEFAULT_OFFER_EXPIRY = Duration.ofHours(48);

  private static final BigDecimal HUNDRED = new BigDecimal("100");
  private static final BigDecimal RATE_DIVISOR = new BigDecimal("36500");

  private BiddingRules() {}

  public static BidQuote evaluate(
      Invoice invoice,
      BigDecimal interestRate,
      BigDecimal fundingPercentage,
      int tenure,
      LocalDate today) {
    if (invoice.getStatus() != InvoiceStatus.LISTED) {
      throw BiddingConstraintException.invoiceNotAvailable(
          invoice.getId(), invoice.getStatus().name());
    }

    MarketplaceFundingTerms terms = invoice.getFundingTerms();
    if (terms == null || !terms.isComplete()) {
      throw BiddingConstraintException.fundingTermsNotSet(invoice.getId());
    }

    if (interestRate.compareTo(terms.getRecommendedInterestRate()) != 0) {
      throw BiddingConstraintException.interestRateMismatch(
          terms.getRecommendedInterestRate(), interestRate);
    }

    long daysUntilDue = invoice.daysUntilDue(today);
    int maxTenure = maxTenure(daysUntilDue, terms.getMaxTenure());
    if (tenure > maxTenure) {
      throw BiddingConstraintException.tenureExceedsLimit(maxTenure, tenure, daysUntilDue);
    }

    BigDecimal fundingAmount = fundingAmount(invoice.getAmount(), fundingPercentage);
    if (fundingAmount.compareTo(terms.getMaxFundingAmount()) > 0) {
      throw BiddingConstraintException.fundingAmountExceedsLimit(
          terms.getMaxFundingAmount(),
          fundingAmount,
          maxAllowedPercentage(terms.getMaxFundingAmount(), invoice.getAmount()));
    }

    return quote(fundingAmount, interestRate, fundingPercentage, tenure);
  }

  /** min(max(0, daysUntilDue − buffer), adminMaxTenure). */
  static int maxTenure(long daysUntilDue, Integer adminMaxTenure) {
    long bufferLimited = Math.max(0, daysUntilDue - COLLECTION_BUFFER_DAYS);
    long limit = adminMaxTenure != null ? Math.min(bufferLimited, adminMaxTenure) : bufferLimited;
    return (int) Math.min(limit, Integer.MAX_VALUE);
  }

  static BigDecimal fundingAmount(BigDecimal invoiceAmount, BigDecimal fundingPercentage) {
    return invoiceAmount.multiply(fundingPercentage).divide(HUNDRED, 2, RoundingMode.HALF_UP);
  }

  static int maxAllowedPercentage(BigDecimal maxFundingAmount, BigDecimal invoiceAmount) {
    return maxFundingAmount
        .multiply(HUNDRED)
        .divide(invoiceAmount, 0, RoundingMode.FLOOR)
        .intValue();
  }

  static BidQuote quote(
      BigDecimal fundingAmount, BigDecimal interestRate, BigDecimal fundingPercentage, int tenure) {
    BigDecimal dailyRate = interestRate.divide(RATE_DIVISOR, 10, RoundingMode.HALF_UP);
    BigDecimal totalInterest =
        fundingAmount
            .multiply(interestRate)
            .multiply(BigDecimal.valueOf(tenure))
            .divide(RATE_DIVISOR, 2, RoundingMode.HALF_UP);
    return new BidQuote(
        fundingAmount,
        interestRate,
        fundingPercentage,
        tenure,
        dailyRate,
        totalInterest,
        fundingAmount.add(totalInterest));
  }
}
