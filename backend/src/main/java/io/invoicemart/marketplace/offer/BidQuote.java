package io.invoicemart.marketplace.offer;

import java.math.BigDecimal;

/**
 * A bid that passed every bidding constraint, with its derived financials. Interest is simple
 * daily interest: {@code dailyRate = rate / 365 / 100}, {@code interest = amount × dailyRate ×
 * tenure}.
 */
public record BidQuote(
    BigDecimal fundingAmount,
    BigDecimal interestRate,
    BigDecimal fundingPercentage,
    int tenure,
    BigDecimal dailyInterestRate,
    BigDecimal totalInterestAmount,
    BigDecimal totalRepaymentAmount) {}
