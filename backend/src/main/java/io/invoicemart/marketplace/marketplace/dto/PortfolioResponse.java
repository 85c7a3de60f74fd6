package io.invoicemart.marketplace.marketplace.dto;

import io.invoicemart.marketplace.offer.dto.OfferResponse;
import io.invoicemart.marketplace.web.PageResponse;
import java.math.BigDecimal;

public record PortfolioResponse(PageResponse<OfferResponse> offers, Summary summary) {

  /**
   * Counts by status across all of the lender's offers; {@code totalFunded} sums accepted amounts.
   */
  public record Summary(
      long pending,
      long accepted,
      long rejected,
      long withdrawn,
      long expired,
      BigDecimal totalFunded) {}
}
