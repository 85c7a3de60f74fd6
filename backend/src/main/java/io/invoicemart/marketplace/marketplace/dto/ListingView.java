package io.invoicemart.marketplace.marketplace.dto;

import io.invoicemart.marketplace.invoice.dto.InvoiceResponse;
import java.math.BigDecimal;

/**
 * A listed invoice with its bidding aggregates. {@code hasMyOffer} is specific to the requesting
 * lender and is filled in after the shared listing is read from cache.
 */
public record ListingView(
    InvoiceResponse invoice, long offerCount, BigDecimal bestRate, boolean hasMyOffer) {

  public ListingView withMyOffer(boolean mine) {
    return new ListingView(invoice, offerCount, bestRate, mine);
  }
}
