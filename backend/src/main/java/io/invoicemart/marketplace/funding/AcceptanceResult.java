package io.invoicemart.marketplace.funding;

import io.invoicemart.marketplace.invoice.Invoice;
import io.invoicemart.marketplace.offer.Offer;

/** The accepted offer, the funded invoice and how many competing offers were auto-rejected. */
public record AcceptanceResult(Offer offer, Invoice invoice, int autoRejectedOffers) {}
