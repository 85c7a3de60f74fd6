package io.invoicemart.marketplace.testutil;

import io.invoicemart.marketplace.invoice.Invoice;
import io.invoicemart.marketplace.invoice.InvoiceDocument;
import io.invoicemart.marketplace.invoice.MarketplaceFundingTerms;
import io.invoicemart.marketplace.offer.BiddingRules;
import io.invoicemart.marketplace.offer.Offer;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;
import org.springframework.test.util.ReflectionTestUtils;

/** Shared test utility for building invoices and offers at a given lifecycle point. */
public final class TestMarketplaceFactory {

  public static final BigDecimal INVOICE_AMOUNT = new BigDecimal("100000.00");
  public static final BigDecimal RATE = new BigDecimal("12.00");
  public static final BigDecimal MAX_FUNDING = new BigDecimal("90000.00");

  private TestMarketplaceFactory() {}

  public static Instant now() {
    return Instant.now();
  }

  public static LocalDate today() {
    return LocalDate.now(ZoneOffset.UTC);
  }

  /** A DRAFT invoice due in 90 days, with an id assigned. */
  public static Invoice draftInvoice(UUID sellerId, UUID anchorId) {
    var invoice = newDraft(sellerId, anchorId);
    ReflectionTestUtils.setField(invoice, "id", UUID.randomUUID());
    return invoice;
  }

  public static Invoice submittedInvoice(UUID sellerId, UUID anchorId) {
    var invoice = draftInvoice(sellerId, anchorId);
    submit(invoice);
    return invoice;
  }

  public static MarketplaceFundingTerms standardTerms() {
    return new MarketplaceFundingTerms(MAX_FUNDING, RATE, 60);
  }

  /** A LISTED invoice with max funding 90,000 at a fixed 12% and a 60-day tenure cap. */
  public static Invoice listedInvoice(UUID sellerId, UUID anchorId, UUID adminId) {
    var invoice = submittedInvoice(sellerId, anchorId);
    approveVerifyAndList(invoice, anchorId, adminId);
    return invoice;
  }

  /** Same as {@link #listedInvoice} but without an id, so it can be persisted. */
  public static Invoice unsavedListedInvoice(UUID sellerId, UUID anchorId, UUID adminId) {
    var invoice = newDraft(sellerId, anchorId);
    submit(invoice);
    approveVerifyAndList(invoice, anchorId, adminId);
    return invoice;
  }

  private static Invoice newDraft(UUID sellerId, UUID anchorId) {
    return new Invoice(
        sellerId,
        anchorId,
        "INV-" + UUID.randomUUID().toString().substring(0, 8),
        INVOICE_AMOUNT,
        "NGN",
        today().minusDays(10),
        today().plusDays(90),
        "Goods delivered",
        now());
  }

  private static void submit(Invoice invoice) {
    invoice.attachPrimaryDocument(
        new InvoiceDocument("invoices/test/invoice.pdf", "invoice.pdf", "application/pdf", 1024),
        now());
    invoice.submit(invoice.getSellerId(), now());
  }

  private static void approveVerifyAndList(Invoice invoice, UUID anchorId, UUID adminId) {
    invoice.approveByAnchor(anchorId, "Confirmed", standardTerms(), now());
    invoice.verifyByAdmin(adminId, "Verified", null, now());
    invoice.list(adminId, now());
  }

  /** A pending offer that passed the bidding rules against {@code invoice}. */
  public static Offer pendingOffer(
      Invoice invoice, UUID lenderId, BigDecimal percentage, int tenure, Instant now) {
    var quote = BiddingRules.evaluate(invoice, RATE, percentage, tenure, today());
    var offer =
        new Offer(
            invoice.getId(),
            invoice.getSellerId(),
            lenderId,
            quote,
            null,
            null,
            now.plus(BiddingRules.DEFAULT_OFFER_EXPIRY),
            now);
    ReflectionTestUtils.setField(offer, "id", UUID.randomUUID());
    return offer;
  }
}
