package io.invoicemart.marketplace.notification;

import io.invoicemart.marketplace.invoice.Invoice;
import io.invoicemart.marketplace.invoice.InvoiceStatus;
import io.invoicemart.marketplace.offer.Offer;
import io.invoicemart.marketplace.offer.OfferSnapshot;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Composes marketplace notifications and enqueues them in the caller's transaction. Delivery
 * happens later through {@link OutboxDispatcher}.
 */
@Component
public class MarketplaceNotifier {

  static final String INVOICE_REF = "INVOICE";
  static final String OFFER_REF = "OFFER";

  private final NotificationOutboxService outbox;

  public MarketplaceNotifier(NotificationOutboxService outbox) {
    this.outbox = outbox;
  }

  public void invoiceStatusChanged(Invoice invoice, String message) {
    InvoiceStatus status = invoice.getStatus();
    String body =
        "Invoice "
            + invoice.getInvoiceNumber()
            + " is now "
            + status
            + "."
            + (message != null && !message.isBlank() ? "\n\n" + message : "");
    outbox.enqueue(
        NotificationType.INVOICE_STATUS_CHANGED,
        invoice.getSellerId(),
        "Invoice " + invoice.getInvoiceNumber() + ": " + humanize(status),
        body,
        invoiceData(invoice),
        INVOICE_REF,
        invoice.getId());
  }

  public void invoiceAwaitingApproval(Invoice invoice) {
    outbox.enqueue(
        NotificationType.INVOICE_AWAITING_APPROVAL,
        invoice.getAnchorId(),
        "Invoice " + invoice.getInvoiceNumber() + " awaits your approval",
        "A seller submitted invoice "
            + invoice.getInvoiceNumber()
            + " for "
            + money(invoice.getAmount(), invoice)
            + ", due "
            + invoice.getDueDate()
            + ". Please approve or reject it.",
        invoiceData(invoice),
        INVOICE_REF,
        invoice.getId());
  }

  public void newOffer(Invoice invoice, Offer offer) {
    outbox.enqueue(
        NotificationType.NEW_OFFER,
        invoice.getSellerId(),
        "New offer on invoice " + invoice.getInvoiceNumber(),
        "A lender offered "
            + money(offer.getAmount(), invoice)
            + " ("
            + offer.getFundingPercentage().toPlainString()
            + "% of the invoice) at "
            + offer.getInterestRate().toPlainString()
            + "% for "
            + offer.getTenure()
            + " days. The offer expires at "
            + offer.getExpiresAt()
            + ".",
        offerData(invoice, offer.getId(), offer.getAmount(), offer.getInterestRate()),
        OFFER_REF,
        offer.getId());
  }

  public void multipleOffers(Invoice invoice, long pendingCount) {
    var data = invoiceData(invoice);
    data.put("pendingOffers", pendingCount);
    outbox.enqueue(
        NotificationType.MULTIPLE_OFFERS,
        invoice.getSellerId(),
        pendingCount + " offers on invoice " + invoice.getInvoiceNumber(),
        "Invoice "
            + invoice.getInvoiceNumber()
            + " now has "
            + pendingCount
            + " pending offers. Compare them before they expire.",
        data,
        INVOICE_REF,
        invoice.getId());
  }

  /** Tells a lender that a newer offer now ranks ahead of theirs. */
  public void competitiveAlert(Invoice invoice, OfferSnapshot outranked, Offer newOffer) {
    outbox.enqueue(
        NotificationType.COMPETITIVE_ALERT,
        outranked.lenderId(),
        "You have been outbid on invoice " + invoice.getInvoiceNumber(),
        "A competing offer of "
            + money(newOffer.getAmount(), invoice)
            + " now ranks ahead of your offer of "
            + money(outranked.amount(), invoice)
            + ".",
        offerData(invoice, outranked.offerId(), outranked.amount(), outranked.interestRate()),
        OFFER_REF,
        outranked.offerId());
  }

  public void offerAccepted(Invoice invoice, Offer offer) {
    outbox.enqueue(
        NotificationType.OFFER_ACCEPTED,
        offer.getLenderId(),
        "Your offer on invoice " + invoice.getInvoiceNumber() + " was accepted",
        "The seller accepted your offer of "
            + money(offer.getAmount(), invoice)
            + ". Expected repayment: "
            + money(invoice.getTotalRepaymentAmount(), invoice)
            + " by "
            + invoice.getDueDate()
            + ".",
        offerData(invoice, offer.getId(), offer.getAmount(), offer.getInterestRate()),
        OFFER_REF,
        offer.getId());
  }

  public void offerRejected(Invoice invoice, OfferSnapshot offer, String reason) {
    outbox.enqueue(
        NotificationType.OFFER_REJECTED,
        offer.lenderId(),
        "Your offer on invoice " + invoice.getInvoiceNumber() + " was rejected",
        "Your offer of "
            + money(offer.amount(), invoice)
            + " was rejected"
            + (reason != null && !reason.isBlank() ? ": " + reason : "."),
        offerData(invoice, offer.offerId(), offer.amount(), offer.interestRate()),
        OFFER_REF,
        offer.offerId());
  }

  public void offerWithdrawn(Invoice invoice, Offer offer) {
    outbox.enqueue(
        NotificationType.OFFER_WITHDRAWN,
        invoice.getSellerId(),
        "An offer on invoice " + invoice.getInvoiceNumber() + " was withdrawn",
        "A lender withdrew their offer of "
            + money(offer.getAmount(), invoice)
            + (offer.getWithdrawalReason() != null ? ": " + offer.getWithdrawalReason() : "."),
        offerData(invoice, offer.getId(), offer.getAmount(), offer.getInterestRate()),
        OFFER_REF,
        offer.getId());
  }

  public void offerExpired(Offer offer) {
    var data = new LinkedHashMap<String, Object>();
    data.put("invoiceId", offer.getInvoiceId());
    data.put("offerId", offer.getId());
    outbox.enqueue(
        NotificationType.OFFER_EXPIRED,
        offer.getLenderId(),
        "Your offer has expired",
        "Your offer of "
            + offer.getAmount().toPlainString()
            + " expired at "
            + offer.getExpiresAt()
            + " without a decision from the seller.",
        data,
        OFFER_REF,
        offer.getId());
  }

  private static Map<String, Object> invoiceData(Invoice invoice) {
    var data = new LinkedHashMap<String, Object>();
    data.put("invoiceId", invoice.getId());
    data.put("invoiceNumber", invoice.getInvoiceNumber());
    data.put("status", invoice.getStatus().name());
    data.put("amount", invoice.getAmount());
    data.put("currency", invoice.getCurrency());
    return data;
  }

  private static Map<String, Object> offerData(
      Invoice invoice, UUID offerId, BigDecimal amount, BigDecimal interestRate) {
    var data = invoiceData(invoice);
    data.put("offerId", offerId);
    data.put("offerAmount", amount);
    data.put("interestRate", interestRate);
    return data;
  }

  private static String money(BigDecimal amount, Invoice invoice) {
    return amount == null ? "-" : invoice.getCurrency() + " " + amount.toPlainString();
  }

  private static String humanize(InvoiceStatus status) {
    return status.name().toLowerCase().replace('_', ' ');
  }
}
