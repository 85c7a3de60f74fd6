package io.invoicemart.marketplace.invoice;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** Published inside the transaction that moved the invoice; handled after commit. */
public record InvoiceStatusChangedEvent(
    UUID invoiceId,
    UUID sellerId,
    UUID anchorId,
    String invoiceNumber,
    InvoiceStatus from,
    InvoiceStatus to,
    UUID actorId,
    List<String> documentKeys) {

  /** Entering or leaving LISTED changes what the marketplace shows. */
  public boolean listingsAffected() {
    return from == InvoiceStatus.LISTED || to == InvoiceStatus.LISTED;
  }

  public static InvoiceStatusChangedEvent of(Invoice invoice, InvoiceStatus from, UUID actorId) {
    var keys = new ArrayList<String>();
    if (invoice.getPrimaryDocument() != null) {
      keys.add(invoice.getPrimaryDocument().getStorageKey());
    }
    invoice.getSupportingDocuments().forEach(d -> keys.add(d.getStorageKey()));
    return new InvoiceStatusChangedEvent(
        invoice.getId(),
        invoice.getSellerId(),
        invoice.getAnchorId(),
        invoice.getInvoiceNumber(),
        from,
        invoice.getStatus(),
        actorId,
        List.copyOf(keys));
  }
}
