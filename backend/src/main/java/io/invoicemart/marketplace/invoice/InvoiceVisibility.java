package io.invoicemart.marketplace.invoice;

import io.invoicemart.marketplace.web.Actor;
import java.util.UUID;

/**
 * Who may read an invoice. Sellers see their own invoices and anchors the ones addressed to them.
 * Admins see everything. Lenders see what is on the marketplace and what they funded.
 */
public final class InvoiceVisibility {

  private InvoiceVisibility() {}

  public static boolean canView(
      Actor actor, UUID sellerId, UUID anchorId, InvoiceStatus status, UUID fundedBy) {
    return switch (actor.role()) {
      case ADMIN -> true;
      case SELLER -> actor.id().equals(sellerId);
      case ANCHOR -> actor.id().equals(anchorId);
      case LENDER -> status == InvoiceStatus.LISTED || actor.id().equals(fundedBy);
    };
  }

  public static boolean canView(Actor actor, Invoice invoice) {
    return canView(
        actor,
        invoice.getSellerId(),
        invoice.getAnchorId(),
        invoice.getStatus(),
        invoice.getFundedBy());
  }
}
