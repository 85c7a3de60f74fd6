package io.invoicemart.marketplace.invoice;

import java.util.EnumSet;
import java.util.Set;

/**
 * Invoice lifecycle status. {@link #canTransitionTo} is the single transition table consulted by
 * every mutation path.
 *
 * <p>Valid transitions:
 *
 * <ul>
 *   <li>DRAFT → SUBMITTED (seller submits with a primary document)
 *   <li>SUBMITTED → ANCHOR_APPROVED or REJECTED (anchor decision)
 *   <li>ANCHOR_APPROVED → ADMIN_VERIFIED or REJECTED (admin decision)
 *   <li>ADMIN_VERIFIED → LISTED (admin lists to the marketplace)
 *   <li>LISTED → FUNDED (an offer is accepted)
 *   <li>FUNDED → REPAID → SETTLED
 *   <li>REJECTED → SUBMITTED (seller corrects and resubmits)
 * </ul>
 */
public enum InvoiceStatus {
  /** Created by the seller; editable. */
  DRAFT,

  /** Awaiting the anchor's decision. */
  SUBMITTED,

  /** Anchor confirmed the obligation; awaiting admin verification. */
  ANCHOR_APPROVED,

  /** Verified by an admin; ready to be listed. */
  ADMIN_VERIFIED,

  /** Visible in the marketplace and open for offers. */
  LISTED,

  /** An offer was accepted and the invoice is financed. */
  FUNDED,

  /** The lender has been repaid. */
  REPAID,

  /** Terminal. */
  SETTLED,

  /** Rejected by the anchor or an admin; editable and resubmittable. */
  REJECTED;

  private static final Set<InvoiceStatus> EDITABLE = EnumSet.of(DRAFT, REJECTED);

  public boolean canTransitionTo(InvoiceStatus target) {
    return switch (this) {
      case DRAFT, REJECTED -> target == SUBMITTED;
      case SUBMITTED, ANCHOR_APPROVED -> target == next() || target == REJECTED;
      case ADMIN_VERIFIED, LISTED, FUNDED, REPAID -> target == next();
      case SETTLED -> false;
    };
  }

  public boolean isEditable() {
    return EDITABLE.contains(this);
  }

  private InvoiceStatus next() {
    return switch (this) {
      case SUBMITTED -> ANCHOR_APPROVED;
      case ANCHOR_APPROVED -> ADMIN_VERIFIED;
      case ADMIN_VERIFIED -> LISTED;
      case LISTED -> FUNDED;
      case FUNDED -> REPAID;
      case REPAID -> SETTLED;
      default -> this;
    };
  }
}
