package io.invoicemart.marketplace.offer;

/**
 * Offer lifecycle: PENDING is the only non-terminal state. ACCEPTED, REJECTED and WITHDRAWN are
 * reached by seller or lender action; EXPIRED by the expiry sweep.
 */
public enum OfferStatus {
  PENDING,
  ACCEPTED,
  REJECTED,
  WITHDRAWN,
  EXPIRED;

  public boolean canTransitionTo(OfferStatus target) {
    return this == PENDING && target != PENDING;
  }
}
