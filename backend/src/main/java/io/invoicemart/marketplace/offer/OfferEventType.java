package io.invoicemart.marketplace.offer;

public enum OfferEventType {
  CREATED,
  ACCEPTED,
  REJECTED,
  AUTO_REJECTED,
  WITHDRAWN,
  EXPIRED
}
