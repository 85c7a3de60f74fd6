package io.invoicemart.marketplace.notification;

public enum NotificationType {
  INVOICE_STATUS_CHANGED,
  INVOICE_AWAITING_APPROVAL,
  NEW_OFFER,
  MULTIPLE_OFFERS,
  COMPETITIVE_ALERT,
  OFFER_ACCEPTED,
  OFFER_REJECTED,
  OFFER_WITHDRAWN,
  OFFER_EXPIRED
}
