package io.invoicemart.marketplace.invoice;

public enum SupportingDocumentType {
  PURCHASE_ORDER,
  DELIVERY_NOTE,
  CONTRACT,
  OTHER
}
