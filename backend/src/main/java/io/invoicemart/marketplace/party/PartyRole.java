package io.invoicemart.marketplace.party;

/** Marketplace participant roles. */
public enum PartyRole {
  SELLER,
  ANCHOR,
  ADMIN,
  LENDER
}
