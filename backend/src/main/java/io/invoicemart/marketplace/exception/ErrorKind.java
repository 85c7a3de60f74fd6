package io.invoicemart.marketplace.exception;

/**
 * Stable discriminator carried as the {@code kind} property of every problem response. Clients
 * switch on this value rather than on HTTP status or title text.
 */
public enum ErrorKind {
  INVALID_STATE_TRANSITION,
  INVOICE_NOT_AVAILABLE,
  FUNDING_TERMS_NOT_SET,
  INTEREST_RATE_MISMATCH,
  TENURE_EXCEEDS_LIMIT,
  FUNDING_AMOUNT_EXCEEDS_LIMIT,
  DUPLICATE_ACTIVE_OFFER,
  OFFER_NOT_ACTIONABLE,
  NOT_AUTHORIZED,
  NOT_FOUND,
  INVALID_REQUEST,
  CONCURRENT_MODIFICATION,
  OPERATION_IN_PROGRESS
}
