package io.invoicemart.marketplace.notification;

public enum OutboxStatus {
  PENDING,
  RETRY_SCHEDULED,
  SENT,
  FAILED
}
