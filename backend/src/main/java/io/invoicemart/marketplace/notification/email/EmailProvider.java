package io.invoicemart.marketplace.notification.email;

/** Port for sending emails via an external provider. */
public interface EmailProvider {

  /** Provider identifier (e.g., "smtp", "noop"). */
  String providerId();

  SendResult sendEmail(EmailMessage message);
}
