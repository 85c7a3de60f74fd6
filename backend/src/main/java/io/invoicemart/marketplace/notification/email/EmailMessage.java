package io.invoicemart.marketplace.notification.email;

import java.util.Map;
import java.util.Objects;

/** Provider-agnostic plain-text email payload with tracking metadata. */
public record EmailMessage(String to, String subject, String body, Map<String, String> metadata) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
  }
}
