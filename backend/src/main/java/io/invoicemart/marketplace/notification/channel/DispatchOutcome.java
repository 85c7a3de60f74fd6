package io.invoicemart.marketplace.notification.channel;

import java.util.Map;
import java.util.Set;

/** Channels that accepted a notification on this attempt, and the error for each that did not. */
public record DispatchOutcome(Set<String> delivered, Map<String, String> failures) {

  public boolean isComplete() {
    return failures.isEmpty();
  }
}
