package io.invoicemart.marketplace.notification.channel;

import io.invoicemart.marketplace.notification.Notification;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes notifications to every enabled channel. Channels self-register via constructor injection
 * (Spring collects all NotificationChannel beans). A failure on one channel does not stop the
 * others.
 */
@Component
public class NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final Map<String, NotificationChannel> channels;

  public NotificationDispatcher(List<NotificationChannel> channelBeans) {
    this.channels =
        channelBeans.stream()
            .filter(NotificationChannel::isEnabled)
            .collect(
                Collectors.toMap(
                    NotificationChannel::channelId,
                    Function.identity(),
                    (a, b) -> a,
                    LinkedHashMap::new));
  }

  /**
   * Delivers through each enabled channel not in {@code alreadyDelivered}.
   *
   * @return which channels succeeded and which failed on this attempt
   */
  public DispatchOutcome dispatch(Notification notification, Set<String> alreadyDelivered) {
    var delivered = new LinkedHashSet<String>();
    var failures = new LinkedHashMap<String, String>();
    for (var entry : channels.entrySet()) {
      String channelId = entry.getKey();
      if (alreadyDelivered.contains(channelId)) {
        continue;
      }
      try {
        entry.getValue().deliver(notification);
        delivered.add(channelId);
      } catch (Exception e) {
        log.warn(
            "Failed to deliver notification via channel={} notificationId={}: {}",
            channelId,
            notification.id(),
            e.getMessage());
        failures.put(channelId, e.getMessage() != null ? e.getMessage() : e.getClass().getName());
      }
    }
    return new DispatchOutcome(delivered, failures);
  }
}
