package io.invoicemart.marketplace.notification.channel;

import io.invoicemart.marketplace.notification.Notification;
import io.invoicemart.marketplace.notification.email.EmailMessage;
import io.invoicemart.marketplace.notification.email.EmailProvider;
import io.invoicemart.marketplace.party.PartyRepository;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Sends the notification as a plain-text email to the recipient's directory address. */
@Component
public class EmailNotificationChannel implements NotificationChannel {

  private static final Logger log = LoggerFactory.getLogger(EmailNotificationChannel.class);

  private final EmailProvider emailProvider;
  private final PartyRepository partyRepository;
  private final boolean enabled;

  public EmailNotificationChannel(
      EmailProvider emailProvider,
      PartyRepository partyRepository,
      @Value("${marketplace.email.enabled:true}") boolean enabled) {
    this.emailProvider = emailProvider;
    this.partyRepository = partyRepository;
    this.enabled = enabled;
  }

  @Override
  public String channelId() {
    return "email";
  }

  @Override
  public void deliver(Notification notification) {
    var recipient = partyRepository.findById(notification.recipientId()).orElse(null);
    if (recipient == null || recipient.getEmail() == null || recipient.getEmail().isBlank()) {
      log.debug(
          "Skipping email for notification {} -- no address for recipient {}",
          notification.id(),
          notification.recipientId());
      return;
    }
    var message =
        new EmailMessage(
            recipient.getEmail(),
            notification.subject(),
            notification.body(),
            Map.of(
                "notificationId", String.valueOf(notification.id()),
                "type", notification.type().name()));
    var result = emailProvider.sendEmail(message);
    if (!result.success()) {
      throw new NotificationDeliveryException(
          "Email provider " + emailProvider.providerId() + " failed: " + result.errorMessage());
    }
  }

  @Override
  public boolean isEnabled() {
    return enabled;
  }
}
