package io.invoicemart.marketplace.notification.email;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Component;

/** Used when no mail host is configured: the message is logged and reported as delivered. */
@Component
@ConditionalOnMissingBean(SmtpEmailProvider.class)
public class NoOpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpEmailProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    String id = "noop-" + UUID.randomUUID();
    log.info("Mail disabled; '{}' for {} logged as {}", message.subject(), message.to(), id);
    return new SendResult(true, id, null);
  }
}
