package io.invoicemart.marketplace.notification.email;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * Sends plain-text marketplace notifications over SMTP. Registered only when {@code
 * spring.mail.host} is set; message metadata travels as {@code X-Invoicemart-*} headers.
 */
@Component
@ConditionalOnProperty(name = "spring.mail.host")
public class SmtpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(SmtpEmailProvider.class);

  static final String HEADER_PREFIX = "X-Invoicemart-";

  private final JavaMailSender mailSender;
  private final String senderAddress;

  public SmtpEmailProvider(
      JavaMailSender mailSender,
      @Value("${marketplace.email.sender-address:no-reply@invoicemart.io}") String senderAddress) {
    this.mailSender = mailSender;
    this.senderAddress = senderAddress;
  }

  @Override
  public String providerId() {
    return "smtp";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    MimeMessage mime = mailSender.createMimeMessage();
    try {
      var helper = new MimeMessageHelper(mime, false, "UTF-8");
      helper.setFrom(senderAddress);
      helper.setTo(message.to());
      helper.setSubject(message.subject());
      helper.setText(message.body() != null ? message.body() : "", false);
      for (var entry : message.metadata().entrySet()) {
        mime.setHeader(HEADER_PREFIX + entry.getKey(), entry.getValue());
      }
      mailSender.send(mime);
      log.debug("Mailed '{}' to {} as {}", message.subject(), message.to(), mime.getMessageID());
      return new SendResult(true, mime.getMessageID(), null);
    } catch (MailException | MessagingException e) {
      log.warn(
          "SMTP delivery of '{}' to {} failed: {}",
          message.subject(),
          message.to(),
          e.getMessage());
      return new SendResult(false, null, e.getMessage());
    }
  }
}
