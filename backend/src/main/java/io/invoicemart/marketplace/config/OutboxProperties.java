package io.invoicemart.marketplace.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Notification outbox dispatch settings.
 *
 * @param batchSize maximum number of rows claimed per dispatch run
 * @param maxRetries attempts before a row is marked failed
 * @param retentionDays age after which sent rows are purged
 */
@ConfigurationProperties(prefix = "marketplace.outbox")
public record OutboxProperties(int batchSize, int maxRetries, int retentionDays) {

  public OutboxProperties {
    if (batchSize <= 0) {
      batchSize = 50;
    }
    if (maxRetries <= 0) {
      maxRetries = 5;
    }
    if (retentionDays <= 0) {
      retentionDays = 30;
    }
  }
}
