package io.invoicemart.marketplace.cache;

import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Puts a fallback expiry on read-model keys that were left without one. */
@Component
public class CacheHygieneProcessor {

  private static final Logger log = LoggerFactory.getLogger(CacheHygieneProcessor.class);

  static final Duration FALLBACK_TTL = Duration.ofHours(24);

  static final List<String> PATTERNS =
      List.of(
          "invoice:details:*",
          "invoice:seller:*",
          "invoice:anchor:*",
          "invoice:admin:*",
          "offers:*",
          "offer:details:*",
          "competitive:*",
          "competition:*",
          CacheKeys.MARKETPLACE_ALL,
          CacheKeys.TRENDING_INVOICES,
          "notifications:*");

  private final MarketplaceCache cache;

  public CacheHygieneProcessor(MarketplaceCache cache) {
    this.cache = cache;
  }

  @Scheduled(fixedRateString = "${marketplace.cache.hygiene-interval:3600000}")
  public void ensureExpiries() {
    long updated = 0;
    for (String pattern : PATTERNS) {
      try {
        updated += cache.ensureExpiry(pattern, FALLBACK_TTL);
      } catch (RuntimeException e) {
        log.warn("Cache hygiene failed for pattern {}: {}", pattern, e.getMessage());
      }
    }
    if (updated > 0) {
      log.info("Cache hygiene applied fallback expiry to {} keys", updated);
    }
  }
}
