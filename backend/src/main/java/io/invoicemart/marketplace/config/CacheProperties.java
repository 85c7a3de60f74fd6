package io.invoicemart.marketplace.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Read-model cache settings. Marketplace-visible projections use short TTLs; rarely-changing
 * aggregates are kept longer.
 *
 * @param enabled when false every read-through call computes from the authoritative store
 * @param provider {@code redis} or {@code memory}
 * @param invoiceDetailTtl TTL for a single invoice's detail projection
 * @param listTtl TTL for seller, anchor, admin and lender list projections
 * @param marketplaceTtl TTL for marketplace browse and trending results
 * @param competitiveAnalysisTtl TTL for per-invoice competitive analysis
 * @param lockTtl expiry of distributed locks taken for stampede protection and invoice operations
 * @param lockWait how long a reader that lost the recompute race polls the cache before computing
 */
@ConfigurationProperties(prefix = "marketplace.cache")
public record CacheProperties(
    boolean enabled,
    String provider,
    Duration invoiceDetailTtl,
    Duration listTtl,
    Duration marketplaceTtl,
    Duration competitiveAnalysisTtl,
    Duration lockTtl,
    Duration lockWait) {

  public CacheProperties {
    if (provider == null || provider.isBlank()) {
      provider = "redis";
    }
    if (invoiceDetailTtl == null) {
      invoiceDetailTtl = Duration.ofMinutes(30);
    }
    if (listTtl == null) {
      listTtl = Duration.ofMinutes(10);
    }
    if (marketplaceTtl == null) {
      marketplaceTtl = Duration.ofMinutes(5);
    }
    if (competitiveAnalysisTtl == null) {
      competitiveAnalysisTtl = Duration.ofMinutes(15);
    }
    if (lockTtl == null) {
      lockTtl = Duration.ofSeconds(5);
    }
    if (lockWait == null) {
      lockWait = Duration.ofMillis(500);
    }
  }

  public static CacheProperties defaults() {
    return new CacheProperties(true, "memory", null, null, null, null, null, null);
  }
}
