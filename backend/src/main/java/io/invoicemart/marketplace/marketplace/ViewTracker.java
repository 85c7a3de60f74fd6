package io.invoicemart.marketplace.marketplace;

import io.invoicemart.marketplace.cache.CacheKeys;
import io.invoicemart.marketplace.cache.MarketplaceCache;
import io.invoicemart.marketplace.cache.ScoredMember;
import io.invoicemart.marketplace.config.CacheProperties;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Counts invoice views in a sorted set whose expiry is pushed forward on every view, so counts
 * reset after a quiet window.
 */
@Component
public class ViewTracker {

  private static final Logger log = LoggerFactory.getLogger(ViewTracker.class);

  static final Duration VIEW_WINDOW = Duration.ofHours(4);

  private final MarketplaceCache cache;
  private final boolean enabled;

  public ViewTracker(MarketplaceCache cache, CacheProperties properties) {
    this.cache = cache;
    this.enabled = properties.enabled();
  }

  public void recordView(UUID invoiceId) {
    if (!enabled) {
      return;
    }
    try {
      cache.zIncrBy(CacheKeys.TRENDING_INVOICES, invoiceId.toString(), 1);
      cache.expire(CacheKeys.TRENDING_INVOICES, VIEW_WINDOW);
    } catch (RuntimeException e) {
      log.warn("Could not record view of invoice {}: {}", invoiceId, e.getMessage());
    }
  }

  /** Most viewed first. Empty when caching is off or the store is unreachable. */
  public List<ScoredMember> mostViewed(int limit) {
    if (!enabled) {
      return List.of();
    }
    try {
      return cache.zTop(CacheKeys.TRENDING_INVOICES, limit);
    } catch (RuntimeException e) {
      log.warn("Could not read trending invoices: {}", e.getMessage());
      return List.of();
    }
  }
}
