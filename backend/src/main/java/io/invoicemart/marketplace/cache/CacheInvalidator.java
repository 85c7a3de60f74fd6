package io.invoicemart.marketplace.cache;

import io.invoicemart.marketplace.config.CacheProperties;
import java.util.Collection;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Broad invalidation of read-model entries after a write. Each deletion is attempted independently
 * and failures are logged; a stale entry still expires at its TTL.
 */
@Component
public class CacheInvalidator {

  private static final Logger log = LoggerFactory.getLogger(CacheInvalidator.class);

  private final MarketplaceCache cache;
  private final boolean enabled;

  public CacheInvalidator(MarketplaceCache cache, CacheProperties properties) {
    this.cache = cache;
    this.enabled = properties.enabled();
  }

  /**
   * @param listingsAffected whether the change moved the invoice into or out of the listed set
   */
  public void invoiceChanged(
      UUID invoiceId, UUID sellerId, UUID anchorId, boolean listingsAffected) {
    if (!enabled) {
      return;
    }
    delete(CacheKeys.invoiceDetail(invoiceId));
    deletePattern(CacheKeys.sellerInvoicesPattern(sellerId));
    if (anchorId != null) {
      deletePattern(CacheKeys.anchorInvoicesPattern(anchorId));
    }
    deletePattern(CacheKeys.adminQueuePattern());
    if (listingsAffected) {
      deletePattern(CacheKeys.marketplaceListingsPattern());
      deletePattern(CacheKeys.marketplaceTrendingPattern());
      delete(CacheKeys.competitiveAnalysis(invoiceId));
    }
  }

  /** Offer writes also touch listing aggregates (offer count, best rate). */
  public void offersChanged(
      UUID invoiceId, Collection<UUID> offerIds, Collection<UUID> lenderIds) {
    if (!enabled) {
      return;
    }
    offerIds.forEach(id -> delete(CacheKeys.offerDetail(id)));
    deletePattern(CacheKeys.invoiceOffersPattern(invoiceId));
    lenderIds.forEach(id -> deletePattern(CacheKeys.lenderOffersPattern(id)));
    delete(CacheKeys.competitiveAnalysis(invoiceId));
    deletePattern(CacheKeys.marketplaceListingsPattern());
  }

  private void delete(String key) {
    try {
      cache.delete(key);
    } catch (RuntimeException e) {
      log.warn("Cache invalidation failed for key {}: {}", key, e.getMessage());
    }
  }

  private void deletePattern(String pattern) {
    try {
      cache.deleteByPattern(pattern);
    } catch (RuntimeException e) {
      log.warn("Cache invalidation failed for pattern {}: {}", pattern, e.getMessage());
    }
  }
}
