package io.invoicemart.marketplace.offer;

import io.invoicemart.marketplace.cache.CacheKeys;
import io.invoicemart.marketplace.cache.MarketplaceCache;
import io.invoicemart.marketplace.config.CacheProperties;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maintains the per-invoice sorted set of pending offers used for fast rank queries. The set is a
 * derived view: every method tolerates a missing or unreachable cache, and {@link #outbidBy}
 * returns empty so callers can fall back to the database.
 */
@Component
public class OfferCompetitionTracker {

  private static final Logger log = LoggerFactory.getLogger(OfferCompetitionTracker.class);

  static final Duration COMPETITION_TTL = Duration.ofDays(7);

  private final MarketplaceCache cache;
  private final boolean enabled;

  public OfferCompetitionTracker(MarketplaceCache cache, CacheProperties properties) {
    this.cache = cache;
    this.enabled = properties.enabled();
  }

  public void track(OfferSnapshot offer) {
    if (!enabled) {
      return;
    }
    String key = CacheKeys.competition(offer.invoiceId());
    try {
      cache.zAdd(
          key,
          offer.offerId().toString(),
          OfferRanking.score(offer.interestRate(), offer.amount()));
      cache.expire(key, COMPETITION_TTL);
    } catch (RuntimeException e) {
      log.warn("Could not track offer {} in {}: {}", offer.offerId(), key, e.getMessage());
    }
  }

  public void remove(UUID invoiceId, UUID offerId) {
    if (!enabled) {
      return;
    }
    try {
      cache.zRemove(CacheKeys.competition(invoiceId), offerId.toString());
    } catch (RuntimeException e) {
      log.warn("Could not untrack offer {}: {}", offerId, e.getMessage());
    }
  }

  /** Drops the whole set once bidding on the invoice is closed. */
  public void clear(UUID invoiceId) {
    if (!enabled) {
      return;
    }
    try {
      cache.delete(CacheKeys.competition(invoiceId));
    } catch (RuntimeException e) {
      log.warn("Could not clear competition set for {}: {}", invoiceId, e.getMessage());
    }
  }

  /**
   * Number of tracked offers ranking strictly ahead of a bid with this rate and amount.
   *
   * @return empty when the set is unavailable or has not been populated
   */
  public OptionalLong outbidBy(UUID invoiceId, BigDecimal interestRate, BigDecimal amount) {
    if (!enabled) {
      return OptionalLong.empty();
    }
    String key = CacheKeys.competition(invoiceId);
    try {
      if (cache.zCard(key) == 0) {
        return OptionalLong.empty();
      }
      double score = OfferRanking.score(interestRate, amount);
      return OptionalLong.of(cache.zCount(key, 0, score - 1));
    } catch (RuntimeException e) {
      log.warn("Rank lookup on {} failed: {}", key, e.getMessage());
      return OptionalLong.empty();
    }
  }
}
