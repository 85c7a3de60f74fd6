package io.invoicemart.marketplace.cache;

import static org.assertj.core.api.Assertions.assertThat;

import io.invoicemart.marketplace.config.CacheProperties;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CacheInvalidatorTest {

  private static final Duration TTL = Duration.ofMinutes(10);

  private final UUID invoiceId = UUID.randomUUID();
  private final UUID sellerId = UUID.randomUUID();
  private final UUID anchorId = UUID.randomUUID();

  private InMemoryMarketplaceCache cache;
  private CacheInvalidator invalidator;

  @BeforeEach
  void setUp() {
    cache = new InMemoryMarketplaceCache();
    invalidator = new CacheInvalidator(cache, CacheProperties.defaults());
  }

  @Test
  void invoiceChanged_listingUnaffected_keepsMarketplaceEntries() {
    var detail = put(CacheKeys.invoiceDetail(invoiceId));
    var sellerList = put(CacheKeys.sellerInvoices(sellerId, null));
    var otherSeller = put(CacheKeys.sellerInvoices(UUID.randomUUID(), null));
    var anchorList = put(CacheKeys.anchorInvoices(anchorId, null));
    var adminQueue = put(CacheKeys.adminQueue("ANCHOR_APPROVED"));
    var listings = put(CacheKeys.marketplaceListings(null));

    invalidator.invoiceChanged(invoiceId, sellerId, anchorId, false);

    assertGone(detail, sellerList, anchorList, adminQueue);
    assertPresent(otherSeller, listings);
  }

  @Test
  void invoiceChanged_listingAffected_clearsMarketplaceViews() {
    var listings = put(CacheKeys.marketplaceListings(null));
    var trending = put(CacheKeys.marketplaceTrending(10));
    var analysis = put(CacheKeys.competitiveAnalysis(invoiceId));

    invalidator.invoiceChanged(invoiceId, sellerId, anchorId, true);

    assertGone(listings, trending, analysis);
  }

  @Test
  void offersChanged_clearsOfferViewsForInvolvedLenders() {
    var offerId = UUID.randomUUID();
    var lenderId = UUID.randomUUID();
    var offerDetail = put(CacheKeys.offerDetail(offerId));
    var invoiceOffers = put(CacheKeys.invoiceOffers(invoiceId, null));
    var portfolio = put(CacheKeys.lenderOffers(lenderId, null));
    var bystander = put(CacheKeys.lenderOffers(UUID.randomUUID(), null));
    var listings = put(CacheKeys.marketplaceListings(null));

    invalidator.offersChanged(invoiceId, List.of(offerId), List.of(lenderId));

    assertGone(offerDetail, invoiceOffers, portfolio, listings);
    assertPresent(bystander);
  }

  @Test
  void invoiceChanged_cachingDisabled_touchesNothing() {
    var disabled =
        new CacheInvalidator(
            cache, new CacheProperties(false, "memory", null, null, null, null, null, null));
    var detail = put(CacheKeys.invoiceDetail(invoiceId));

    disabled.invoiceChanged(invoiceId, sellerId, anchorId, true);

    assertPresent(detail);
  }

  private String put(String key) {
    cache.set(key, "{}", TTL);
    return key;
  }

  private void assertGone(String... keys) {
    for (String key : keys) {
      assertThat(cache.get(key)).as(key).isEmpty();
    }
  }

  private void assertPresent(String... keys) {
    for (String key : keys) {
      assertThat(cache.get(key)).as(key).isPresent();
    }
  }
}
