package io.invoicemart.marketplace.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.UUID;

/**
 * Cache key and pattern layout. Keys for filtered projections embed a deterministic hash of the
 * full filter and pagination tuple, so equal queries always share one entry.
 */
public final class CacheKeys {

  public static final String TRENDING_INVOICES = "trending:invoices";
  public static final String MARKETPLACE_ALL = "marketplace:*";

  private static final ObjectMapper CANONICAL =
      JsonMapper.builder()
          .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
          .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .addModule(new JavaTimeModule())
          .build();

  private CacheKeys() {}

  public static String invoiceDetail(UUID invoiceId) {
    return "invoice:details:" + invoiceId;
  }

  public static String sellerInvoices(UUID sellerId, Object query) {
    return "invoice:seller:" + sellerId + ":" + hash(query);
  }

  public static String sellerInvoicesPattern(UUID sellerId) {
    return "invoice:seller:" + sellerId + ":*";
  }

  public static String anchorInvoices(UUID anchorId, Object query) {
    return "invoice:anchor:" + anchorId + ":" + hash(query);
  }

  public static String anchorInvoicesPattern(UUID anchorId) {
    return "invoice:anchor:" + anchorId + ":*";
  }

  public static String adminQueue(Object query) {
    return "invoice:admin:" + hash(query);
  }

  public static String adminQueuePattern() {
    return "invoice:admin:*";
  }

  public static String marketplaceListings(Object query) {
    return "marketplace:listings:" + hash(query);
  }

  public static String marketplaceListingsPattern() {
    return "marketplace:listings:*";
  }

  public static String marketplaceTrending(int limit) {
    return "marketplace:trending:" + limit;
  }

  public static String marketplaceTrendingPattern() {
    return "marketplace:trending:*";
  }

  public static String invoiceOffers(UUID invoiceId, Object query) {
    return "offers:invoice:" + invoiceId + ":" + hash(query);
  }

  public static String invoiceOffersPattern(UUID invoiceId) {
    return "offers:invoice:" + invoiceId + ":*";
  }

  public static String lenderOffers(UUID lenderId, Object query) {
    return "offers:lender:" + lenderId + ":" + hash(query);
  }

  public static String lenderOffersPattern(UUID lenderId) {
    return "offers:lender:" + lenderId + ":*";
  }

  public static String offerDetail(UUID offerId) {
    return "offer:details:" + offerId;
  }

  public static String competitiveAnalysis(UUID invoiceId) {
    return "competitive:analysis:" + invoiceId;
  }

  /** Sorted set of an invoice's pending offers scored by interest rate. */
  public static String competition(UUID invoiceId) {
    return "competition:" + invoiceId;
  }

  public static String invoiceLock(UUID invoiceId, String operation) {
    return "invoice:lock:" + invoiceId + ":" + operation;
  }

  public static String recomputeLock(String cacheKey) {
    return "cache:lock:" + cacheKey;
  }

  public static String userNotifications(UUID userId) {
    return "notifications:user:" + userId;
  }

  static String hash(Object query) {
    if (query == null) {
      return "all";
    }
    try {
      byte[] json = CANONICAL.writeValueAsString(query).getBytes(StandardCharsets.UTF_8);
      return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cache key query is not serializable", e);
    }
  }
}
