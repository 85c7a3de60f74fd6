package io.invoicemart.marketplace.cache;

import java.util.UUID;

/** Pub/sub channel names. */
public final class Channels {

  public static final String MARKETPLACE_UPDATES = "marketplace:updates";
  public static final String MARKETPLACE_OFFERS = "marketplace:offers";

  private Channels() {}

  public static String invoiceUpdates(UUID invoiceId) {
    return "invoice:" + invoiceId + ":updates";
  }

  public static String invoiceOffers(UUID invoiceId) {
    return "invoice:" + invoiceId + ":offers";
  }

  public static String offerUpdates(UUID offerId) {
    return "offer:" + offerId + ":updates";
  }

  public static String lenderOffers(UUID lenderId) {
    return "lender:" + lenderId + ":offers";
  }

  public static String userNotifications(UUID userId) {
    return "user:" + userId + ":notifications";
  }
}
