package io.invoicemart.marketplace.cache;

/** Handle for an active channel subscription. */
@FunctionalInterface
public interface CacheSubscription extends AutoCloseable {

  @Override
  void close();
}
