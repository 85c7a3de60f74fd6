package io.invoicemart.marketplace.cache;

/**
 * A held lock. {@code token} is unique per acquisition so a holder whose lock expired cannot
 * release a lock subsequently taken by someone else. A degraded lock was granted without the
 * backing store and releases as a no-op.
 */
public record DistributedLock(String key, String token, boolean degraded) {

  static DistributedLock degraded(String key) {
    return new DistributedLock(key, "DEGRADED", true);
  }
}
