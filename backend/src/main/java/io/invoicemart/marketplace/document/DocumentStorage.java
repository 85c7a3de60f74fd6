package io.invoicemart.marketplace.document;

import java.time.Duration;

/**
 * Object storage for invoice documents. Domain services inject this interface instead of
 * vendor-specific clients.
 */
public interface DocumentStorage {

  StoredDocument upload(String key, byte[] content, String contentType);

  /** Best-effort; failures are logged, not thrown. */
  void delete(String key);

  /** Tags the object with the invoice's lifecycle stage. Best-effort. */
  void updateVisibility(String key, DocumentStage stage);

  PresignedUrl generateDownloadUrl(String key, Duration expiry);
}
