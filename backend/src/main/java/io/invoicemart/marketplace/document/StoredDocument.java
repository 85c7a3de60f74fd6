package io.invoicemart.marketplace.document;

/** Result of an upload: where the object lives and what was stored. */
public record StoredDocument(String storageKey, String contentType, long sizeBytes) {}
