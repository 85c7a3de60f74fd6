package io.invoicemart.marketplace.document;

import java.time.Instant;

/** Represents a time-limited presigned URL for a stored document. */
public record PresignedUrl(String url, Instant expiresAt) {}
