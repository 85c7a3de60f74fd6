package io.invoicemart.marketplace.invoice;

import java.util.List;
import java.util.UUID;

/** Stored objects no longer referenced once the publishing transaction commits. */
public record DocumentsDiscardedEvent(UUID invoiceId, List<String> storageKeys) {}
