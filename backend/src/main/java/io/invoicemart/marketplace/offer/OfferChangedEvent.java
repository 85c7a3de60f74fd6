package io.invoicemart.marketplace.offer;

import java.util.List;
import java.util.UUID;

/** Published inside the transaction that changed the offers; handled after commit. */
public record OfferChangedEvent(
    OfferEventType type, UUID invoiceId, UUID sellerId, List<OfferSnapshot> offers) {}
