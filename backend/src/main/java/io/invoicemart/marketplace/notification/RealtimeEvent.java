package io.invoicemart.marketplace.notification;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Message broadcast on pub/sub channels. */
public record RealtimeEvent(
    String type, UUID entityId, Map<String, Object> data, Instant timestamp) {}
