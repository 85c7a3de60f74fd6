package io.invoicemart.marketplace.marketplace.dto;

import java.math.BigDecimal;
import java.util.UUID;

/** Optional narrowing of the marketplace browse. Null fields do not filter. */
public record MarketplaceFilter(
    BigDecimal minAmount,
    BigDecimal maxAmount,
    Integer minDaysUntilDue,
    Integer maxDaysUntilDue,
    UUID anchorId,
    String currency) {}
