package io.invoicemart.marketplace.notification.email;

public record SendResult(boolean success, String providerMessageId, String errorMessage) {}
