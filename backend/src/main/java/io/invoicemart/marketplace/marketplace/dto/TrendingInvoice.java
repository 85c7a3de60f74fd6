package io.invoicemart.marketplace.marketplace.dto;

import io.invoicemart.marketplace.invoice.dto.InvoiceResponse;

public record TrendingInvoice(InvoiceResponse invoice, long views) {}
