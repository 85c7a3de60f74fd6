package io.invoicemart.marketplace.cache;

public record ScoredMember(String member, double score) {}
