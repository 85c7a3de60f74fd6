package io.invoicemart.marketplace.marketplace.dto;

import io.invoicemart.marketplace.offer.OfferRanking.MarketPosition;
import java.util.UUID;

/** Competitive analysis plus, for a lender holding an active offer, where that offer stands. */
public record CompetitionResponse(
    CompetitiveAnalysis analysis, UUID myOfferId, MarketPosition myPosition) {}
