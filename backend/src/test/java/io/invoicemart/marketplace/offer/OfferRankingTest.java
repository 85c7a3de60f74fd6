package io.invoicemart.marketplace.offer;

import static io.invoicemart.marketplace.testutil.TestMarketplaceFactory.RATE;
import static org.assertj.core.api.Assertions.assertThat;

import io.invoicemart.marketplace.testutil.TestMarketplaceFactory;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class OfferRankingTest {

  private record Bid(BigDecimal interestRate, BigDecimal amount)
      implements OfferRanking.RankedBid {

    static Bid of(String rate, String amount) {
      return new Bid(new BigDecimal(rate), new BigDecimal(amount));
    }
  }

  @Test
  void isBetter_lowerRateWins() {
    assertThat(
            OfferRanking.isBetter(
                new BigDecimal("10"), new BigDecimal("100"),
                new BigDecimal("12"), new BigDecimal("900")))
        .isTrue();
  }

  @Test
  void isBetter_sameRateLargerAmountWins() {
    assertThat(
            OfferRanking.isBetter(
                RATE, new BigDecimal("90000"), new BigDecimal("12"), new BigDecimal("80000")))
        .isTrue();
    assertThat(
            OfferRanking.isBetter(
                RATE, new BigDecimal("80000"), RATE, new BigDecimal("90000")))
        .isFalse();
  }

  @Test
  void isBetter_identicalBids_neitherWins() {
    assertThat(OfferRanking.isBetter(RATE, new BigDecimal("500"), RATE, new BigDecimal("500")))
        .isFalse();
  }

  @Test
  void position_loneOffer_ranksFirstAndBeatsAll() {
    var only = Bid.of("12", "50000");

    var position = OfferRanking.position(only.interestRate(), only.amount(), List.of(only));

    assertThat(position.rank()).isEqualTo(1);
    assertThat(position.totalOffers()).isEqualTo(1);
    assertThat(position.betterThanPercent()).isEqualTo(100);
  }

  @Test
  void position_amongCompetitors_countsStrictlyBetterOffers() {
    var best = Bid.of("10", "50000");
    var middle = Bid.of("12", "90000");
    var worst = Bid.of("12", "80000");
    var all = List.of(best, middle, worst);

    var first = OfferRanking.position(best.interestRate(), best.amount(), all);
    var second = OfferRanking.position(middle.interestRate(), middle.amount(), all);
    var third = OfferRanking.position(worst.interestRate(), worst.amount(), all);

    assertThat(first.rank()).isEqualTo(1);
    assertThat(first.betterThanPercent()).isEqualTo(100);
    assertThat(second.rank()).isEqualTo(2);
    assertThat(second.betterOffers()).isEqualTo(1);
    assertThat(second.betterThanPercent()).isEqualTo(50);
    assertThat(third.rank()).isEqualTo(3);
    assertThat(third.betterThanPercent()).isZero();
  }

  @Test
  void score_ordersLikeIsBetter() {
    double lowRate = OfferRanking.score(new BigDecimal("9.99"), new BigDecimal("1000"));
    double highRateBigAmount =
        OfferRanking.score(new BigDecimal("10.00"), new BigDecimal("999999"));
    double sameRateLarger = OfferRanking.score(RATE, new BigDecimal("90000.01"));
    double sameRateSmaller = OfferRanking.score(RATE, new BigDecimal("90000.00"));

    assertThat(lowRate).isLessThan(highRateBigAmount);
    assertThat(sameRateLarger).isLessThan(sameRateSmaller);
    assertThat(OfferRanking.score(RATE, new BigDecimal("90000.00"))).isEqualTo(sameRateSmaller);
  }

  @Test
  void bestFirst_sortsByAmountThenSubmissionWhenRatesAreFixed() {
    var invoice =
        TestMarketplaceFactory.listedInvoice(
            UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());
    var t0 = Instant.parse("2026-01-01T10:00:00Z");
    var small =
        TestMarketplaceFactory.pendingOffer(
            invoice, UUID.randomUUID(), new BigDecimal("40"), 30, t0);
    var largeLate =
        TestMarketplaceFactory.pendingOffer(
            invoice, UUID.randomUUID(), new BigDecimal("80"), 30, t0.plusSeconds(60));
    var largeEarly =
        TestMarketplaceFactory.pendingOffer(
            invoice, UUID.randomUUID(), new BigDecimal("80"), 30, t0);

    var offers = new ArrayList<>(List.of(small, largeLate, largeEarly));
    offers.sort(OfferRanking.BEST_FIRST);

    assertThat(offers).containsExactly(largeEarly, largeLate, small);
  }
}
