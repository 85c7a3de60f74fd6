package io.invoicemart.marketplace.offer;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Comparator;

/**
 * Competitive ordering of offers on one invoice. The best offer has the lowest rate; ties go to
 * the larger amount, then to the earlier submission.
 */
public final class OfferRanking {

  public static final Comparator<Offer> BEST_FIRST =
      Comparator.comparing(Offer::getInterestRate)
          .thenComparing(Offer::getAmount, Comparator.reverseOrder())
          .thenComparing(Offer::getCreatedAt);

  private static final long AMOUNT_SLOTS = 1_000_000_000_000L;

  private OfferRanking() {}

  /** Whether {@code candidate} ranks strictly ahead of {@code reference} on rate and amount. */
  public static boolean isBetter(
      BigDecimal candidateRate,
      BigDecimal candidateAmount,
      BigDecimal referenceRate,
      BigDecimal referenceAmount) {
    int byRate = candidateRate.compareTo(referenceRate);
    return byRate < 0 || (byRate == 0 && candidateAmount.compareTo(referenceAmount) > 0);
  }

  /**
   * Position of an offer among {@code competitors} (which include it).
   *
   * @return rank starting at 1 and the share of other offers it beats, 100 when alone
   */
  public static MarketPosition position(
      BigDecimal rate, BigDecimal amount, Collection<? extends RankedBid> competitors) {
    long better =
        competitors.stream()
            .filter(c -> isBetter(c.interestRate(), c.amount(), rate, amount))
            .count();
    return MarketPosition.of(better, competitors.size());
  }

  /**
   * Sorted-set score encoding the rate-then-amount order in one double: lower is better. Rates
   * carry two decimals and amounts are in minor units below 10^12, so the encoding is exact.
   */
  public static double score(BigDecimal interestRate, BigDecimal amount) {
    long rateBasisPoints = interestRate.movePointRight(2).longValue();
    long amountMinor = Math.min(amount.movePointRight(2).longValue(), AMOUNT_SLOTS - 1);
    return (double) rateBasisPoints * AMOUNT_SLOTS + (AMOUNT_SLOTS - 1 - amountMinor);
  }

  /** The rate and amount of an offer, as seen in ranking inputs. */
  public interface RankedBid {

    BigDecimal interestRate();

    BigDecimal amount();
  }

  public record MarketPosition(
      long rank, long betterOffers, long totalOffers, int betterThanPercent) {

    static MarketPosition of(long better, long total) {
      int percent =
          total > 1 ? (int) Math.round((double) (total - better - 1) / (total - 1) * 100) : 100;
      return new MarketPosition(better + 1, better, total, percent);
    }
  }
}
