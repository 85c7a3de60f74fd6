package io.invoicemart.marketplace.offer;

import static io.invoicemart.marketplace.testutil.TestMarketplaceFactory.RATE;
import static io.invoicemart.marketplace.testutil.TestMarketplaceFactory.today;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.invoicemart.marketplace.exception.BiddingConstraintException;
import io.invoicemart.marketplace.exception.ErrorKind;
import io.invoicemart.marketplace.invoice.Invoice;
import io.invoicemart.marketplace.invoice.MarketplaceFundingTerms;
import io.invoicemart.marketplace.testutil.TestMarketplaceFactory;
import java.math.BigDecimal;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class BiddingRulesTest {

  private final UUID sellerId = UUID.randomUUID();
  private final UUID anchorId = UUID.randomUUID();
  private final UUID adminId = UUID.randomUUID();

  private Invoice listed;

  @BeforeEach
  void setUp() {
    listed = TestMarketplaceFactory.listedInvoice(sellerId, anchorId, adminId);
  }

  @Test
  void evaluate_validBid_returnsDerivedFinancials() {
    var quote = BiddingRules.evaluate(listed, RATE, new BigDecimal("90"), 60, today());

    assertThat(quote.fundingAmount()).isEqualByComparingTo("90000.00");
    // 90000 * 12 * 60 / 36500
    assertThat(quote.totalInterestAmount()).isEqualByComparingTo("1775.34");
    assertThat(quote.totalRepaymentAmount()).isEqualByComparingTo("91775.34");
    assertThat(quote.dailyInterestRate()).isEqualByComparingTo("0.0003287671");
    assertThat(quote.tenure()).isEqualTo(60);
  }

  @Test
  void evaluate_rateWithDifferentScale_isAccepted() {
    var quote =
        BiddingRules.evaluate(listed, new BigDecimal("12"), new BigDecimal("50"), 30, today());

    assertThat(quote.fundingAmount()).isEqualByComparingTo("50000.00");
  }

  @Test
  void evaluate_invoiceNotListed_reportsNotAvailable() {
    var submitted = TestMarketplaceFactory.submittedInvoice(sellerId, anchorId);

    assertThatThrownBy(
            () -> BiddingRules.evaluate(submitted, RATE, new BigDecimal("50"), 30, today()))
        .isInstanceOfSatisfying(
            BiddingConstraintException.class,
            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVOICE_NOT_AVAILABLE));
  }

  @Test
  void evaluate_listedWithoutTerms_reportsTermsNotSet() {
    var invoice = TestMarketplaceFactory.listedInvoice(sellerId, anchorId, adminId);
    ReflectionTestUtils.setField(invoice, "fundingTerms", null);

    assertThatThrownBy(
            () -> BiddingRules.evaluate(invoice, RATE, new BigDecimal("50"), 30, today()))
        .isInstanceOfSatisfying(
            BiddingConstraintException.class,
            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.FUNDING_TERMS_NOT_SET));
  }

  @Test
  void evaluate_incompleteTerms_reportsTermsNotSet() {
    var invoice = TestMarketplaceFactory.listedInvoice(sellerId, anchorId, adminId);
    ReflectionTestUtils.setField(
        invoice, "fundingTerms", new MarketplaceFundingTerms(new BigDecimal("50000"), null, 30));

    assertThatThrownBy(
            () -> BiddingRules.evaluate(invoice, RATE, new BigDecimal("50"), 30, today()))
        .isInstanceOfSatisfying(
            BiddingConstraintException.class,
            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.FUNDING_TERMS_NOT_SET));
  }

  @Test
  void evaluate_differentRate_reportsMismatchWithRequiredRate() {
    assertThatThrownBy(
            () ->
                BiddingRules.evaluate(
                    listed, new BigDecimal("11.50"), new BigDecimal("50"), 30, today()))
        .isInstanceOfSatisfying(
            BiddingConstraintException.class,
            e -> {
              assertThat(e.getKind()).isEqualTo(ErrorKind.INTEREST_RATE_MISMATCH);
              assertThat(e.getBody().getProperties()).containsEntry("limit", RATE);
            });
  }

  @Test
  void evaluate_rateCheckedBeforeTenure() {
    assertThatThrownBy(
            () ->
                BiddingRules.evaluate(
                    listed, new BigDecimal("15"), new BigDecimal("99"), 300, today()))
        .isInstanceOfSatisfying(
            BiddingConstraintException.class,
            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INTEREST_RATE_MISMATCH));
  }

  @Test
  void evaluate_tenureAboveAdminCap_reportsLimit() {
    assertThatThrownBy(() -> BiddingRules.evaluate(listed, RATE, new BigDecimal("50"), 61, today()))
        .isInstanceOfSatisfying(
            BiddingConstraintException.class,
            e -> {
              assertThat(e.getKind()).isEqualTo(ErrorKind.TENURE_EXCEEDS_LIMIT);
              assertThat(e.getBody().getProperties()).containsEntry("limit", 60);
            });
  }

  @Test
  void evaluate_amountAboveCap_reportsMaxPercentage() {
    assertThatThrownBy(() -> BiddingRules.evaluate(listed, RATE, new BigDecimal("95"), 30, today()))
        .isInstanceOfSatisfying(
            BiddingConstraintException.class,
            e -> {
              assertThat(e.getKind()).isEqualTo(ErrorKind.FUNDING_AMOUNT_EXCEEDS_LIMIT);
              assertThat(e.getBody().getProperties()).containsEntry("maxAllowedPercentage", 90);
            });
  }

  @Test
  void maxTenure_keepsCollectionBufferBeforeDueDate() {
    assertThat(BiddingRules.maxTenure(90, 60)).isEqualTo(60);
    assertThat(BiddingRules.maxTenure(50, 60)).isEqualTo(36);
    assertThat(BiddingRules.maxTenure(20, null)).isEqualTo(6);
  }

  @Test
  void maxTenure_dueWithinBuffer_isZero() {
    assertThat(BiddingRules.maxTenure(10, 30)).isZero();
    assertThat(BiddingRules.maxTenure(-5, null)).isZero();
  }

  @Test
  void maxAllowedPercentage_roundsDown() {
    assertThat(BiddingRules.maxAllowedPercentage(new BigDecimal("66666"), new BigDecimal("100000")))
        .isEqualTo(66);
  }
}
