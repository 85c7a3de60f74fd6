package io.invoicemart.marketplace.offer;

import static io.invoicemart.marketplace.testutil.TestMarketplaceFactory.RATE;
import static io.invoicemart.marketplace.testutil.TestMarketplaceFactory.today;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.invoicemart.marketplace.TestcontainersConfiguration;
import io.invoicemart.marketplace.invoice.Invoice;
import io.invoicemart.marketplace.invoice.InvoiceRepository;
import io.invoicemart.marketplace.testutil.TestMarketplaceFactory;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles({"test", "memory"})
@Testcontainers(disabledWithoutDocker = true)
class OfferRepositoryIntegrationTest {

  private static final String REASON = "Another offer was accepted";

  @Autowired private OfferRepository offerRepository;
  @Autowired private InvoiceRepository invoiceRepository;
  @Autowired private TransactionTemplate transactionTemplate;

  private final UUID sellerId = UUID.randomUUID();
  private final UUID anchorId = UUID.randomUUID();
  private final UUID adminId = UUID.randomUUID();

  // Postgres keeps microseconds; truncate so reloaded instants compare equal
  private final Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);

  private Invoice invoice;

  @BeforeEach
  void persistListedInvoice() {
    invoice =
        invoiceRepository.save(
            TestMarketplaceFactory.unsavedListedInvoice(sellerId, anchorId, adminId));
  }

  @Test
  void rejectPendingSiblings_rejectsOtherPendingOffersOnly() {
    var accepted = offerRepository.save(pending(UUID.randomUUID(), "80"));
    var first = offerRepository.save(pending(UUID.randomUUID(), "70"));
    var second = offerRepository.save(pending(UUID.randomUUID(), "60"));
    var withdrawn = pending(UUID.randomUUID(), "50");
    withdrawn.withdraw("Changed my mind", now);
    withdrawn = offerRepository.save(withdrawn);
    var otherInvoice =
        invoiceRepository.save(
            TestMarketplaceFactory.unsavedListedInvoice(sellerId, anchorId, adminId));
    var elsewhere = offerRepository.save(pendingOn(otherInvoice, UUID.randomUUID(), "80"));

    int rejected =
        transactionTemplate.execute(
            tx -> {
              var offer = offerRepository.findById(accepted.getId()).orElseThrow();
              offer.accept(null, now);
              return offerRepository.rejectPendingSiblings(
                  invoice.getId(), accepted.getId(), REASON, now);
            });

    assertThat(rejected).isEqualTo(2);
    assertThat(reload(accepted).getStatus()).isEqualTo(OfferStatus.ACCEPTED);
    for (Offer sibling : List.of(first, second)) {
      var reloaded = reload(sibling);
      assertThat(reloaded.getStatus()).isEqualTo(OfferStatus.REJECTED);
      assertThat(reloaded.getRejectionReason()).isEqualTo(REASON);
      assertThat(reloaded.getRejectedAt()).isEqualTo(now);
      assertThat(reloaded.getVersion()).isEqualTo(sibling.getVersion() + 1);
    }
    assertThat(reload(withdrawn).getStatus()).isEqualTo(OfferStatus.WITHDRAWN);
    assertThat(reload(elsewhere).getStatus()).isEqualTo(OfferStatus.PENDING);
    assertThat(offerRepository.countByInvoiceIdAndStatus(invoice.getId(), OfferStatus.PENDING))
        .isZero();
  }

  @Test
  void activeLenderIndex_secondPendingOfferFromSameLender_isRejected() {
    var lenderId = UUID.randomUUID();
    offerRepository.saveAndFlush(pending(lenderId, "80"));

    assertThatThrownBy(() -> offerRepository.saveAndFlush(pending(lenderId, "70")))
        .isInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void activeLenderIndex_allowsNewOfferOnceEarlierOneIsWithdrawn() {
    var lenderId = UUID.randomUUID();
    var earlier = pending(lenderId, "80");
    earlier.withdraw(null, now);
    offerRepository.saveAndFlush(earlier);

    var replacement = offerRepository.saveAndFlush(pending(lenderId, "70"));

    assertThat(replacement.getId()).isNotNull();
  }

  @Test
  void acceptedInvoiceIndex_secondAcceptedOfferOnInvoice_isRejected() {
    var first = pending(UUID.randomUUID(), "80");
    first.accept(null, now);
    offerRepository.saveAndFlush(first);
    var second = pending(UUID.randomUUID(), "70");
    second.accept(null, now);

    assertThatThrownBy(() -> offerRepository.saveAndFlush(second))
        .isInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void summarizeActiveOffers_countsOnlyUnexpiredPendingOffers() {
    offerRepository.save(pending(UUID.randomUUID(), "80"));
    offerRepository.save(pending(UUID.randomUUID(), "60"));
    var lapsed = offerRepository.save(expiringAt(now.minus(Duration.ofHours(1))));
    var withdrawn = pending(UUID.randomUUID(), "50");
    withdrawn.withdraw(null, now);
    offerRepository.save(withdrawn);

    List<Object[]> summary = offerRepository.summarizeActiveOffers(List.of(invoice.getId()), now);

    assertThat(summary).hasSize(1);
    assertThat(summary.get(0)[0]).isEqualTo(invoice.getId());
    assertThat(summary.get(0)[1]).isEqualTo(2L);
    assertThat((BigDecimal) summary.get(0)[2]).isEqualByComparingTo(RATE);
    assertThat(reload(lapsed).getStatus()).isEqualTo(OfferStatus.PENDING);
  }

  @Test
  void findInvoicesWithActiveOfferFrom_returnsInvoicesWhereLenderIsBidding() {
    var lenderId = UUID.randomUUID();
    offerRepository.save(pending(lenderId, "80"));
    var otherInvoice =
        invoiceRepository.save(
            TestMarketplaceFactory.unsavedListedInvoice(sellerId, anchorId, adminId));

    var ids =
        offerRepository.findInvoicesWithActiveOfferFrom(
            List.of(invoice.getId(), otherInvoice.getId()), lenderId, now);

    assertThat(ids).containsExactly(invoice.getId());
  }

  @Test
  void findByStatusAndExpiresAtBefore_returnsLapsedPendingOffers() {
    var lapsed = offerRepository.save(expiringAt(now.minus(Duration.ofMinutes(5))));
    offerRepository.save(pending(UUID.randomUUID(), "80"));

    var due =
        offerRepository.findByStatusAndExpiresAtBefore(
            OfferStatus.PENDING, now, Pageable.ofSize(500));

    assertThat(due).extracting(Offer::getId).contains(lapsed.getId());
    assertThat(due).allMatch(o -> o.getExpiresAt().isBefore(now));
  }

  private Offer pending(UUID lenderId, String percentage) {
    return pendingOn(invoice, lenderId, percentage);
  }

  private Offer pendingOn(Invoice target, UUID lenderId, String percentage) {
    var quote = BiddingRules.evaluate(target, RATE, new BigDecimal(percentage), 30, today());
    return new Offer(
        target.getId(),
        sellerId,
        lenderId,
        quote,
        null,
        null,
        now.plus(BiddingRules.DEFAULT_OFFER_EXPIRY),
        now);
  }

  private Offer expiringAt(Instant expiresAt) {
    var quote = BiddingRules.evaluate(invoice, RATE, new BigDecimal("40"), 30, today());
    return new Offer(
        invoice.getId(),
        sellerId,
        UUID.randomUUID(),
        quote,
        null,
        null,
        expiresAt,
        expiresAt.minus(BiddingRules.DEFAULT_OFFER_EXPIRY));
  }

  private Offer reload(Offer offer) {
    return offerRepository.findById(offer.getId()).orElseThrow();
  }
}
