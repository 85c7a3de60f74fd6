package io.invoicemart.marketplace.offer;

import static io.invoicemart.marketplace.testutil.TestMarketplaceFactory.RATE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.invoicemart.marketplace.exception.BiddingConstraintException;
import io.invoicemart.marketplace.exception.ForbiddenException;
import io.invoicemart.marketplace.exception.InvalidRequestException;
import io.invoicemart.marketplace.exception.ResourceConflictException;
import io.invoicemart.marketplace.exception.ResourceNotFoundException;
import io.invoicemart.marketplace.invoice.Invoice;
import io.invoicemart.marketplace.invoice.InvoiceRepository;
import io.invoicemart.marketplace.notification.MarketplaceNotifier;
import io.invoicemart.marketplace.party.PartyRole;
import io.invoicemart.marketplace.testutil.TestMarketplaceFactory;
import io.invoicemart.marketplace.web.Actor;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class OfferServiceTest {

  @Mock private OfferRepository offerRepository;
  @Mock private InvoiceRepository invoiceRepository;
  @Mock private OfferCompetitionTracker competitionTracker;
  @Mock private MarketplaceNotifier notifier;
  @Mock private ApplicationEventPublisher eventPublisher;

  private final Instant now = Instant.now();
  private final UUID sellerId = UUID.randomUUID();
  private final UUID lenderId = UUID.randomUUID();

  private OfferService service;
  private Invoice invoice;

  @BeforeEach
  void setUp() {
    service =
        new OfferService(
            offerRepository,
            invoiceRepository,
            competitionTracker,
            notifier,
            eventPublisher,
            Clock.fixed(now, ZoneOffset.UTC));
    invoice = TestMarketplaceFactory.listedInvoice(sellerId, UUID.randomUUID(), UUID.randomUUID());
  }

  @Test
  void createOffer_validBid_savesAndNotifiesSeller() {
    stubInvoiceAndOwnOffers(List.of());
    when(offerRepository.findByInvoiceIdAndStatus(invoice.getId(), OfferStatus.PENDING))
        .thenReturn(List.of());
    stubSave();

    var offer = createOffer(new BigDecimal("80"), null);

    assertThat(offer.getStatus()).isEqualTo(OfferStatus.PENDING);
    assertThat(offer.getAmount()).isEqualByComparingTo("80000.00");
    assertThat(offer.getExpiresAt()).isEqualTo(now.plus(BiddingRules.DEFAULT_OFFER_EXPIRY));
    verify(notifier).newOffer(invoice, offer);
    verify(notifier, never()).multipleOffers(any(), anyLong());

    var captor = ArgumentCaptor.forClass(OfferChangedEvent.class);
    verify(eventPublisher).publishEvent(captor.capture());
    assertThat(captor.getValue().type()).isEqualTo(OfferEventType.CREATED);
    assertThat(captor.getValue().offers())
        .extracting(OfferSnapshot::offerId)
        .containsExactly(offer.getId());
  }

  @Test
  void createOffer_invoiceMissing_throwsNotFound() {
    var invoiceId = UUID.randomUUID();
    when(invoiceRepository.findByIdForShare(invoiceId)).thenReturn(Optional.empty());

    assertThatThrownBy(
            () ->
                service.createOffer(
                    lenderId, invoiceId, RATE, new BigDecimal("50"), 30, null, null, null))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void createOffer_rateMismatch_savesNothing() {
    when(invoiceRepository.findByIdForShare(invoice.getId())).thenReturn(Optional.of(invoice));

    assertThatThrownBy(
            () ->
                service.createOffer(
                    lenderId,
                    invoice.getId(),
                    new BigDecimal("9"),
                    new BigDecimal("50"),
                    30,
                    null,
                    null,
                    null))
        .isInstanceOf(BiddingConstraintException.class);
    verify(offerRepository, never()).saveAndFlush(any());
  }

  @Test
  void createOffer_expiryInPast_throwsInvalidRequest() {
    when(invoiceRepository.findByIdForShare(invoice.getId())).thenReturn(Optional.of(invoice));

    assertThatThrownBy(() -> createOffer(new BigDecimal("50"), now.minusSeconds(1)))
        .isInstanceOf(InvalidRequestException.class);
    verify(offerRepository, never()).saveAndFlush(any());
  }

  @Test
  void createOffer_activeOwnOffer_throwsDuplicate() {
    var existing = lenderOffer("50");
    stubInvoiceAndOwnOffers(List.of(existing));

    assertThatThrownBy(() -> createOffer(new BigDecimal("60"), null))
        .isInstanceOf(ResourceConflictException.class)
        .hasMessageContaining("already have an active offer");
    verify(offerRepository, never()).saveAndFlush(any());
  }

  @Test
  void createOffer_staleOwnOffer_isExpiredBeforeNewOfferIsPlaced() {
    var stale =
        TestMarketplaceFactory.pendingOffer(
            invoice, lenderId, new BigDecimal("50"), 30, now.minus(Duration.ofDays(3)));
    stubInvoiceAndOwnOffers(List.of(stale));
    when(offerRepository.findByInvoiceIdAndStatus(invoice.getId(), OfferStatus.PENDING))
        .thenReturn(List.of());
    stubSave();

    createOffer(new BigDecimal("60"), null);

    assertThat(stale.getStatus()).isEqualTo(OfferStatus.EXPIRED);
    verify(offerRepository).saveAll(List.of(stale));
    var captor = ArgumentCaptor.forClass(OfferChangedEvent.class);
    verify(eventPublisher, times(2)).publishEvent(captor.capture());
    assertThat(captor.getAllValues())
        .extracting(OfferChangedEvent::type)
        .containsExactly(OfferEventType.EXPIRED, OfferEventType.CREATED);
  }

  @Test
  void createOffer_outranksCompetitor_alertsOnlyOutrankedLenders() {
    var weaker =
        TestMarketplaceFactory.pendingOffer(
            invoice, UUID.randomUUID(), new BigDecimal("50"), 30, now.minusSeconds(120));
    var stronger =
        TestMarketplaceFactory.pendingOffer(
            invoice, UUID.randomUUID(), new BigDecimal("90"), 30, now.minusSeconds(60));
    stubInvoiceAndOwnOffers(List.of());
    when(offerRepository.findByInvoiceIdAndStatus(invoice.getId(), OfferStatus.PENDING))
        .thenReturn(List.of(weaker, stronger));
    stubSave();

    var offer = createOffer(new BigDecimal("80"), null);

    verify(notifier).multipleOffers(invoice, 3);
    verify(notifier).competitiveAlert(invoice, OfferSnapshot.of(weaker), offer);
    verify(notifier, never()).competitiveAlert(eq(invoice), eq(OfferSnapshot.of(stronger)), any());
  }

  @Test
  void createOffer_expiredCompetitorsAreIgnored() {
    var expired =
        TestMarketplaceFactory.pendingOffer(
            invoice, UUID.randomUUID(), new BigDecimal("10"), 30, now.minus(Duration.ofDays(5)));
    stubInvoiceAndOwnOffers(List.of());
    when(offerRepository.findByInvoiceIdAndStatus(invoice.getId(), OfferStatus.PENDING))
        .thenReturn(List.of(expired));
    stubSave();

    createOffer(new BigDecimal("80"), null);

    verify(notifier, never()).multipleOffers(any(), anyLong());
    verify(notifier, never()).competitiveAlert(any(), any(), any());
  }

  @Test
  void withdrawOffer_byOtherLender_throwsForbidden() {
    var offer = lenderOffer("50");
    when(offerRepository.findById(offer.getId())).thenReturn(Optional.of(offer));

    assertThatThrownBy(() -> service.withdrawOffer(UUID.randomUUID(), offer.getId(), null))
        .isInstanceOf(ForbiddenException.class);
    assertThat(offer.getStatus()).isEqualTo(OfferStatus.PENDING);
  }

  @Test
  void withdrawOffer_byOwner_notifiesSellerAndPublishes() {
    var offer = lenderOffer("50");
    when(offerRepository.findById(offer.getId())).thenReturn(Optional.of(offer));
    when(offerRepository.save(offer)).thenReturn(offer);
    when(invoiceRepository.findById(invoice.getId())).thenReturn(Optional.of(invoice));

    service.withdrawOffer(lenderId, offer.getId(), "Funds reallocated");

    assertThat(offer.getStatus()).isEqualTo(OfferStatus.WITHDRAWN);
    verify(notifier).offerWithdrawn(invoice, offer);
    var captor = ArgumentCaptor.forClass(OfferChangedEvent.class);
    verify(eventPublisher).publishEvent(captor.capture());
    assertThat(captor.getValue().type()).isEqualTo(OfferEventType.WITHDRAWN);
  }

  @Test
  void rejectOffer_byOtherSeller_throwsForbidden() {
    var offer = lenderOffer("50");
    when(offerRepository.findById(offer.getId())).thenReturn(Optional.of(offer));
    when(invoiceRepository.findById(invoice.getId())).thenReturn(Optional.of(invoice));

    assertThatThrownBy(() -> service.rejectOffer(UUID.randomUUID(), offer.getId(), "No"))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void rejectOffer_bySeller_notifiesLender() {
    var offer = lenderOffer("50");
    when(offerRepository.findById(offer.getId())).thenReturn(Optional.of(offer));
    when(invoiceRepository.findById(invoice.getId())).thenReturn(Optional.of(invoice));
    when(offerRepository.save(offer)).thenReturn(offer);

    service.rejectOffer(sellerId, offer.getId(), "Amount too low");

    assertThat(offer.getStatus()).isEqualTo(OfferStatus.REJECTED);
    verify(notifier).offerRejected(eq(invoice), any(OfferSnapshot.class), eq("Amount too low"));
  }

  @Test
  void getOffer_unrelatedLender_throwsForbidden() {
    var offer = lenderOffer("50");
    when(offerRepository.findById(offer.getId())).thenReturn(Optional.of(offer));

    assertThatThrownBy(
            () -> service.getOffer(new Actor(UUID.randomUUID(), PartyRole.LENDER), offer.getId()))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void getOffer_sellerAndAdmin_canView() {
    var offer = lenderOffer("50");
    when(offerRepository.findById(offer.getId())).thenReturn(Optional.of(offer));

    assertThat(service.getOffer(new Actor(sellerId, PartyRole.SELLER), offer.getId()))
        .isSameAs(offer);
    assertThat(service.getOffer(new Actor(UUID.randomUUID(), PartyRole.ADMIN), offer.getId()))
        .isSameAs(offer);
  }

  @Test
  void position_trackerPopulated_usesTrackedCount() {
    var mine = lenderOffer("80");
    var other =
        TestMarketplaceFactory.pendingOffer(
            invoice, UUID.randomUUID(), new BigDecimal("90"), 30, now);
    when(offerRepository.findByInvoiceIdAndStatus(invoice.getId(), OfferStatus.PENDING))
        .thenReturn(List.of(mine, other));
    when(competitionTracker.outbidBy(invoice.getId(), mine.getInterestRate(), mine.getAmount()))
        .thenReturn(OptionalLong.of(1));

    var position = service.position(mine);

    assertThat(position.rank()).isEqualTo(2);
    assertThat(position.totalOffers()).isEqualTo(2);
  }

  @Test
  void position_trackerUnavailable_ranksFromDatabase() {
    var mine = lenderOffer("90");
    var other =
        TestMarketplaceFactory.pendingOffer(
            invoice, UUID.randomUUID(), new BigDecimal("80"), 30, now);
    when(offerRepository.findByInvoiceIdAndStatus(invoice.getId(), OfferStatus.PENDING))
        .thenReturn(List.of(mine, other));
    when(competitionTracker.outbidBy(any(), any(), any())).thenReturn(OptionalLong.empty());

    var position = service.position(mine);

    assertThat(position.rank()).isEqualTo(1);
    assertThat(position.betterThanPercent()).isEqualTo(100);
  }

  private Offer createOffer(BigDecimal percentage, Instant expiry) {
    return service.createOffer(
        lenderId, invoice.getId(), RATE, percentage, 30, "Standard terms", null, expiry);
  }

  private Offer lenderOffer(String percentage) {
    return TestMarketplaceFactory.pendingOffer(
        invoice, lenderId, new BigDecimal(percentage), 30, now);
  }

  private void stubInvoiceAndOwnOffers(List<Offer> ownPending) {
    when(invoiceRepository.findByIdForShare(invoice.getId())).thenReturn(Optional.of(invoice));
    when(offerRepository.findByInvoiceIdAndLenderIdAndStatus(
            invoice.getId(), lenderId, OfferStatus.PENDING))
        .thenReturn(ownPending);
  }

  private void stubSave() {
    when(offerRepository.saveAndFlush(any(Offer.class)))
        .thenAnswer(
            invocation -> {
              Offer offer = invocation.getArgument(0);
              ReflectionTestUtils.setField(offer, "id", UUID.randomUUID());
              return offer;
            });
  }
}
