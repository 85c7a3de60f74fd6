package io.invoicemart.marketplace.marketplace;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.invoicemart.marketplace.cache.DistributedLockService;
import io.invoicemart.marketplace.cache.InMemoryMarketplaceCache;
import io.invoicemart.marketplace.cache.ReadThroughCache;
import io.invoicemart.marketplace.config.CacheProperties;
import io.invoicemart.marketplace.exception.ForbiddenException;
import io.invoicemart.marketplace.invoice.Invoice;
import io.invoicemart.marketplace.invoice.InvoiceRepository;
import io.invoicemart.marketplace.marketplace.dto.PageQuery;
import io.invoicemart.marketplace.offer.Offer;
import io.invoicemart.marketplace.offer.OfferRepository;
import io.invoicemart.marketplace.offer.OfferService;
import io.invoicemart.marketplace.offer.OfferStatus;
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
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

@ExtendWith(MockitoExtension.class)
class MarketplaceQueryServiceTest {

  @Mock private InvoiceRepository invoiceRepository;
  @Mock private OfferRepository offerRepository;
  @Mock private OfferService offerService;

  private final Instant now = Instant.now();
  private final UUID sellerId = UUID.randomUUID();
  private final UUID anchorId = UUID.randomUUID();
  private final PageQuery firstPage = new PageQuery(0, 20, null, null);

  private ViewTracker viewTracker;
  private MarketplaceQueryService service;

  @BeforeEach
  void setUp() {
    var properties = CacheProperties.defaults();
    var store = new InMemoryMarketplaceCache();
    var cache =
        new ReadThroughCache(
            store,
            new DistributedLockService(store, properties),
            new ObjectMapper().registerModule(new JavaTimeModule()),
            properties);
    viewTracker = new ViewTracker(store, properties);
    service =
        new MarketplaceQueryService(
            invoiceRepository,
            offerRepository,
            offerService,
            cache,
            viewTracker,
            properties,
            Clock.fixed(now, ZoneOffset.UTC));
  }

  @Test
  void browseMarketplace_sharedListingCachedAndOfferFlagPerLender() {
    var first = listed();
    var second = listed();
    var lenderA = UUID.randomUUID();
    var lenderB = UUID.randomUUID();
    when(invoiceRepository.findListed(any(), any(), any(), any(), any(), any(), any(), any()))
        .thenReturn(new PageImpl<>(List.of(first, second), PageRequest.of(0, 20), 2));
    when(offerRepository.summarizeActiveOffers(anyCollection(), any()))
        .thenReturn(List.<Object[]>of(new Object[] {first.getId(), 2L, new BigDecimal("12.00")}));
    when(offerRepository.findInvoicesWithActiveOfferFrom(anyCollection(), eq(lenderA), any()))
        .thenReturn(List.of(first.getId()));
    when(offerRepository.findInvoicesWithActiveOfferFrom(anyCollection(), eq(lenderB), any()))
        .thenReturn(List.of());

    var forA = service.browseMarketplace(lenderA, null, firstPage);
    var forB = service.browseMarketplace(lenderB, null, firstPage);

    assertThat(forA.content()).hasSize(2);
    assertThat(forA.content().get(0).offerCount()).isEqualTo(2);
    assertThat(forA.content().get(0).bestRate()).isEqualByComparingTo("12.00");
    assertThat(forA.content().get(0).hasMyOffer()).isTrue();
    assertThat(forA.content().get(1).offerCount()).isZero();
    assertThat(forA.content().get(1).hasMyOffer()).isFalse();
    assertThat(forB.content()).noneMatch(listing -> listing.hasMyOffer());
    verify(invoiceRepository, times(1))
        .findListed(any(), any(), any(), any(), any(), any(), any(), any());
  }

  @Test
  void trending_noViews_fallsBackToNewestListings() {
    var newest = listed();
    when(invoiceRepository.findListed(any(), any(), any(), any(), any(), any(), any(), any()))
        .thenReturn(new PageImpl<>(List.of(newest)));

    var trending = service.trending(10);

    assertThat(trending).singleElement().satisfies(t -> {
      assertThat(t.invoice().id()).isEqualTo(newest.getId());
      assertThat(t.views()).isZero();
    });
  }

  @Test
  void trending_ordersByViewsAndSkipsInvoicesNoLongerListed() {
    var popular = listed();
    var quiet = listed();
    var withdrawn = TestMarketplaceFactory.draftInvoice(sellerId, anchorId);
    viewTracker.recordView(quiet.getId());
    viewTracker.recordView(popular.getId());
    viewTracker.recordView(popular.getId());
    viewTracker.recordView(withdrawn.getId());
    viewTracker.recordView(withdrawn.getId());
    viewTracker.recordView(withdrawn.getId());
    when(invoiceRepository.findAllById(any())).thenReturn(List.of(popular, quiet, withdrawn));

    var trending = service.trending(10);

    assertThat(trending)
        .extracting(t -> t.invoice().id())
        .containsExactly(popular.getId(), quiet.getId());
    assertThat(trending.get(0).views()).isEqualTo(2);
  }

  @Test
  void invoiceDetail_lenderOpeningListing_countsView() {
    var invoice = listed();
    when(invoiceRepository.findById(invoice.getId())).thenReturn(Optional.of(invoice));

    service.invoiceDetail(new Actor(UUID.randomUUID(), PartyRole.LENDER), invoice.getId());

    assertThat(viewTracker.mostViewed(5))
        .singleElement()
        .satisfies(member -> assertThat(member.member()).isEqualTo(invoice.getId().toString()));
  }

  @Test
  void invoiceDetail_otherSellersInvoice_forbidden() {
    var invoice = TestMarketplaceFactory.draftInvoice(sellerId, anchorId);
    when(invoiceRepository.findById(invoice.getId())).thenReturn(Optional.of(invoice));

    assertThatThrownBy(
            () ->
                service.invoiceDetail(
                    new Actor(UUID.randomUUID(), PartyRole.SELLER), invoice.getId()))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void invoiceOffers_lenderIsNotSeller_forbidden() {
    var invoice = listed();
    when(invoiceRepository.findById(invoice.getId())).thenReturn(Optional.of(invoice));
    var lender = new Actor(UUID.randomUUID(), PartyRole.LENDER);

    assertThatThrownBy(() -> service.invoiceOffers(lender, invoice.getId(), null, firstPage))
        .isInstanceOf(ForbiddenException.class)
        .hasMessageContaining("seller");
  }

  @Test
  void analyze_activeOffers_rankedWithStatistics() {
    var invoice = listed();
    var eighty = offer(invoice, "80", now);
    var ninety = offer(invoice, "90", now);
    var lapsed = offer(invoice, "85", now.minus(Duration.ofDays(3)));
    when(offerRepository.findByInvoiceIdAndStatus(invoice.getId(), OfferStatus.PENDING))
        .thenReturn(List.of(eighty, lapsed, ninety));

    var analysis = service.analyze(invoice.getId());

    assertThat(analysis.totalOffers()).isEqualTo(2);
    assertThat(analysis.minAmount()).isEqualByComparingTo("80000.00");
    assertThat(analysis.maxAmount()).isEqualByComparingTo("90000.00");
    assertThat(analysis.averageAmount()).isEqualByComparingTo("85000.00");
    assertThat(analysis.averageFundingPercentage()).isEqualByComparingTo("85.00");
    assertThat(analysis.minInterestRate()).isEqualByComparingTo("12.00");
    assertThat(analysis.topOffers())
        .extracting(top -> top.offerId())
        .containsExactly(ninety.getId(), eighty.getId());
    assertThat(analysis.topOffers().get(0).rank()).isEqualTo(1);
  }

  @Test
  void analyze_noOffers_emptyStatistics() {
    var invoiceId = UUID.randomUUID();
    when(offerRepository.findByInvoiceIdAndStatus(invoiceId, OfferStatus.PENDING))
        .thenReturn(List.of());

    var analysis = service.analyze(invoiceId);

    assertThat(analysis.totalOffers()).isZero();
    assertThat(analysis.averageInterestRate()).isNull();
    assertThat(analysis.topOffers()).isEmpty();
  }

  @Test
  void competition_sellerView_hasNoPosition() {
    var invoice = listed();
    when(invoiceRepository.findById(invoice.getId())).thenReturn(Optional.of(invoice));
    when(offerRepository.findByInvoiceIdAndStatus(invoice.getId(), OfferStatus.PENDING))
        .thenReturn(List.of(offer(invoice, "80", now)));

    var response = service.competition(new Actor(sellerId, PartyRole.SELLER), invoice.getId());

    assertThat(response.analysis().totalOffers()).isEqualTo(1);
    assertThat(response.myOfferId()).isNull();
    assertThat(response.myPosition()).isNull();
  }

  private Invoice listed() {
    return TestMarketplaceFactory.listedInvoice(sellerId, anchorId, UUID.randomUUID());
  }

  private static Offer offer(Invoice invoice, String percentage, Instant createdAt) {
    return TestMarketplaceFactory.pendingOffer(
        invoice, UUID.randomUUID(), new BigDecimal(percentage), 30, createdAt);
  }
}
