package io.invoicemart.marketplace.marketplace;

import com.fasterxml.jackson.core.type.TypeReference;
import io.invoicemart.marketplace.cache.CacheKeys;
import io.invoicemart.marketplace.cache.ReadThroughCache;
import io.invoicemart.marketplace.cache.ScoredMember;
import io.invoicemart.marketplace.config.CacheProperties;
import io.invoicemart.marketplace.exception.ForbiddenException;
import io.invoicemart.marketplace.exception.ResourceNotFoundException;
import io.invoicemart.marketplace.invoice.Invoice;
import io.invoicemart.marketplace.invoice.InvoiceRepository;
import io.invoicemart.marketplace.invoice.InvoiceStatus;
import io.invoicemart.marketplace.invoice.InvoiceVisibility;
import io.invoicemart.marketplace.invoice.dto.InvoiceResponse;
import io.invoicemart.marketplace.marketplace.dto.CompetitionResponse;
import io.invoicemart.marketplace.marketplace.dto.CompetitiveAnalysis;
import io.invoicemart.marketplace.marketplace.dto.CompetitiveAnalysis.TopOffer;
import io.invoicemart.marketplace.marketplace.dto.ListingView;
import io.invoicemart.marketplace.marketplace.dto.MarketplaceFilter;
import io.invoicemart.marketplace.marketplace.dto.PageQuery;
import io.invoicemart.marketplace.marketplace.dto.PortfolioResponse;
import io.invoicemart.marketplace.marketplace.dto.TrendingInvoice;
import io.invoicemart.marketplace.offer.Offer;
import io.invoicemart.marketplace.offer.OfferRanking;
import io.invoicemart.marketplace.offer.OfferRepository;
import io.invoicemart.marketplace.offer.OfferService;
import io.invoicemart.marketplace.offer.OfferStatus;
import io.invoicemart.marketplace.offer.dto.OfferResponse;
import io.invoicemart.marketplace.party.PartyRole;
import io.invoicemart.marketplace.web.Actor;
import io.invoicemart.marketplace.web.PageResponse;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Paged, filtered projections over invoices and offers, served through {@link ReadThroughCache}.
 * Cache keys cover the full filter and page tuple; writes invalidate them through {@code
 * CacheInvalidator}. Ownership checks run on every call, cached or not.
 */
@Service
public class MarketplaceQueryService {

  static final Set<String> LISTING_SORTS = Set.of("listedAt", "amount", "dueDate", "createdAt");
  static final Set<String> INVOICE_SORTS =
      Set.of("createdAt", "updatedAt", "amount", "dueDate", "submittedAt");
  static final int TOP_OFFERS = 5;
  static final int MAX_TRENDING = 50;

  private static final Sort BEST_FIRST =
      Sort.by(
          Sort.Order.asc("interestRate"), Sort.Order.desc("amount"), Sort.Order.asc("createdAt"));

  private static final TypeReference<PageResponse<InvoiceResponse>> INVOICE_PAGE =
      new TypeReference<>() {};
  private static final TypeReference<PageResponse<ListingView>> LISTING_PAGE =
      new TypeReference<>() {};
  private static final TypeReference<PageResponse<OfferResponse>> OFFER_PAGE =
      new TypeReference<>() {};
  private static final TypeReference<List<TrendingInvoice>> TRENDING = new TypeReference<>() {};

  private final InvoiceRepository invoiceRepository;
  private final OfferRepository offerRepository;
  private final OfferService offerService;
  private final ReadThroughCache cache;
  private final ViewTracker viewTracker;
  private final CacheProperties cacheProperties;
  private final Clock clock;

  public MarketplaceQueryService(
      InvoiceRepository invoiceRepository,
      OfferRepository offerRepository,
      OfferService offerService,
      ReadThroughCache cache,
      ViewTracker viewTracker,
      CacheProperties cacheProperties,
      Clock clock) {
    this.invoiceRepository = invoiceRepository;
    this.offerRepository = offerRepository;
    this.offerService = offerService;
    this.cache = cache;
    this.viewTracker = viewTracker;
    this.cacheProperties = cacheProperties;
    this.clock = clock;
  }

  // --- Marketplace (lenders) ---

  @Transactional(readOnly = true)
  public PageResponse<ListingView> browseMarketplace(
      UUID lenderId, MarketplaceFilter filter, PageQuery query) {
    var page =
        cache.get(
            CacheKeys.marketplaceListings(new ListingQuery(filter, query)),
            cacheProperties.marketplaceTtl(),
            LISTING_PAGE,
            () -> loadListings(filter, query));
    if (lenderId == null || page.content().isEmpty()) {
      return page;
    }
    var ids = page.content().stream().map(l -> l.invoice().id()).toList();
    var mine =
        new HashSet<>(
            offerRepository.findInvoicesWithActiveOfferFrom(ids, lenderId, clock.instant()));
    return new PageResponse<>(
        page.content().stream().map(l -> l.withMyOffer(mine.contains(l.invoice().id()))).toList(),
        page.page(),
        page.size(),
        page.totalElements(),
        page.totalPages(),
        page.hasNext(),
        page.hasPrevious());
  }

  /**
   * Most viewed listed invoices over the recent view window. Falls back to the newest listings
   * when no views have been recorded.
   */
  @Transactional(readOnly = true)
  public List<TrendingInvoice> trending(int limit) {
    int bounded = Math.max(1, Math.min(limit, MAX_TRENDING));
    return cache.get(
        CacheKeys.marketplaceTrending(bounded),
        cacheProperties.marketplaceTtl(),
        TRENDING,
        () -> loadTrending(bounded));
  }

  // --- Invoice detail and queues ---

  @Transactional(readOnly = true)
  public InvoiceResponse invoiceDetail(Actor actor, UUID invoiceId) {
    var invoice = visibleInvoice(actor, invoiceId);
    if (actor.is(PartyRole.LENDER) && invoice.status() == InvoiceStatus.LISTED) {
      viewTracker.recordView(invoiceId);
    }
    return invoice;
  }

  @Transactional(readOnly = true)
  public PageResponse<InvoiceResponse> sellerInvoices(
      UUID sellerId, InvoiceStatus status, PageQuery query) {
    return cache.get(
        CacheKeys.sellerInvoices(sellerId, new StatusQuery(status, query)),
        cacheProperties.listTtl(),
        INVOICE_PAGE,
        () ->
            toInvoicePage(
                invoiceRepository.findBySeller(
                    sellerId, status, query.toPageable(INVOICE_SORTS, "createdAt"))));
  }

  @Transactional(readOnly = true)
  public PageResponse<InvoiceResponse> anchorPendingInvoices(UUID anchorId, PageQuery query) {
    return cache.get(
        CacheKeys.anchorInvoices(anchorId, new StatusQuery(InvoiceStatus.SUBMITTED, query)),
        cacheProperties.listTtl(),
        INVOICE_PAGE,
        () ->
            toInvoicePage(
                invoiceRepository.findByAnchorIdAndStatus(
                    anchorId,
                    InvoiceStatus.SUBMITTED,
                    query.toPageable(INVOICE_SORTS, "submittedAt"))));
  }

  /** Admin work queues: ANCHOR_APPROVED awaiting verification, ADMIN_VERIFIED awaiting listing. */
  @Transactional(readOnly = true)
  public PageResponse<InvoiceResponse> adminQueue(InvoiceStatus status, PageQuery query) {
    return cache.get(
        CacheKeys.adminQueue(new StatusQuery(status, query)),
        cacheProperties.listTtl(),
        INVOICE_PAGE,
        () ->
            toInvoicePage(
                invoiceRepository.findByStatus(
                    status, query.toPageable(INVOICE_SORTS, "updatedAt"))));
  }

  // --- Offers ---

  /** Offers on one invoice, best first. Only the owning seller and admins may look. */
  @Transactional(readOnly = true)
  public PageResponse<OfferResponse> invoiceOffers(
      Actor actor, UUID invoiceId, OfferStatus status, PageQuery query) {
    var invoice = visibleInvoice(actor, invoiceId);
    if (!actor.is(PartyRole.ADMIN) && !invoice.sellerId().equals(actor.id())) {
      throw new ForbiddenException(
          "Cannot view offers", "Only the invoice's seller can view all of its offers");
    }
    return cache.get(
        CacheKeys.invoiceOffers(invoiceId, new OfferQuery(status, query)),
        cacheProperties.listTtl(),
        OFFER_PAGE,
        () -> {
          var pageable = query.toPageable(BEST_FIRST);
          Page<Offer> page =
              status == null
                  ? offerRepository.findByInvoiceId(invoiceId, pageable)
                  : offerRepository.findByInvoiceIdAndStatus(invoiceId, status, pageable);
          Instant now = clock.instant();
          return PageResponse.of(page, o -> OfferResponse.from(o, now));
        });
  }

  @Transactional(readOnly = true)
  public PortfolioResponse lenderPortfolio(UUID lenderId, OfferStatus status, PageQuery query) {
    return cache.get(
        CacheKeys.lenderOffers(lenderId, new OfferQuery(status, query)),
        cacheProperties.listTtl(),
        PortfolioResponse.class,
        () -> loadPortfolio(lenderId, status, query));
  }

  /**
   * Statistics over an invoice's active offers. A lender holding one of them also gets its market
   * position, computed fresh.
   */
  @Transactional(readOnly = true)
  public CompetitionResponse competition(Actor actor, UUID invoiceId) {
    visibleInvoice(actor, invoiceId);
    var analysis =
        cache.get(
            CacheKeys.competitiveAnalysis(invoiceId),
            cacheProperties.competitiveAnalysisTtl(),
            CompetitiveAnalysis.class,
            () -> analyze(invoiceId));

    if (!actor.is(PartyRole.LENDER)) {
      return new CompetitionResponse(analysis, null, null);
    }
    Instant now = clock.instant();
    return offerRepository
        .findByInvoiceIdAndLenderIdAndStatus(invoiceId, actor.id(), OfferStatus.PENDING)
        .stream()
        .filter(o -> o.isActive(now))
        .findFirst()
        .map(o -> new CompetitionResponse(analysis, o.getId(), offerService.position(o)))
        .orElseGet(() -> new CompetitionResponse(analysis, null, null));
  }

  // --- Loaders ---

  private PageResponse<ListingView> loadListings(MarketplaceFilter filter, PageQuery query) {
    LocalDate today = LocalDate.now(clock);
    var f = filter != null ? filter : new MarketplaceFilter(null, null, null, null, null, null);
    Page<Invoice> page =
        invoiceRepository.findListed(
            today,
            f.minAmount(),
            f.maxAmount(),
            f.minDaysUntilDue() != null ? today.plusDays(f.minDaysUntilDue()) : null,
            f.maxDaysUntilDue() != null ? today.plusDays(f.maxDaysUntilDue()) : null,
            f.anchorId(),
            f.currency(),
            query.toPageable(LISTING_SORTS, "listedAt"));

    Map<UUID, Object[]> summaries = new HashMap<>();
    var ids = page.getContent().stream().map(Invoice::getId).toList();
    if (!ids.isEmpty()) {
      for (Object[] row : offerRepository.summarizeActiveOffers(ids, clock.instant())) {
        summaries.put((UUID) row[0], row);
      }
    }
    return PageResponse.of(
        page,
        invoice -> {
          Object[] row = summaries.get(invoice.getId());
          long count = row != null ? ((Number) row[1]).longValue() : 0;
          BigDecimal bestRate = row != null ? (BigDecimal) row[2] : null;
          return new ListingView(InvoiceResponse.from(invoice, today), count, bestRate, false);
        });
  }

  private List<TrendingInvoice> loadTrending(int limit) {
    LocalDate today = LocalDate.now(clock);
    List<ScoredMember> viewed = viewTracker.mostViewed(limit * 2);
    if (viewed.isEmpty()) {
      return invoiceRepository
          .findListed(
              today,
              null,
              null,
              null,
              null,
              null,
              null,
              PageRequest.of(0, limit, Sort.by(Sort.Direction.DESC, "listedAt")))
          .stream()
          .map(i -> new TrendingInvoice(InvoiceResponse.from(i, today), 0))
          .toList();
    }

    var ids = viewed.stream().map(m -> UUID.fromString(m.member())).toList();
    Map<UUID, Invoice> invoices =
        invoiceRepository.findAllById(ids).stream()
            .collect(Collectors.toMap(Invoice::getId, Function.identity()));
    var result = new ArrayList<TrendingInvoice>();
    for (ScoredMember member : viewed) {
      Invoice invoice = invoices.get(UUID.fromString(member.member()));
      if (invoice != null && invoice.getStatus() == InvoiceStatus.LISTED) {
        result.add(
            new TrendingInvoice(InvoiceResponse.from(invoice, today), (long) member.score()));
      }
      if (result.size() == limit) {
        break;
      }
    }
    return result;
  }

  private PortfolioResponse loadPortfolio(UUID lenderId, OfferStatus status, PageQuery query) {
    Instant now = clock.instant();
    var page =
        offerRepository.findByLender(
            lenderId, status, query.toPageable(Sort.by(Sort.Direction.DESC, "createdAt")));

    Map<OfferStatus, Long> counts = new HashMap<>();
    BigDecimal totalFunded = BigDecimal.ZERO;
    for (Offer offer : offerRepository.findByLenderId(lenderId)) {
      counts.merge(offer.getStatus(), 1L, Long::sum);
      if (offer.getStatus() == OfferStatus.ACCEPTED) {
        totalFunded = totalFunded.add(offer.getAmount());
      }
    }
    var summary =
        new PortfolioResponse.Summary(
            counts.getOrDefault(OfferStatus.PENDING, 0L),
            counts.getOrDefault(OfferStatus.ACCEPTED, 0L),
            counts.getOrDefault(OfferStatus.REJECTED, 0L),
            counts.getOrDefault(OfferStatus.WITHDRAWN, 0L),
            counts.getOrDefault(OfferStatus.EXPIRED, 0L),
            totalFunded);
    return new PortfolioResponse(PageResponse.of(page, o -> OfferResponse.from(o, now)), summary);
  }

  CompetitiveAnalysis analyze(UUID invoiceId) {
    Instant now = clock.instant();
    List<Offer> active =
        offerRepository.findByInvoiceIdAndStatus(invoiceId, OfferStatus.PENDING).stream()
            .filter(o -> o.isActive(now))
            .sorted(OfferRanking.BEST_FIRST)
            .toList();
    if (active.isEmpty()) {
      return new CompetitiveAnalysis(
          invoiceId, 0, null, null, null, null, null, null, null, null, List.of());
    }

    var top = new ArrayList<TopOffer>();
    for (int i = 0; i < Math.min(TOP_OFFERS, active.size()); i++) {
      Offer o = active.get(i);
      top.add(
          new TopOffer(
              i + 1,
              o.getId(),
              o.getAmount(),
              o.getInterestRate(),
              o.getFundingPercentage(),
              o.getTenure(),
              o.getCreatedAt()));
    }
    return new CompetitiveAnalysis(
        invoiceId,
        active.size(),
        min(active, Offer::getInterestRate),
        max(active, Offer::getInterestRate),
        average(active, Offer::getInterestRate),
        min(active, Offer::getAmount),
        max(active, Offer::getAmount),
        average(active, Offer::getAmount),
        average(active, Offer::getFundingPercentage),
        max(active, Offer::getFundingPercentage),
        List.copyOf(top));
  }

  // --- Helpers ---

  private InvoiceResponse visibleInvoice(Actor actor, UUID invoiceId) {
    var invoice =
        cache.get(
            CacheKeys.invoiceDetail(invoiceId),
            cacheProperties.invoiceDetailTtl(),
            InvoiceResponse.class,
            () ->
                invoiceRepository
                    .findById(invoiceId)
                    .map(i -> InvoiceResponse.from(i, LocalDate.now(clock)))
                    .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId)));
    if (!InvoiceVisibility.canView(
        actor, invoice.sellerId(), invoice.anchorId(), invoice.status(), invoice.fundedBy())) {
      throw new ForbiddenException(
          "Cannot view invoice", "Invoice " + invoiceId + " is not visible to you");
    }
    return invoice;
  }

  private PageResponse<InvoiceResponse> toInvoicePage(Page<Invoice> page) {
    LocalDate today = LocalDate.now(clock);
    return PageResponse.of(page, i -> InvoiceResponse.from(i, today));
  }

  private static BigDecimal min(List<Offer> offers, Function<Offer, BigDecimal> field) {
    return offers.stream().map(field).min(BigDecimal::compareTo).orElse(null);
  }

  private static BigDecimal max(List<Offer> offers, Function<Offer, BigDecimal> field) {
    return offers.stream().map(field).max(BigDecimal::compareTo).orElse(null);
  }

  private static BigDecimal average(List<Offer> offers, Function<Offer, BigDecimal> field) {
    BigDecimal sum = offers.stream().map(field).reduce(BigDecimal.ZERO, BigDecimal::add);
    return sum.divide(BigDecimal.valueOf(offers.size()), 2, RoundingMode.HALF_UP);
  }

  record ListingQuery(MarketplaceFilter filter, PageQuery page) {}

  record StatusQuery(InvoiceStatus status, PageQuery page) {}

  record OfferQuery(OfferStatus status, PageQuery page) {}
}
