package io.invoicemart.marketplace.marketplace;

import io.invoicemart.marketplace.invoice.InvoiceStatus;
import io.invoicemart.marketplace.invoice.dto.InvoiceResponse;
import io.invoicemart.marketplace.marketplace.dto.CompetitionResponse;
import io.invoicemart.marketplace.marketplace.dto.ListingView;
import io.invoicemart.marketplace.marketplace.dto.MarketplaceFilter;
import io.invoicemart.marketplace.marketplace.dto.PageQuery;
import io.invoicemart.marketplace.marketplace.dto.PortfolioResponse;
import io.invoicemart.marketplace.marketplace.dto.TrendingInvoice;
import io.invoicemart.marketplace.offer.OfferStatus;
import io.invoicemart.marketplace.offer.dto.OfferResponse;
import io.invoicemart.marketplace.party.PartyRole;
import io.invoicemart.marketplace.web.Actor;
import io.invoicemart.marketplace.web.PageResponse;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Read endpoints for every actor. Writes live with their owning module's controller. */
@RestController
public class MarketplaceController {

  private final MarketplaceQueryService queryService;

  public MarketplaceController(MarketplaceQueryService queryService) {
    this.queryService = queryService;
  }

  // --- Lender ---

  @GetMapping("/api/marketplace/invoices")
  public ResponseEntity<PageResponse<ListingView>> browseMarketplace(
      Actor actor,
      @RequestParam(required = false) BigDecimal minAmount,
      @RequestParam(required = false) BigDecimal maxAmount,
      @RequestParam(required = false) Integer minDaysUntilDue,
      @RequestParam(required = false) Integer maxDaysUntilDue,
      @RequestParam(required = false) UUID anchorId,
      @RequestParam(required = false) String currency,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size,
      @RequestParam(required = false) String sortBy,
      @RequestParam(defaultValue = "desc") String direction) {
    actor.requireRole(PartyRole.LENDER, PartyRole.ADMIN);
    var filter =
        new MarketplaceFilter(
            minAmount, maxAmount, minDaysUntilDue, maxDaysUntilDue, anchorId, currency);
    var lenderId = actor.is(PartyRole.LENDER) ? actor.id() : null;
    return ResponseEntity.ok(
        queryService.browseMarketplace(
            lenderId, filter, new PageQuery(page, size, sortBy, direction)));
  }

  @GetMapping("/api/marketplace/trending")
  public ResponseEntity<List<TrendingInvoice>> trending(
      Actor actor, @RequestParam(defaultValue = "10") int limit) {
    actor.requireRole(PartyRole.LENDER, PartyRole.ADMIN);
    return ResponseEntity.ok(queryService.trending(limit));
  }

  @GetMapping("/api/offers/mine")
  public ResponseEntity<PortfolioResponse> myOffers(
      Actor actor,
      @RequestParam(required = false) OfferStatus status,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {
    actor.requireRole(PartyRole.LENDER);
    return ResponseEntity.ok(
        queryService.lenderPortfolio(actor.id(), status, new PageQuery(page, size, null, null)));
  }

  // --- Seller ---

  @GetMapping("/api/invoices/mine")
  public ResponseEntity<PageResponse<InvoiceResponse>> myInvoices(
      Actor actor,
      @RequestParam(required = false) InvoiceStatus status,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size,
      @RequestParam(required = false) String sortBy,
      @RequestParam(defaultValue = "desc") String direction) {
    actor.requireRole(PartyRole.SELLER);
    return ResponseEntity.ok(
        queryService.sellerInvoices(
            actor.id(), status, new PageQuery(page, size, sortBy, direction)));
  }

  @GetMapping("/api/invoices/{id}/offers")
  public ResponseEntity<PageResponse<OfferResponse>> invoiceOffers(
      Actor actor,
      @PathVariable UUID id,
      @RequestParam(required = false) OfferStatus status,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {
    actor.requireRole(PartyRole.SELLER, PartyRole.ADMIN);
    return ResponseEntity.ok(
        queryService.invoiceOffers(actor, id, status, new PageQuery(page, size, null, null)));
  }

  // --- Anchor ---

  @GetMapping("/api/anchor/invoices/pending")
  public ResponseEntity<PageResponse<InvoiceResponse>> anchorPending(
      Actor actor,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {
    actor.requireRole(PartyRole.ANCHOR);
    return ResponseEntity.ok(
        queryService.anchorPendingInvoices(actor.id(), new PageQuery(page, size, null, "asc")));
  }

  // --- Admin ---

  @GetMapping("/api/admin/invoices/pending")
  public ResponseEntity<PageResponse<InvoiceResponse>> adminPending(
      Actor actor,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {
    actor.requireRole(PartyRole.ADMIN);
    return ResponseEntity.ok(
        queryService.adminQueue(
            InvoiceStatus.ANCHOR_APPROVED, new PageQuery(page, size, null, "asc")));
  }

  @GetMapping("/api/admin/invoices/verified")
  public ResponseEntity<PageResponse<InvoiceResponse>> adminVerified(
      Actor actor,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {
    actor.requireRole(PartyRole.ADMIN);
    return ResponseEntity.ok(
        queryService.adminQueue(
            InvoiceStatus.ADMIN_VERIFIED, new PageQuery(page, size, null, "asc")));
  }

  // --- Shared ---

  @GetMapping("/api/invoices/{id}")
  public ResponseEntity<InvoiceResponse> getInvoice(Actor actor, @PathVariable UUID id) {
    return ResponseEntity.ok(queryService.invoiceDetail(actor, id));
  }

  @GetMapping("/api/invoices/{id}/competition")
  public ResponseEntity<CompetitionResponse> competition(Actor actor, @PathVariable UUID id) {
    return ResponseEntity.ok(queryService.competition(actor, id));
  }
}
