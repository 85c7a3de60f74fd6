package io.invoicemart.marketplace.offer;

import io.invoicemart.marketplace.offer.dto.OfferResponse;
import io.invoicemart.marketplace.party.PartyRole;
import io.invoicemart.marketplace.web.Actor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class OfferController {

  private final OfferService offerService;
  private final Clock clock;

  public OfferController(OfferService offerService, Clock clock) {
    this.offerService = offerService;
    this.clock = clock;
  }

  @PostMapping("/api/offers")
  public ResponseEntity<OfferResponse> createOffer(
      Actor actor, @Valid @RequestBody CreateOfferRequest request) {
    actor.requireRole(PartyRole.LENDER);
    var offer =
        offerService.createOffer(
            actor.id(),
            request.invoiceId(),
            request.interestRate(),
            request.fundingPercentage(),
            request.tenure(),
            request.terms(),
            request.lenderNotes(),
            request.expiresAt());
    return ResponseEntity.created(URI.create("/api/offers/" + offer.getId()))
        .body(OfferResponse.from(offer, clock.instant()));
  }

  @PostMapping("/api/offers/{id}/withdraw")
  public ResponseEntity<OfferResponse> withdrawOffer(
      Actor actor,
      @PathVariable UUID id,
      @Valid @RequestBody(required = false) ReasonRequest body) {
    actor.requireRole(PartyRole.LENDER);
    var offer = offerService.withdrawOffer(actor.id(), id, ReasonRequest.reasonOf(body));
    return ResponseEntity.ok(OfferResponse.from(offer, clock.instant()));
  }

  @PostMapping("/api/offers/{id}/reject")
  public ResponseEntity<OfferResponse> rejectOffer(
      Actor actor,
      @PathVariable UUID id,
      @Valid @RequestBody(required = false) ReasonRequest body) {
    actor.requireRole(PartyRole.SELLER);
    var offer = offerService.rejectOffer(actor.id(), id, ReasonRequest.reasonOf(body));
    return ResponseEntity.ok(OfferResponse.from(offer, clock.instant()));
  }

  @GetMapping("/api/offers/{id}")
  public ResponseEntity<OfferDetailResponse> getOffer(Actor actor, @PathVariable UUID id) {
    var offer = offerService.getOffer(actor, id);
    return ResponseEntity.ok(
        new OfferDetailResponse(
            OfferResponse.from(offer, clock.instant()), offerService.position(offer)));
  }

  // --- DTOs ---

  public record CreateOfferRequest(
      @NotNull(message = "invoiceId is required") UUID invoiceId,
      @NotNull(message = "interestRate is required")
          @DecimalMin(value = "0.0", message = "interestRate must not be negative")
          @DecimalMax(value = "50.0", message = "interestRate must not exceed 50")
          BigDecimal interestRate,
      @NotNull(message = "fundingPercentage is required")
          @DecimalMin(value = "1", message = "fundingPercentage must be at least 1")
          @DecimalMax(value = "100", message = "fundingPercentage must not exceed 100")
          BigDecimal fundingPercentage,
      @Min(value = 1, message = "tenure must be at least 1 day")
          @Max(value = 365, message = "tenure must not exceed 365 days")
          int tenure,
      @Size(max = 2000, message = "terms must not exceed 2000 characters") String terms,
      @Size(max = 1000, message = "lenderNotes must not exceed 1000 characters")
          String lenderNotes,
      Instant expiresAt) {}

  public record ReasonRequest(
      @Size(max = 500, message = "reason must not exceed 500 characters") String reason) {

    static String reasonOf(ReasonRequest request) {
      return request != null ? request.reason() : null;
    }
  }

  public record OfferDetailResponse(OfferResponse offer, OfferRanking.MarketPosition position) {}
}
