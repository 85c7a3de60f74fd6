package io.invoicemart.marketplace.funding;

import io.invoicemart.marketplace.invoice.dto.InvoiceResponse;
import io.invoicemart.marketplace.offer.dto.OfferResponse;
import io.invoicemart.marketplace.party.PartyRole;
import io.invoicemart.marketplace.web.Actor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AcceptanceController {

  private final OfferAcceptanceCoordinator coordinator;
  private final Clock clock;

  public AcceptanceController(OfferAcceptanceCoordinator coordinator, Clock clock) {
    this.coordinator = coordinator;
    this.clock = clock;
  }

  @PostMapping("/api/offers/{id}/accept")
  public ResponseEntity<AcceptanceResponse> acceptOffer(
      Actor actor,
      @PathVariable UUID id,
      @Valid @RequestBody(required = false) AcceptOfferRequest body) {
    actor.requireRole(PartyRole.SELLER);
    var result = coordinator.acceptOffer(actor.id(), id, body != null ? body.notes() : null);
    return ResponseEntity.ok(
        new AcceptanceResponse(
            OfferResponse.from(result.offer(), clock.instant()),
            InvoiceResponse.from(result.invoice(), LocalDate.now(clock)),
            result.autoRejectedOffers()));
  }

  public record AcceptOfferRequest(
      @Size(max = 500, message = "notes must not exceed 500 characters") String notes) {}

  public record AcceptanceResponse(
      OfferResponse offer, InvoiceResponse invoice, int autoRejectedOffers) {}
}
