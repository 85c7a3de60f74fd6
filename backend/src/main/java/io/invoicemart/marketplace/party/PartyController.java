package io.invoicemart.marketplace.party;

import io.invoicemart.marketplace.web.Actor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PartyController {

  private final PartyService partyService;

  public PartyController(PartyService partyService) {
    this.partyService = partyService;
  }

  @PostMapping("/api/parties")
  public ResponseEntity<PartyResponse> registerParty(
      Actor actor, @Valid @RequestBody RegisterPartyRequest request) {
    actor.requireRole(PartyRole.ADMIN);
    var party =
        partyService.register(
            request.role(), request.displayName(), request.email(), request.companyName());
    return ResponseEntity.created(URI.create("/api/parties/" + party.getId()))
        .body(PartyResponse.from(party));
  }

  @GetMapping("/api/parties/{id}")
  public ResponseEntity<PartyResponse> getParty(Actor actor, @PathVariable UUID id) {
    return ResponseEntity.ok(PartyResponse.from(partyService.get(id)));
  }

  /** Directory lookup, e.g. sellers choosing the anchor an invoice is addressed to. */
  @GetMapping("/api/parties")
  public ResponseEntity<List<PartyResponse>> listParties(
      Actor actor, @RequestParam PartyRole role) {
    return ResponseEntity.ok(
        partyService.listByRole(role).stream().map(PartyResponse::from).toList());
  }

  public record RegisterPartyRequest(
      @NotNull(message = "role is required") PartyRole role,
      @NotBlank(message = "displayName is required")
          @Size(max = 200, message = "displayName must not exceed 200 characters")
          String displayName,
      @NotBlank(message = "email is required") @Email(message = "email must be valid")
          String email,
      @Size(max = 200, message = "companyName must not exceed 200 characters")
          String companyName) {}

  public record PartyResponse(
      UUID id,
      PartyRole role,
      String displayName,
      String email,
      String companyName,
      Instant createdAt) {

    static PartyResponse from(Party party) {
      return new PartyResponse(
          party.getId(),
          party.getRole(),
          party.getDisplayName(),
          party.getEmail(),
          party.getCompanyName(),
          party.getCreatedAt());
    }
  }
}
