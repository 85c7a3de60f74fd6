package io.invoicemart.marketplace.party;

import io.invoicemart.marketplace.exception.ErrorKind;
import io.invoicemart.marketplace.exception.InvalidRequestException;
import io.invoicemart.marketplace.exception.ResourceConflictException;
import io.invoicemart.marketplace.exception.ResourceNotFoundException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PartyService {

  private static final Logger log = LoggerFactory.getLogger(PartyService.class);

  private final PartyRepository partyRepository;

  public PartyService(PartyRepository partyRepository) {
    this.partyRepository = partyRepository;
  }

  @Transactional
  public Party register(PartyRole role, String displayName, String email, String companyName) {
    if (partyRepository.existsByEmailIgnoreCase(email)) {
      throw new ResourceConflictException(
          ErrorKind.INVALID_REQUEST,
          "Party already exists",
          "A party with email " + email + " is already registered");
    }
    var party = partyRepository.save(new Party(role, displayName, email, companyName));
    log.info("Registered {} party {}", role, party.getId());
    return party;
  }

  @Transactional(readOnly = true)
  public Party get(UUID id) {
    return partyRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Party", id));
  }

  @Transactional(readOnly = true)
  public Optional<Party> find(UUID id) {
    return id == null ? Optional.empty() : partyRepository.findById(id);
  }

  @Transactional(readOnly = true)
  public List<Party> listByRole(PartyRole role) {
    return partyRepository.findByRoleOrderByDisplayNameAsc(role);
  }

  /** Anchors named on an invoice must exist in the directory with the ANCHOR role. */
  @Transactional(readOnly = true)
  public void requireAnchor(UUID anchorId) {
    var party =
        partyRepository
            .findById(anchorId)
            .orElseThrow(() -> new ResourceNotFoundException("Anchor", anchorId));
    if (party.getRole() != PartyRole.ANCHOR) {
      throw new InvalidRequestException(
          "Invalid anchor", "Party " + anchorId + " is not registered as an anchor");
    }
  }
}
