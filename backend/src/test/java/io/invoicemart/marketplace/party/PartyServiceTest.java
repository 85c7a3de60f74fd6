package io.invoicemart.marketplace.party;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.invoicemart.marketplace.exception.InvalidRequestException;
import io.invoicemart.marketplace.exception.ResourceConflictException;
import io.invoicemart.marketplace.exception.ResourceNotFoundException;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PartyServiceTest {

  @Mock private PartyRepository partyRepository;

  private PartyService service;

  @BeforeEach
  void setUp() {
    service = new PartyService(partyRepository);
  }

  @Test
  void register_duplicateEmail_conflict() {
    when(partyRepository.existsByEmailIgnoreCase("ops@acme.example")).thenReturn(true);

    assertThatThrownBy(
            () -> service.register(PartyRole.ANCHOR, "Acme", "ops@acme.example", "Acme Ltd"))
        .isInstanceOf(ResourceConflictException.class);
    verify(partyRepository, never()).save(any());
  }

  @Test
  void register_newParty_saved() {
    when(partyRepository.existsByEmailIgnoreCase("funds@lend.example")).thenReturn(false);
    when(partyRepository.save(any(Party.class))).thenAnswer(i -> i.getArgument(0));

    var party = service.register(PartyRole.LENDER, "Lend Co", "funds@lend.example", null);

    assertThat(party.getRole()).isEqualTo(PartyRole.LENDER);
    assertThat(party.getCreatedAt()).isNotNull();
  }

  @Test
  void requireAnchor_unknownParty_notFound() {
    var id = UUID.randomUUID();
    when(partyRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.requireAnchor(id))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void requireAnchor_partyWithOtherRole_invalid() {
    var id = UUID.randomUUID();
    when(partyRepository.findById(id))
        .thenReturn(Optional.of(new Party(PartyRole.SELLER, "Seller", "s@x.example", null)));

    assertThatThrownBy(() -> service.requireAnchor(id))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessageContaining("not registered as an anchor");
  }

  @Test
  void find_nullId_empty() {
    assertThat(service.find(null)).isEmpty();
  }
}
