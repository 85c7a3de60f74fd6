package io.invoicemart.marketplace.party;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PartyRepository extends JpaRepository<Party, UUID> {

  List<Party> findByRoleOrderByDisplayNameAsc(PartyRole role);

  boolean existsByEmailIgnoreCase(String email);
}
