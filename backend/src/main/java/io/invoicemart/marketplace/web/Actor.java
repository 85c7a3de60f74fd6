package io.invoicemart.marketplace.web;

import io.invoicemart.marketplace.exception.ForbiddenException;
import io.invoicemart.marketplace.party.PartyRole;
import java.util.Arrays;
import java.util.UUID;

/**
 * The caller's identity and role as asserted by the upstream gateway. Controllers check the role;
 * services check ownership.
 */
public record Actor(UUID id, PartyRole role) {

  public Actor requireRole(PartyRole... allowed) {
    if (Arrays.asList(allowed).contains(role)) {
      return this;
    }
    throw new ForbiddenException(
        "Insufficient role", "Role " + role + " may not perform this operation");
  }

  public boolean is(PartyRole candidate) {
    return role == candidate;
  }
}
