package io.invoicemart.marketplace.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.invoicemart.marketplace.exception.ForbiddenException;
import io.invoicemart.marketplace.party.PartyRole;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.ServletWebRequest;

class ActorArgumentResolverTest {

  private final ActorArgumentResolver resolver = new ActorArgumentResolver();

  @Test
  void resolveArgument_readsGatewayHeaders() {
    var id = UUID.randomUUID();
    var request = new MockHttpServletRequest();
    request.addHeader(ActorArgumentResolver.ACTOR_ID_HEADER, id.toString());
    request.addHeader(ActorArgumentResolver.ACTOR_ROLE_HEADER, "LENDER");

    var actor = resolver.resolveArgument(null, null, new ServletWebRequest(request), null);

    assertThat(actor).isEqualTo(new Actor(id, PartyRole.LENDER));
  }

  @Test
  void resolve_roleIsCaseInsensitive() {
    var id = UUID.randomUUID();

    assertThat(ActorArgumentResolver.resolve(id.toString(), "anchor").role())
        .isEqualTo(PartyRole.ANCHOR);
  }

  @Test
  void resolve_missingHeader_forbidden() {
    assertThatThrownBy(() -> ActorArgumentResolver.resolve(null, "SELLER"))
        .isInstanceOf(ForbiddenException.class)
        .hasMessageContaining("no actor identity");
  }

  @Test
  void resolve_malformedId_forbidden() {
    assertThatThrownBy(() -> ActorArgumentResolver.resolve("not-a-uuid", "SELLER"))
        .isInstanceOf(ForbiddenException.class)
        .hasMessageContaining("malformed");
  }

  @Test
  void resolve_unknownRole_forbidden() {
    assertThatThrownBy(() -> ActorArgumentResolver.resolve(UUID.randomUUID().toString(), "OWNER"))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void requireRole_disallowedRole_forbidden() {
    var seller = new Actor(UUID.randomUUID(), PartyRole.SELLER);

    assertThat(seller.requireRole(PartyRole.SELLER, PartyRole.ADMIN)).isSameAs(seller);
    assertThatThrownBy(() -> seller.requireRole(PartyRole.LENDER))
        .isInstanceOf(ForbiddenException.class)
        .hasMessageContaining("SELLER");
  }
}
