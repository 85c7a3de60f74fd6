package io.invoicemart.marketplace.web;

import io.invoicemart.marketplace.exception.ForbiddenException;
import io.invoicemart.marketplace.party.PartyRole;
import java.util.Locale;
import java.util.UUID;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/** Resolves {@link Actor} controller parameters from the gateway's identity headers. */
@Component
public class ActorArgumentResolver implements HandlerMethodArgumentResolver {

  public static final String ACTOR_ID_HEADER = "X-Actor-Id";
  public static final String ACTOR_ROLE_HEADER = "X-Actor-Role";

  @Override
  public boolean supportsParameter(MethodParameter parameter) {
    return Actor.class.equals(parameter.getParameterType());
  }

  @Override
  public Actor resolveArgument(
      MethodParameter parameter,
      ModelAndViewContainer mavContainer,
      NativeWebRequest webRequest,
      WebDataBinderFactory binderFactory) {
    return resolve(
        webRequest.getHeader(ACTOR_ID_HEADER), webRequest.getHeader(ACTOR_ROLE_HEADER));
  }

  static Actor resolve(String id, String role) {
    if (id == null || role == null) {
      throw new ForbiddenException("Missing identity", "Request carries no actor identity");
    }
    try {
      return new Actor(UUID.fromString(id), PartyRole.valueOf(role.toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      throw new ForbiddenException("Invalid identity", "Actor identity headers are malformed");
    }
  }
}
