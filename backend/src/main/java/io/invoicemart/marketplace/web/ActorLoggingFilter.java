package io.invoicemart.marketplace.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Tags every log line of a request with the calling actor and a request id. */
@Component
public class ActorLoggingFilter extends OncePerRequestFilter {

  static final String MDC_ACTOR_ID = "actorId";
  static final String MDC_ACTOR_ROLE = "actorRole";
  static final String MDC_REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      String actorId = request.getHeader(ActorArgumentResolver.ACTOR_ID_HEADER);
      if (actorId != null) {
        MDC.put(MDC_ACTOR_ID, actorId);
      }
      String role = request.getHeader(ActorArgumentResolver.ACTOR_ROLE_HEADER);
      if (role != null) {
        MDC.put(MDC_ACTOR_ROLE, role);
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_ACTOR_ID);
      MDC.remove(MDC_ACTOR_ROLE);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
