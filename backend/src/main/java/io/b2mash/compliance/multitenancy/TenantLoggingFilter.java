package io.b2mash.compliance.multitenancy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Copies the bound request identity into the logging MDC. Runs after {@link TenantFilter}. */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class TenantLoggingFilter extends OncePerRequestFilter {

  private static final String MDC_TENANT_ID = "tenantId";
  private static final String MDC_MEMBER_ID = "memberId";
  private static final String MDC_REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      String orgId = RequestScopes.getOrgIdOrNull();
      if (orgId != null) {
        MDC.put(MDC_TENANT_ID, orgId);
      }

      UUID memberId = RequestScopes.getMemberIdOrNull();
      if (memberId != null) {
        MDC.put(MDC_MEMBER_ID, memberId.toString());
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_TENANT_ID);
      MDC.remove(MDC_MEMBER_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
