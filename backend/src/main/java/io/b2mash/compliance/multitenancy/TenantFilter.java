package io.b2mash.compliance.multitenancy;

import io.b2mash.compliance.exception.MissingOrganizationContextException;
import io.b2mash.compliance.multitenancy.RequestScopes.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the caller identity forwarded by the authentication gateway into {@link RequestScopes}.
 * The gateway authenticates the user and resolves the tenant before the request reaches this
 * service; the headers below are trusted as-is.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class TenantFilter extends OncePerRequestFilter {

  static final String ORG_HEADER = MissingOrganizationContextException.ORGANIZATION_HEADER;
  static final String MEMBER_HEADER = "X-Member-Id";
  static final String ROLE_HEADER = "X-Org-Role";
  static final String TEAMS_HEADER = "X-Team-Ids";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String orgId = request.getHeader(ORG_HEADER);
    String memberHeader = request.getHeader(MEMBER_HEADER);

    if (orgId == null || orgId.isBlank() || memberHeader == null) {
      // No identity: continue unbound (actuator, health checks)
      filterChain.doFilter(request, response);
      return;
    }

    UUID memberId;
    Set<UUID> teamIds;
    try {
      memberId = UUID.fromString(memberHeader.trim());
      teamIds = parseTeams(request.getHeader(TEAMS_HEADER));
    } catch (IllegalArgumentException e) {
      response.sendError(HttpServletResponse.SC_BAD_REQUEST, "Malformed identity headers");
      return;
    }

    var context =
        new RequestContext(orgId.trim(), memberId, request.getHeader(ROLE_HEADER), teamIds);
    try {
      RequestScopes.runScoped(
          context,
          () -> {
            try {
              filterChain.doFilter(request, response);
            } catch (IOException e) {
              throw new UncheckedIOException(e);
            } catch (ServletException e) {
              throw new WrappedServletException(e);
            }
          });
    } catch (UncheckedIOException e) {
      throw e.getCause();
    } catch (WrappedServletException e) {
      throw e.wrapped;
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }

  private static Set<UUID> parseTeams(String header) {
    if (header == null || header.isBlank()) {
      return Set.of();
    }
    return Arrays.stream(header.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .map(UUID::fromString)
        .collect(Collectors.toUnmodifiableSet());
  }

  static final class WrappedServletException extends RuntimeException {
    final ServletException wrapped;

    WrappedServletException(ServletException e) {
      super(e);
      this.wrapped = e;
    }
  }
}
