package io.b2mash.compliance.multitenancy;

import io.b2mash.compliance.exception.MissingOrganizationContextException;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Request-scoped identity for multitenancy and member ownership checks. Bound by {@link
 * TenantFilter} for HTTP requests and by {@link #runScoped}/{@link #callScoped} elsewhere (jobs,
 * tests), read by services.
 *
 * <p>A binding is visible to the current thread only and is removed when the bound action exits,
 * restoring any outer binding.
 */
public final class RequestScopes {

  /**
   * Identity of the caller.
   *
   * @param orgId organization identifier, the tenant discriminator of every saved view
   * @param memberId the acting member
   * @param orgRole "owner", "admin" or "member"; nullable
   * @param teamIds teams the member belongs to, used for team-visible views
   */
  public record RequestContext(String orgId, UUID memberId, String orgRole, Set<UUID> teamIds) {

    public RequestContext {
      teamIds = teamIds != null ? Set.copyOf(teamIds) : Set.of();
    }

    public static RequestContext of(String orgId, UUID memberId) {
      return new RequestContext(orgId, memberId, "member", Set.of());
    }
  }

  private static final ThreadLocal<RequestContext> CURRENT = new ThreadLocal<>();

  /** Runs {@code action} with {@code context} bound to the current thread. */
  public static void runScoped(RequestContext context, Runnable action) {
    callScoped(
        context,
        () -> {
          action.run();
          return null;
        });
  }

  /** Calls {@code action} with {@code context} bound to the current thread. */
  public static <T> T callScoped(RequestContext context, Supplier<T> action) {
    RequestContext previous = CURRENT.get();
    CURRENT.set(context);
    try {
      return action.get();
    } finally {
      if (previous != null) {
        CURRENT.set(previous);
      } else {
        CURRENT.remove();
      }
    }
  }

  public static boolean isBound() {
    return CURRENT.get() != null;
  }

  /** Returns the current member's UUID. Throws if not bound. */
  public static UUID requireMemberId() {
    RequestContext context = CURRENT.get();
    if (context == null || context.memberId() == null) {
      throw new MemberContextNotBoundException();
    }
    return context.memberId();
  }

  /** Returns the organization ID. Throws if not bound. */
  public static String requireOrgId() {
    RequestContext context = CURRENT.get();
    if (context == null || context.orgId() == null) {
      throw new MissingOrganizationContextException();
    }
    return context.orgId();
  }

  /** Returns the current member's org role, or null if not bound. */
  public static String getOrgRole() {
    RequestContext context = CURRENT.get();
    return context != null ? context.orgRole() : null;
  }

  /** Returns the teams of the current member, empty if not bound. */
  public static Set<UUID> getTeamIds() {
    RequestContext context = CURRENT.get();
    return context != null ? context.teamIds() : Set.of();
  }

  /** Returns the organization ID, or null if not bound. */
  public static String getOrgIdOrNull() {
    RequestContext context = CURRENT.get();
    return context != null ? context.orgId() : null;
  }

  /** Returns the member ID, or null if not bound. */
  public static UUID getMemberIdOrNull() {
    RequestContext context = CURRENT.get();
    return context != null ? context.memberId() : null;
  }

  private RequestScopes() {}
}
