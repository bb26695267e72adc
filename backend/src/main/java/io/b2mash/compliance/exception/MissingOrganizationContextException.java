package io.b2mash.compliance.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when a tenant-scoped operation runs without an organization bound to the request, i.e.
 * the gateway did not forward {@value #ORGANIZATION_HEADER}.
 */
public class MissingOrganizationContextException extends ErrorResponseException {

  public static final String ORGANIZATION_HEADER = "X-Organization-Id";

  public MissingOrganizationContextException() {
    super(HttpStatus.UNAUTHORIZED, problem(), null);
  }

  private static ProblemDetail problem() {
    var problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.UNAUTHORIZED,
            "Saved views are organization-scoped; no " + ORGANIZATION_HEADER + " was bound");
    problem.setTitle("Organization required");
    problem.setProperty("requiredHeader", ORGANIZATION_HEADER);
    return problem;
  }
}
