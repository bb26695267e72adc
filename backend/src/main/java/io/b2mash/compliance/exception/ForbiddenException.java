package io.b2mash.compliance.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** HTTP 403. Raised when a member writes to a resource they do not own. */
public class ForbiddenException extends ErrorResponseException {

  public ForbiddenException(String title, String detail) {
    super(HttpStatus.FORBIDDEN, createProblem(title, detail), null);
  }

  /** Ownership violation on a write to someone else's resource. */
  public static ForbiddenException notOwner(String resourceType, Object id, String action) {
    var ex =
        new ForbiddenException(
            resourceType + " " + action + " denied",
            "Only the creator can " + action + " this " + resourceType.toLowerCase());
    ex.getBody().setProperty("resourceId", String.valueOf(id));
    return ex;
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
