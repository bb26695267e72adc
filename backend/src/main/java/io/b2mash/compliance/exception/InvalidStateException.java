package io.b2mash.compliance.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail), null);
  }

  /**
   * Rejects a write whose filter configuration does not validate against the current property
   * registry. The offending property ids are exposed as {@code invalidFilters} on the problem body.
   */
  public static InvalidStateException invalidFilters(List<String> invalidFilters) {
    var ex =
        new InvalidStateException(
            "Invalid filters", "Invalid filter(s): " + String.join(", ", invalidFilters));
    ex.getBody().setProperty("invalidFilters", invalidFilters);
    return ex;
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
