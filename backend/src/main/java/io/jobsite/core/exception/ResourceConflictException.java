package io.jobsite.core.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A write that lost a race: two advances of the same approval request, or two first inserts of
 * the same snapshot period. Repeating the call after re-reading is safe.
 */
public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, problem(title, detail), null);
  }

  static ProblemDetail problem(String title, String detail) {
    var problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, detail);
    problem.setTitle(title);
    problem.setProperty("retryable", true);
    return problem;
  }
}
