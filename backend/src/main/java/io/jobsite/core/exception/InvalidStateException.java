package io.jobsite.core.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Input the engines refuse: an unknown approver code, a malformed step list, an impossible
 * reporting period or an analysis window out of range.
 */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, problem(title, detail), null);
  }

  private static ProblemDetail problem(String title, String detail) {
    var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
    problem.setTitle(title);
    return problem;
  }
}
