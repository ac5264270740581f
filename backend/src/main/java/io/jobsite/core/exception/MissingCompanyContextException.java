package io.jobsite.core.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class MissingCompanyContextException extends ErrorResponseException {

  public MissingCompanyContextException(String detail) {
    super(HttpStatus.UNAUTHORIZED, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Missing company context");
    problem.setDetail(detail);
    return problem;
  }
}
