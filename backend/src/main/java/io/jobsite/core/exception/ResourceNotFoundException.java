package io.jobsite.core.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A workflow, step, request or snapshot that does not exist for the caller. Resources owned by
 * another company are reported the same way.
 */
public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(HttpStatus.NOT_FOUND, identified(resourceType, id), null);
  }

  private ResourceNotFoundException(ProblemDetail problem) {
    super(HttpStatus.NOT_FOUND, problem, null);
  }

  /** For lookups by something other than a single id, such as a workflow's step number. */
  public static ResourceNotFoundException withDetail(String title, String detail) {
    var problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, detail);
    problem.setTitle(title);
    return new ResourceNotFoundException(problem);
  }

  private static ProblemDetail identified(String resourceType, Object id) {
    var problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.NOT_FOUND, "No " + resourceType.toLowerCase() + " found with id " + id);
    problem.setTitle(resourceType + " not found");
    problem.setProperty("resourceType", resourceType);
    problem.setProperty("resourceId", String.valueOf(id));
    return problem;
  }
}
