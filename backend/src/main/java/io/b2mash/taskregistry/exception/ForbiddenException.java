package io.b2mash.taskregistry.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Caller lacks the role an operation requires. Rendered as HTTP 403, kind {@code Unauthorized}. */
public class ForbiddenException extends ErrorResponseException {

  public ForbiddenException(String title, String detail) {
    super(HttpStatus.FORBIDDEN, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty(ErrorKind.PROPERTY, ErrorKind.UNAUTHORIZED.label());
    return problem;
  }
}
