package io.b2mash.taskregistry.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A request argument the registry cannot act on, such as a blank principal or negative page. */
public class InvalidRequestException extends ErrorResponseException {

  public InvalidRequestException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid request");
    problem.setDetail(detail);
    return problem;
  }
}
