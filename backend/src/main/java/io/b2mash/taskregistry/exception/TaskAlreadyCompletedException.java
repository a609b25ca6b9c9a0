package io.b2mash.taskregistry.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when completing a task that is already complete. Results in HTTP 409 Conflict. */
public class TaskAlreadyCompletedException extends ErrorResponseException {

  public TaskAlreadyCompletedException(long taskId) {
    super(HttpStatus.CONFLICT, createProblem(taskId), null);
  }

  private static ProblemDetail createProblem(long taskId) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Task already completed");
    problem.setDetail("Task " + taskId + " is already completed");
    problem.setProperty(ErrorKind.PROPERTY, ErrorKind.ALREADY_COMPLETED.label());
    return problem;
  }
}
