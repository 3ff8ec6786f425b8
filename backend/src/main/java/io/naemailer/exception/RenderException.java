package io.naemailer.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when notification content cannot be rendered, including rejected request-supplied
 * templates. Results in HTTP 500; nothing is sent.
 */
public class RenderException extends ErrorResponseException {

  public RenderException(String detail) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(detail), null);
  }

  public RenderException(String detail, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Template rendering failed");
    problem.setDetail(detail);
    return problem;
  }
}
