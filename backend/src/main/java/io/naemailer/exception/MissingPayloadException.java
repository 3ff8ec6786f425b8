package io.naemailer.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when a raw-MIME event carries no usable message content. Results in HTTP 400. */
public class MissingPayloadException extends ErrorResponseException {

  public MissingPayloadException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  public MissingPayloadException(String detail, Throwable cause) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Missing MIME payload");
    problem.setDetail(detail);
    return problem;
  }
}
