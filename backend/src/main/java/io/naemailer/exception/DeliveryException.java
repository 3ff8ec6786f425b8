package io.naemailer.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when the delivery provider rejects or fails to send a message. Results in HTTP 502. */
public class DeliveryException extends ErrorResponseException {

  public DeliveryException(String detail) {
    super(HttpStatus.BAD_GATEWAY, createProblem(detail), null);
  }

  public DeliveryException(String detail, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Email send failed");
    problem.setDetail(detail);
    return problem;
  }
}
