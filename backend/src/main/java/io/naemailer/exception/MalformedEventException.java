package io.naemailer.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when the inbound envelope cannot be parsed or lacks a required attribute ({@code id},
 * {@code source}, {@code type}, {@code specversion}). Never retried; results in HTTP 400.
 */
public class MalformedEventException extends ErrorResponseException {

  public MalformedEventException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  public MalformedEventException(String detail, Throwable cause) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid CloudEvent");
    problem.setDetail(detail);
    return problem;
  }
}
