package io.naemailer.content;

/** Thrown when a request-supplied template contains a pattern that could lead to SSTI. */
public class TemplateSecurityException extends RuntimeException {

  public TemplateSecurityException(String message) {
    super(message);
  }
}
