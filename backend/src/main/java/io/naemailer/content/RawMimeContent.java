package io.naemailer.content;

import java.util.Objects;

/**
 * A pre-formed MIME message forwarded verbatim.
 *
 * @param subject the message's own Subject header, decoded; blank when it has none
 */
public record RawMimeContent(String rawMime, String subject) implements MessageContent {

  public RawMimeContent {
    Objects.requireNonNull(rawMime, "rawMime");
    subject = subject != null ? subject : "";
  }
}
