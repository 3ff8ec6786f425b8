package io.naemailer.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A fully-formed email ready for delivery. Carries either a rendered text/html pair or a raw MIME
 * document, never both.
 *
 * @param subject subject line; for raw MIME, the document's own subject (informational only)
 * @param headers extra headers, in insertion order
 */
public record OutboundMessage(
    String subject,
    String text,
    String html,
    String rawMime,
    String sender,
    List<String> to,
    List<String> cc,
    List<String> bcc,
    Map<String, String> headers) {

  public OutboundMessage {
    Objects.requireNonNull(sender, "sender");
    subject = subject != null ? subject : "";
    boolean hasBody = text != null || html != null;
    if (hasBody == (rawMime != null)) {
      throw new IllegalArgumentException(
          "Message needs either a text/html body or a raw MIME document, not both");
    }
    to = to != null ? List.copyOf(to) : List.of();
    cc = cc != null ? List.copyOf(cc) : List.of();
    bcc = bcc != null ? List.copyOf(bcc) : List.of();
    headers =
        headers != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(headers))
            : Map.of();
  }

  public boolean isRawMime() {
    return rawMime != null;
  }

  public boolean hasRecipients() {
    return !to.isEmpty() || !cc.isEmpty() || !bcc.isEmpty();
  }
}
