package io.naemailer.recipient;

import java.util.List;

/** Recipients an event asked for; an empty list means the event did not specify that field. */
public record ResolvedRecipients(List<String> to, List<String> cc, List<String> bcc) {

  public ResolvedRecipients {
    to = to != null ? List.copyOf(to) : List.of();
    cc = cc != null ? List.copyOf(cc) : List.of();
    bcc = bcc != null ? List.copyOf(bcc) : List.of();
  }

  public List<String> get(RecipientField field) {
    return switch (field) {
      case TO -> to;
      case CC -> cc;
      case BCC -> bcc;
    };
  }
}
