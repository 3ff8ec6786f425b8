package io.naemailer.content;

import java.util.Objects;

/** Output of template rendering. At least one of {@code text} and {@code html} is present. */
public record RenderedContent(String subject, String text, String html) implements MessageContent {

  public RenderedContent {
    Objects.requireNonNull(subject, "subject");
    if (text == null && html == null) {
      throw new IllegalArgumentException("Rendered content needs a text or an html body");
    }
  }
}
