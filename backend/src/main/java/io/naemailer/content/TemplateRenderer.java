package io.naemailer.content;

import io.naemailer.event.EventContext;

/** Renders notification content for one event. */
public interface TemplateRenderer {

  /**
   * Renders {@code templates} against {@code ctx}.
   *
   * @throws io.naemailer.exception.RenderException if any template fails to render or the result
   *     has no subject or no body
   */
  RenderedContent render(EventContext ctx, TemplateSet templates);
}
