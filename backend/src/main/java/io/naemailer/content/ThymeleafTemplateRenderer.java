package io.naemailer.content;

import io.naemailer.event.EventContext;
import io.naemailer.event.EventPayload;
import io.naemailer.exception.RenderException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.exceptions.TemplateEngineException;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.StringTemplateResolver;

/**
 * Renders notification templates with Thymeleaf. Templates are template <em>content</em>, not
 * names, so two dedicated engines with a {@link StringTemplateResolver} are used: {@code TEXT} mode
 * for the subject and plain-text body, {@code HTML} mode for the HTML body.
 *
 * <p>Template variables:
 *
 * <ul>
 *   <li>{@code event}: every attribute by CloudEvents name ({@code event.type}, {@code
 *       event.email_to}, ...)
 *   <li>{@code data}: the payload; a map for JSON objects, a string for text, otherwise {@code
 *       null}
 *   <li>{@code ext}: the extension attributes only
 * </ul>
 */
@Service
public class ThymeleafTemplateRenderer implements TemplateRenderer {

  private static final Logger log = LoggerFactory.getLogger(ThymeleafTemplateRenderer.class);

  private final TemplateEngine textEngine;
  private final TemplateEngine htmlEngine;

  public ThymeleafTemplateRenderer() {
    this.textEngine = createStringTemplateEngine(TemplateMode.TEXT);
    this.htmlEngine = createStringTemplateEngine(TemplateMode.HTML);
  }

  @Override
  public RenderedContent render(EventContext ctx, TemplateSet templates) {
    if (templates.subject() == null) {
      throw new RenderException("No subject template available");
    }
    if (!templates.hasBody()) {
      throw new RenderException("No text or html template available");
    }

    var thymeleafContext = new Context();
    buildModel(ctx).forEach(thymeleafContext::setVariable);

    String subject =
        singleLine(process(textEngine, "subject", templates.subject(), thymeleafContext));
    if (subject.isBlank()) {
      throw new RenderException("Subject template rendered an empty subject");
    }
    String text =
        templates.text() != null
            ? process(textEngine, "text", templates.text(), thymeleafContext)
            : null;
    String html =
        templates.html() != null
            ? process(htmlEngine, "html", templates.html(), thymeleafContext)
            : null;
    if (text == null) {
      text = toPlainText(html);
    }

    log.debug(
        "Rendered templates for ceId={}: subject='{}', textSize={}, htmlSize={}",
        ctx.id(),
        subject,
        text.length(),
        html != null ? html.length() : 0);
    return new RenderedContent(subject, text, html);
  }

  Map<String, Object> buildModel(EventContext ctx) {
    var event = new LinkedHashMap<String, Object>();
    event.put("id", ctx.id());
    event.put("source", ctx.source());
    event.put("type", ctx.type());
    event.put("subject", ctx.subject());
    event.put("time", ctx.time());
    event.put("dataschema", ctx.dataschema());
    event.put("datacontenttype", ctx.dataContentType());
    ctx.routingAttributes().forEach(event::putIfAbsent);
    ctx.extensions().forEach(event::putIfAbsent);

    var model = new LinkedHashMap<String, Object>();
    model.put("event", event);
    model.put("data", dataView(ctx.data()));
    model.put("ext", ctx.extensions());
    return model;
  }

  private static Object dataView(EventPayload payload) {
    if (payload instanceof EventPayload.StructuredData structured) {
      return structured.values();
    }
    if (payload instanceof EventPayload.TextData text) {
      return text.text();
    }
    return null;
  }

  private static String process(
      TemplateEngine engine, String part, String template, Context context) {
    try {
      return engine.process(template, context);
    } catch (TemplateEngineException e) {
      throw new RenderException("Failed to render " + part + " template: " + e.getMessage(), e);
    }
  }

  private static String singleLine(String subject) {
    return subject.strip().replaceAll("\\s*\\R\\s*", " ");
  }

  /**
   * Strips HTML tags to produce a plain-text fallback body. Preserves link text with URL in
   * parentheses. Collapses whitespace.
   */
  String toPlainText(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }

    String text = html;

    // <a href="url">text</a> -> text (url)
    text = text.replaceAll("<a[^>]*href=\"([^\"]*)\"[^>]*>([^<]*)</a>", "$2 ($1)");

    text = text.replaceAll("(?is)<(head|style|script)[^>]*>.*?</\\1>", "");
    text = text.replaceAll("<br\\s*/?>", "\n");
    text = text.replaceAll("</p>", "\n\n");
    text = text.replaceAll("</div>", "\n");
    text = text.replaceAll("</tr>", "\n");
    text = text.replaceAll("</td>", " ");
    text = text.replaceAll("</h[1-6]>", "\n\n");

    text = text.replaceAll("<[^>]+>", "");

    text = text.replace("&amp;", "&");
    text = text.replace("&lt;", "<");
    text = text.replace("&gt;", ">");
    text = text.replace("&quot;", "\"");
    text = text.replace("&nbsp;", " ");
    text = text.replace("&#39;", "'");

    text = text.replaceAll("[ \\t]+", " ");
    text = text.replaceAll("(?m)^ +| +$", "");
    text = text.replaceAll("\\n{3,}", "\n\n");

    return text.strip();
  }

  private static TemplateEngine createStringTemplateEngine(TemplateMode mode) {
    var engine = new TemplateEngine();
    engine.setDialect(new LenientStandardDialect());
    var resolver = new StringTemplateResolver();
    resolver.setTemplateMode(mode);
    engine.setTemplateResolver(resolver);
    return engine;
  }
}
