package io.naemailer.content;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.naemailer.event.EventContext;
import io.naemailer.event.EventPayload;
import io.naemailer.event.PayloadDecoder;
import io.naemailer.exception.MissingPayloadException;
import io.naemailer.exception.RenderException;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetHeaders;
import jakarta.mail.internet.MimeUtility;
import java.io.ByteArrayInputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides what the notification body is. Events whose content type names a MIME multipart payload
 * are forwarded as raw MIME and never templated; every other event is rendered from templates.
 */
@Component
public class ContentSelector {

  private static final Logger log = LoggerFactory.getLogger(ContentSelector.class);

  static final Set<String> RAW_MIME_TYPES =
      Set.of("mimemultipart", "mime/multipart", "multipart/mixed");

  /** Payload keys searched, in order, for a raw MIME document carried in structured data. */
  static final List<String> RAW_MIME_KEYS = List.of("raw_mime", "mime", "message");

  static final String INLINE_TEMPLATES_KEY = "templates_inline_json";

  private final TemplateRenderer templateRenderer;
  private final TemplateSourceProvider templateSourceProvider;
  private final PayloadDecoder payloadDecoder;
  private final ObjectMapper objectMapper;

  public ContentSelector(
      TemplateRenderer templateRenderer,
      TemplateSourceProvider templateSourceProvider,
      PayloadDecoder payloadDecoder,
      ObjectMapper objectMapper) {
    this.templateRenderer = templateRenderer;
    this.templateSourceProvider = templateSourceProvider;
    this.payloadDecoder = payloadDecoder;
    this.objectMapper = objectMapper;
  }

  public MessageContent select(EventContext ctx) {
    if (isRawMime(ctx.dataContentType())) {
      String rawMime = extractRawMime(ctx);
      log.debug("Using raw MIME payload for ceId={} ({} chars)", ctx.id(), rawMime.length());
      return new RawMimeContent(rawMime, subjectOf(rawMime));
    }
    return templateRenderer.render(ctx, templatesFor(ctx));
  }

  static boolean isRawMime(String dataContentType) {
    if (dataContentType == null) {
      return false;
    }
    int paramStart = dataContentType.indexOf(';');
    String mediaType = paramStart >= 0 ? dataContentType.substring(0, paramStart) : dataContentType;
    return RAW_MIME_TYPES.contains(mediaType.strip().toLowerCase(Locale.ROOT));
  }

  private String extractRawMime(EventContext ctx) {
    EventPayload data = ctx.data();
    if (data instanceof EventPayload.StructuredData structured) {
      for (String key : RAW_MIME_KEYS) {
        if (structured.get(key) instanceof String raw && !raw.isEmpty()) {
          return raw;
        }
      }
      throw new MissingPayloadException(
          "Raw MIME event carries none of " + RAW_MIME_KEYS + " in its data");
    }
    return payloadDecoder
        .asLenientText(data)
        .filter(raw -> !raw.isEmpty())
        .orElseThrow(() -> new MissingPayloadException("Raw MIME event has no data"));
  }

  private TemplateSet templatesFor(EventContext ctx) {
    TemplateSet configured = templateSourceProvider.configured();
    if (!(ctx.data() instanceof EventPayload.StructuredData structured)
        || !structured.containsKey(INLINE_TEMPLATES_KEY)) {
      return configured;
    }

    try {
      TemplateSet inline =
          TemplateSet.fromValue(structured.get(INLINE_TEMPLATES_KEY), objectMapper);
      TemplateSecurityValidator.validate(inline);
      log.debug("Using request-supplied templates for ceId={}", ctx.id());
      return inline.over(configured);
    } catch (TemplateSecurityException e) {
      log.warn("Rejected request-supplied templates for ceId={}: {}", ctx.id(), e.getMessage());
      throw new RenderException("Request-supplied template rejected: " + e.getMessage(), e);
    } catch (IllegalArgumentException e) {
      throw new RenderException(e.getMessage(), e);
    }
  }

  /** Reads and decodes the Subject header of a raw MIME document; blank when there is none. */
  static String subjectOf(String rawMime) {
    try {
      var headers =
          new InternetHeaders(new ByteArrayInputStream(rawMime.getBytes(StandardCharsets.UTF_8)));
      String subject = headers.getHeader("Subject", null);
      return subject != null ? MimeUtility.decodeText(MimeUtility.unfold(subject)).strip() : "";
    } catch (MessagingException | UnsupportedEncodingException e) {
      log.debug("Could not read subject from raw MIME payload: {}", e.getMessage());
      return "";
    }
  }
}
