package io.naemailer.message;

import io.naemailer.config.EmailerProperties;
import io.naemailer.content.MessageContent;
import io.naemailer.content.RawMimeContent;
import io.naemailer.content.RenderedContent;
import io.naemailer.event.EventContext;
import io.naemailer.recipient.RecipientField;
import io.naemailer.recipient.ResolvedRecipients;
import java.util.LinkedHashMap;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Combines the selected content, the event's recipients and the static configuration into an
 * {@link OutboundMessage}, and decides its {@link Disposition}.
 */
@Component
public class MessageAssembler {

  public static final String HEADER_EVENT_ID = "X-CloudEvent-ID";
  public static final String HEADER_EVENT_TYPE = "X-CloudEvent-Type";
  public static final String HEADER_EVENT_SOURCE = "X-CloudEvent-Source";

  private final EmailerProperties properties;

  public MessageAssembler(EmailerProperties properties) {
    this.properties = properties;
  }

  public OutboundMessage assemble(
      EventContext ctx, MessageContent content, ResolvedRecipients recipients) {
    var headers = new LinkedHashMap<String, String>();
    headers.put(HEADER_EVENT_ID, ctx.id());
    headers.put(HEADER_EVENT_TYPE, ctx.type());
    headers.put(HEADER_EVENT_SOURCE, ctx.source());

    List<String> to = recipientsOrDefault(recipients, RecipientField.TO);
    List<String> cc = recipientsOrDefault(recipients, RecipientField.CC);
    List<String> bcc = recipientsOrDefault(recipients, RecipientField.BCC);
    String sender = properties.email().from();

    if (content instanceof RawMimeContent raw) {
      return new OutboundMessage(
          raw.subject(), null, null, raw.rawMime(), sender, to, cc, bcc, headers);
    }
    var rendered = (RenderedContent) content;
    return new OutboundMessage(
        rendered.subject(), rendered.text(), rendered.html(), null, sender, to, cc, bcc, headers);
  }

  public Disposition disposition(OutboundMessage message) {
    if (!message.hasRecipients()) {
      return Disposition.NO_RECIPIENTS;
    }
    if (properties.dryRun()) {
      return Disposition.DRY_RUN;
    }
    return Disposition.SEND;
  }

  // Event-supplied recipients win per field; configuration fills only the empty ones.
  private List<String> recipientsOrDefault(ResolvedRecipients recipients, RecipientField field) {
    List<String> fromEvent = recipients.get(field);
    return fromEvent.isEmpty() ? properties.email().defaults(field) : fromEvent;
  }
}
