package io.naemailer.recipient;

import io.naemailer.event.EventContext;
import io.naemailer.event.PayloadDecoder;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts per-event recipient overrides. For a field name such as {@code email_to} the sources are
 * consulted in this order, and the first one that carries the name decides, even if its value
 * parses to an empty list:
 *
 * <ol>
 *   <li>the extension attribute {@code email_to}
 *   <li>the routing attribute {@code emailto}
 *   <li>the key {@code email_to} in the event payload, decoding bytes or JSON text when needed
 * </ol>
 *
 * An event that carries none of them yields an empty list.
 */
@Component
public class RecipientResolver {

  private static final Logger log = LoggerFactory.getLogger(RecipientResolver.class);

  private final PayloadDecoder payloadDecoder;

  public RecipientResolver(PayloadDecoder payloadDecoder) {
    this.payloadDecoder = payloadDecoder;
  }

  public List<String> resolve(EventContext ctx, String fieldName) {
    if (ctx.extensions().containsKey(fieldName)) {
      return RecipientParser.parse(ctx.extensions().get(fieldName));
    }

    String routingName = RecipientField.routingNameOf(fieldName);
    if (ctx.routingAttributes().containsKey(routingName)) {
      return RecipientParser.parse(ctx.routingAttributes().get(routingName));
    }

    Optional<Map<String, Object>> data = payloadDecoder.asMap(ctx.data());
    if (data.isPresent() && data.get().containsKey(fieldName)) {
      return RecipientParser.parse(data.get().get(fieldName));
    }

    return List.of();
  }

  public List<String> resolve(EventContext ctx, RecipientField field) {
    return resolve(ctx, field.attributeName());
  }

  public ResolvedRecipients resolveAll(EventContext ctx) {
    var resolved =
        new ResolvedRecipients(
            resolve(ctx, RecipientField.TO),
            resolve(ctx, RecipientField.CC),
            resolve(ctx, RecipientField.BCC));
    log.debug(
        "Event recipients: ceId={}, to={}, cc={}, bcc={}",
        ctx.id(),
        resolved.to(),
        resolved.cc(),
        resolved.bcc());
    return resolved;
  }
}
