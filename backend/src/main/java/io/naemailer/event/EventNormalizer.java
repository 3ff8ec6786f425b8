package io.naemailer.event;

import io.naemailer.exception.MalformedEventException;
import java.util.LinkedHashMap;
import org.springframework.stereotype.Component;

/**
 * Turns a parsed {@link EventEnvelope} into an {@link EventContext}. Core attributes become typed
 * fields; every other attribute is kept, value untouched, as an extension or (for the names in
 * {@link CloudEventAttributes#ROUTING}) a routing attribute.
 */
@Component
public class EventNormalizer {

  public EventContext normalize(EventEnvelope envelope) {
    String id = requiredString(envelope, CloudEventAttributes.ID);
    String source = requiredString(envelope, CloudEventAttributes.SOURCE);
    String type = requiredString(envelope, CloudEventAttributes.TYPE);

    var extensions = new LinkedHashMap<String, Object>();
    var routing = new LinkedHashMap<String, Object>();
    envelope
        .extensionAttributes()
        .forEach(
            (name, value) -> {
              if (CloudEventAttributes.ROUTING.contains(name)) {
                routing.put(name, value);
              } else {
                extensions.put(name, value);
              }
            });

    return new EventContext(
        id,
        source,
        type,
        optionalString(envelope, CloudEventAttributes.SUBJECT),
        optionalString(envelope, CloudEventAttributes.TIME),
        optionalString(envelope, CloudEventAttributes.DATASCHEMA),
        optionalString(envelope, CloudEventAttributes.DATACONTENTTYPE),
        envelope.data(),
        extensions,
        routing);
  }

  private static String requiredString(EventEnvelope envelope, String name) {
    Object value =
        envelope
            .get(name)
            .orElseThrow(
                () -> new MalformedEventException("Missing required attribute '" + name + "'"));
    if (!(value instanceof String text) || text.isBlank()) {
      throw new MalformedEventException("Attribute '" + name + "' must be a non-empty string");
    }
    return text;
  }

  private static String optionalString(EventEnvelope envelope, String name) {
    return envelope.get(name).map(String::valueOf).orElse(null);
  }
}
