package io.naemailer.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized, read-only view of one inbound CloudEvent. Created once per request by {@link
 * EventNormalizer} and discarded when the request completes.
 *
 * @param extensions caller-defined attributes, keyed by their original name
 * @param routingAttributes deployment-reserved first-class routing attributes (see {@link
 *     CloudEventAttributes#ROUTING})
 */
public record EventContext(
    String id,
    String source,
    String type,
    String subject,
    String time,
    String dataschema,
    String dataContentType,
    EventPayload data,
    Map<String, Object> extensions,
    Map<String, Object> routingAttributes) {

  public EventContext {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(type, "type");
    data = data != null ? data : EventPayload.absent();
    extensions = readOnlyCopy(extensions);
    routingAttributes = readOnlyCopy(routingAttributes);
  }

  /**
   * Looks up an attribute by its CloudEvents name: reserved attributes first, then routing
   * attributes, then extensions. Returns {@code null} when the event does not carry it.
   */
  public Object attribute(String name) {
    return switch (name) {
      case CloudEventAttributes.ID -> id;
      case CloudEventAttributes.SOURCE -> source;
      case CloudEventAttributes.TYPE -> type;
      case CloudEventAttributes.SUBJECT -> subject;
      case CloudEventAttributes.TIME -> time;
      case CloudEventAttributes.DATASCHEMA -> dataschema;
      case CloudEventAttributes.DATACONTENTTYPE -> dataContentType;
      default ->
          routingAttributes.containsKey(name) ? routingAttributes.get(name) : extensions.get(name);
    };
  }

  // Map.copyOf rejects null values, which JSON extensions may legitimately carry.
  private static Map<String, Object> readOnlyCopy(Map<String, Object> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
