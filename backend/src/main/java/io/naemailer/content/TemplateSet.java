package io.naemailer.content;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;

/**
 * Subject, plain-text and HTML template sources. Any part may be {@code null}.
 *
 * <p>The JSON form is an object with optional {@code subject}, {@code text} and {@code html}
 * string members.
 */
public record TemplateSet(String subject, String text, String html) {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  public boolean hasBody() {
    return text != null || html != null;
  }

  /**
   * Layers this set over {@code fallback}: a missing subject comes from the fallback, and the
   * fallback's bodies are used only when this set defines neither body.
   */
  public TemplateSet over(TemplateSet fallback) {
    String effectiveSubject = subject != null ? subject : fallback.subject();
    if (hasBody()) {
      return new TemplateSet(effectiveSubject, text, html);
    }
    return new TemplateSet(effectiveSubject, fallback.text(), fallback.html());
  }

  /**
   * Reads a template set from a JSON string or an already-decoded mapping.
   *
   * @throws IllegalArgumentException if the value is neither, or a member is not a string
   */
  public static TemplateSet fromValue(Object value, ObjectMapper objectMapper) {
    if (value instanceof String json) {
      try {
        return fromMap(objectMapper.readValue(json, MAP_TYPE));
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException(
            "Inline templates are not a valid JSON object: " + e.getOriginalMessage(), e);
      }
    }
    if (value instanceof Map<?, ?> map) {
      return fromMap(map);
    }
    throw new IllegalArgumentException("Inline templates must be a JSON object or JSON string");
  }

  private static TemplateSet fromMap(Map<?, ?> map) {
    if (map == null) {
      throw new IllegalArgumentException("Inline templates must not be null");
    }
    return new TemplateSet(member(map, "subject"), member(map, "text"), member(map, "html"));
  }

  private static String member(Map<?, ?> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String text)) {
      throw new IllegalArgumentException("Inline template '" + key + "' must be a string");
    }
    return text;
  }
}
