package io.naemailer.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Best-effort reinterpretation of an {@link EventPayload}. Every method degrades to an empty
 * result instead of failing: callers treat an undecodable payload as absent.
 */
@Component
public class PayloadDecoder {

  private static final Logger log = LoggerFactory.getLogger(PayloadDecoder.class);
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public PayloadDecoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Returns the payload as a string-keyed mapping. Structured data is returned as is; bytes are
   * decoded as strict UTF-8 and, like text, parsed only when they look like a JSON object.
   */
  public Optional<Map<String, Object>> asMap(EventPayload payload) {
    if (payload instanceof EventPayload.StructuredData structured) {
      return Optional.of(structured.values());
    }
    if (payload instanceof EventPayload.ByteData bytes) {
      return decodeStrict(bytes.bytes()).flatMap(this::parseJsonObject);
    }
    if (payload instanceof EventPayload.TextData text) {
      return parseJsonObject(text.text());
    }
    return Optional.empty();
  }

  /** Decodes bytes as UTF-8, substituting undecodable sequences; text is returned unchanged. */
  public Optional<String> asLenientText(EventPayload payload) {
    if (payload instanceof EventPayload.ByteData bytes) {
      return Optional.of(new String(bytes.bytes(), StandardCharsets.UTF_8));
    }
    if (payload instanceof EventPayload.TextData text) {
      return Optional.of(text.text());
    }
    return Optional.empty();
  }

  Optional<String> decodeStrict(byte[] bytes) {
    try {
      return Optional.of(
          StandardCharsets.UTF_8
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(ByteBuffer.wrap(bytes))
              .toString());
    } catch (CharacterCodingException e) {
      log.debug("Payload bytes are not valid UTF-8, treating as absent");
      return Optional.empty();
    }
  }

  Optional<Map<String, Object>> parseJsonObject(String text) {
    String trimmed = text.strip();
    if (!trimmed.startsWith("{") || !trimmed.endsWith("}")) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.readValue(trimmed, MAP_TYPE));
    } catch (JsonProcessingException e) {
      log.debug("Payload text looked like JSON but did not parse: {}", e.getOriginalMessage());
      return Optional.empty();
    }
  }
}
