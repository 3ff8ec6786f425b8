package io.naemailer.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.naemailer.exception.MalformedEventException;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

/**
 * Reads a CloudEvent from an HTTP request in either content mode of the CloudEvents HTTP binding.
 *
 * <ul>
 *   <li><b>Binary</b> (a {@code ce-specversion} header is present): attributes travel as
 *       percent-encoded {@code ce-*} headers, {@code Content-Type} is the {@code datacontenttype}
 *       and the body is the data.
 *   <li><b>Structured</b> (otherwise): the body is a JSON object holding every attribute plus
 *       {@code data} or {@code data_base64}.
 * </ul>
 *
 * <p>Unlike the CloudEvents SDK builders, attribute names are not restricted to lowercase
 * alphanumerics and JSON extension values keep their structure, so routing hints such as {@code
 * email_to} or a list of recipients pass through unchanged.
 */
@Component
public class CloudEventHttpReader {

  private static final Logger log = LoggerFactory.getLogger(CloudEventHttpReader.class);

  static final String HEADER_PREFIX = "ce-";
  static final MediaType CLOUDEVENTS_BATCH_JSON =
      MediaType.parseMediaType("application/cloudevents-batch+json");

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public CloudEventHttpReader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parses the request into an envelope.
   *
   * @throws MalformedEventException if the request is not a readable single CloudEvent
   */
  public EventEnvelope read(HttpHeaders headers, byte[] body) {
    byte[] content = body != null ? body : new byte[0];
    MediaType contentType = parseContentType(headers);

    if (headers.getFirst(HEADER_PREFIX + CloudEventAttributes.SPECVERSION) != null) {
      return readBinary(headers, contentType, content);
    }
    if (contentType != null && CLOUDEVENTS_BATCH_JSON.includes(contentType)) {
      throw new MalformedEventException("Batched CloudEvents are not supported");
    }
    return readStructured(content);
  }

  private EventEnvelope readBinary(HttpHeaders headers, MediaType contentType, byte[] body) {
    var attributes = new LinkedHashMap<String, Object>();
    headers.forEach(
        (name, values) -> {
          String lower = name.toLowerCase(Locale.ROOT);
          if (lower.startsWith(HEADER_PREFIX) && !values.isEmpty()) {
            attributes.put(
                lower.substring(HEADER_PREFIX.length()),
                UriUtils.decode(values.get(0), StandardCharsets.UTF_8));
          }
        });
    if (contentType != null) {
      attributes.put(CloudEventAttributes.DATACONTENTTYPE, contentType.toString());
    }
    requireSupportedSpecVersion(attributes.get(CloudEventAttributes.SPECVERSION));
    return new ParsedEnvelope(attributes, classifyBody(body, contentType));
  }

  private EventEnvelope readStructured(byte[] body) {
    if (body.length == 0) {
      throw new MalformedEventException("Request carries neither CloudEvent headers nor a body");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new MalformedEventException("Body is not valid JSON: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new MalformedEventException("Body could not be read: " + e.getMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new MalformedEventException("Structured CloudEvent must be a JSON object");
    }

    var attributes = new LinkedHashMap<String, Object>();
    var fields = ((ObjectNode) root).fields();
    while (fields.hasNext()) {
      var field = fields.next();
      String name = field.getKey();
      if (!CloudEventAttributes.DATA.equals(name)
          && !CloudEventAttributes.DATA_BASE64.equals(name)) {
        attributes.put(name, objectMapper.convertValue(field.getValue(), Object.class));
      }
    }
    requireSupportedSpecVersion(attributes.get(CloudEventAttributes.SPECVERSION));

    EventPayload data = classifyStructuredData(root);
    return new ParsedEnvelope(attributes, data);
  }

  private EventPayload classifyStructuredData(JsonNode root) {
    JsonNode base64 = root.get(CloudEventAttributes.DATA_BASE64);
    if (base64 != null && !base64.isNull()) {
      if (!base64.isTextual()) {
        throw new MalformedEventException("data_base64 must be a string");
      }
      try {
        return new EventPayload.ByteData(Base64.getDecoder().decode(base64.asText()));
      } catch (IllegalArgumentException e) {
        throw new MalformedEventException("data_base64 is not valid base64", e);
      }
    }

    JsonNode data = root.get(CloudEventAttributes.DATA);
    if (data == null || data.isNull() || data.isMissingNode()) {
      return EventPayload.absent();
    }
    if (data.isObject()) {
      return new EventPayload.StructuredData(objectMapper.convertValue(data, MAP_TYPE));
    }
    if (data.isTextual()) {
      return new EventPayload.TextData(data.asText());
    }
    return new EventPayload.TextData(data.toString());
  }

  private EventPayload classifyBody(byte[] body, MediaType contentType) {
    if (body.length == 0) {
      return EventPayload.absent();
    }
    if (isJson(contentType)) {
      try {
        JsonNode node = objectMapper.readTree(body);
        if (node != null && node.isObject()) {
          return new EventPayload.StructuredData(objectMapper.convertValue(node, MAP_TYPE));
        }
      } catch (JsonProcessingException e) {
        log.debug("Binary-mode body declared JSON but did not parse: {}", e.getOriginalMessage());
      } catch (IOException e) {
        log.debug("Binary-mode body could not be read as JSON: {}", e.getMessage());
      }
      return new EventPayload.ByteData(body);
    }
    if (contentType != null && "text".equalsIgnoreCase(contentType.getType())) {
      Charset charset =
          contentType.getCharset() != null ? contentType.getCharset() : StandardCharsets.UTF_8;
      return new EventPayload.TextData(new String(body, charset));
    }
    return new EventPayload.ByteData(body);
  }

  private static void requireSupportedSpecVersion(Object specVersion) {
    if (specVersion == null) {
      throw new MalformedEventException("Missing required attribute 'specversion'");
    }
    if (!CloudEventAttributes.SUPPORTED_SPEC_VERSIONS.contains(String.valueOf(specVersion))) {
      throw new MalformedEventException("Unsupported specversion '" + specVersion + "'");
    }
  }

  static boolean isJson(MediaType contentType) {
    if (contentType == null) {
      return false;
    }
    String subtype = contentType.getSubtype().toLowerCase(Locale.ROOT);
    return "json".equals(subtype) || subtype.endsWith("+json");
  }

  private static MediaType parseContentType(HttpHeaders headers) {
    String value = headers.getFirst(HttpHeaders.CONTENT_TYPE);
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return MediaType.parseMediaType(value);
    } catch (InvalidMediaTypeException e) {
      throw new MalformedEventException("Invalid Content-Type '" + value + "'", e);
    }
  }

  /** Attribute map plus payload, shared by both content modes. */
  private static final class ParsedEnvelope implements EventEnvelope {

    private final Map<String, Object> attributes;
    private final Map<String, Object> extensions;
    private final EventPayload data;

    private ParsedEnvelope(Map<String, Object> attributes, EventPayload data) {
      this.attributes = Collections.unmodifiableMap(attributes);
      var ext = new LinkedHashMap<String, Object>();
      attributes.forEach(
          (name, value) -> {
            if (!CloudEventAttributes.isReserved(name)) {
              ext.put(name, value);
            }
          });
      this.extensions = Collections.unmodifiableMap(ext);
      this.data = data;
    }

    @Override
    public Optional<Object> get(String name) {
      return Optional.ofNullable(attributes.get(name));
    }

    @Override
    public Map<String, Object> extensionAttributes() {
      return extensions;
    }

    @Override
    public EventPayload data() {
      return data;
    }
  }
}
