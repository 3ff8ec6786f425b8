package io.naemailer.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The {@code data} member of a CloudEvent, classified once by the envelope reader. Consumers decide
 * how to reinterpret a variant (for example decoding {@link ByteData} as text) instead of probing
 * runtime types.
 */
public sealed interface EventPayload
    permits EventPayload.Absent,
        EventPayload.ByteData,
        EventPayload.TextData,
        EventPayload.StructuredData {

  static EventPayload absent() {
    return Absent.INSTANCE;
  }

  default boolean isAbsent() {
    return this instanceof Absent;
  }

  /** No data member, an empty body, or an explicit JSON {@code null}. */
  final class Absent implements EventPayload {
    static final Absent INSTANCE = new Absent();

    private Absent() {}

    @Override
    public String toString() {
      return "Absent";
    }
  }

  /** Opaque bytes, e.g. a binary-mode body or a structured-mode {@code data_base64}. */
  record ByteData(byte[] bytes) implements EventPayload {

    public ByteData {
      Objects.requireNonNull(bytes, "bytes");
      bytes = bytes.clone();
    }

    @Override
    public byte[] bytes() {
      return bytes.clone();
    }

    @Override
    public String toString() {
      return "ByteData[" + bytes.length + " bytes]";
    }
  }

  record TextData(String text) implements EventPayload {

    public TextData {
      Objects.requireNonNull(text, "text");
    }
  }

  /** A JSON object payload. Values keep their JSON-derived Java types. */
  record StructuredData(Map<String, Object> values) implements EventPayload {

    public StructuredData {
      Objects.requireNonNull(values, "values");
      values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean containsKey(String key) {
      return values.containsKey(key);
    }

    public Object get(String key) {
      return values.get(key);
    }
  }
}
