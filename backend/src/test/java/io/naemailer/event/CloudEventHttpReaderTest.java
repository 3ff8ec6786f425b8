package io.naemailer.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.naemailer.exception.MalformedEventException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

class CloudEventHttpReaderTest {

  private CloudEventHttpReader reader;

  @BeforeEach
  void setUp() {
    reader = new CloudEventHttpReader(new ObjectMapper());
  }

  private static HttpHeaders binaryHeaders(String contentType) {
    var headers = new HttpHeaders();
    headers.add("ce-specversion", "1.0");
    headers.add("ce-id", "evt-1");
    headers.add("ce-source", "/orders");
    headers.add("ce-type", "com.example.order.created");
    if (contentType != null) {
      headers.add(HttpHeaders.CONTENT_TYPE, contentType);
    }
    return headers;
  }

  private static HttpHeaders structuredHeaders() {
    var headers = new HttpHeaders();
    headers.add(HttpHeaders.CONTENT_TYPE, "application/cloudevents+json");
    return headers;
  }

  private static byte[] utf8(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  @Nested
  class BinaryMode {

    @Test
    void ce_headers_become_attributes_and_extensions() {
      var headers = binaryHeaders("application/json");
      headers.add("ce-email_to", "a@example.com,b@example.com");
      headers.add("Ce-Tenant", "acme");

      var envelope = reader.read(headers, utf8("{\"orderId\":42}"));

      assertThat(envelope.get("id")).contains("evt-1");
      assertThat(envelope.get("type")).contains("com.example.order.created");
      assertThat(envelope.get("datacontenttype")).contains("application/json");
      assertThat(envelope.extensionAttributes())
          .containsEntry("email_to", "a@example.com,b@example.com")
          .containsEntry("tenant", "acme")
          .doesNotContainKeys("id", "specversion", "datacontenttype");
    }

    @Test
    void json_object_body_becomes_structured_data() {
      var envelope = reader.read(binaryHeaders("application/json"), utf8("{\"orderId\":42}"));

      assertThat(envelope.data()).isInstanceOf(EventPayload.StructuredData.class);
      assertThat(((EventPayload.StructuredData) envelope.data()).values())
          .containsEntry("orderId", 42);
    }

    @Test
    void json_body_that_is_not_an_object_stays_bytes() {
      var envelope = reader.read(binaryHeaders("application/json"), utf8("[1,2,3]"));

      assertThat(envelope.data()).isInstanceOf(EventPayload.ByteData.class);
    }

    @Test
    void text_body_becomes_text_data() {
      var envelope = reader.read(binaryHeaders("text/plain; charset=utf-8"), utf8("héllo"));

      assertThat(envelope.data()).isEqualTo(new EventPayload.TextData("héllo"));
    }

    @Test
    void other_body_stays_bytes() {
      var envelope = reader.read(binaryHeaders("mime/multipart"), utf8("Subject: hi\r\n\r\nbody"));

      assertThat(envelope.data()).isInstanceOf(EventPayload.ByteData.class);
      assertThat(((EventPayload.ByteData) envelope.data()).bytes())
          .isEqualTo(utf8("Subject: hi\r\n\r\nbody"));
      assertThat(envelope.get("datacontenttype")).contains("mime/multipart");
    }

    @Test
    void ce_header_values_are_percent_decoded() {
      var headers = binaryHeaders("application/json");
      headers.add("ce-subject", "Caf%C3%A9 order");
      headers.add("ce-email_to", "a@example.com%2Cb@example.com");
      headers.add("ce-note", "1+1%20=%202");

      var envelope = reader.read(headers, utf8("{}"));

      assertThat(envelope.get("subject")).contains("Café order");
      assertThat(envelope.extensionAttributes())
          .containsEntry("email_to", "a@example.com,b@example.com")
          .containsEntry("note", "1+1 = 2");
    }

    @Test
    void empty_body_is_absent() {
      var envelope = reader.read(binaryHeaders(null), new byte[0]);

      assertThat(envelope.data().isAbsent()).isTrue();
      assertThat(envelope.get("datacontenttype")).isEmpty();
    }

    @Test
    void unsupported_specversion_is_rejected() {
      var headers = binaryHeaders("application/json");
      headers.set("ce-specversion", "2.0");

      assertThatExceptionOfType(MalformedEventException.class)
          .isThrownBy(() -> reader.read(headers, utf8("{}")))
          .satisfies(e -> assertThat(e.getBody().getDetail()).contains("2.0"));
    }

    @Test
    void invalid_content_type_is_rejected() {
      var headers = binaryHeaders(null);
      headers.add(HttpHeaders.CONTENT_TYPE, "not a media type");

      assertThatExceptionOfType(MalformedEventException.class)
          .isThrownBy(() -> reader.read(headers, utf8("x")));
    }
  }

  @Nested
  class StructuredMode {

    @Test
    void members_become_attributes_with_types_preserved() {
      var body =
          """
          {
            "specversion": "1.0",
            "id": "evt-2",
            "source": "/billing",
            "type": "com.example.invoice.paid",
            "email_to": ["a@example.com", "b@example.com"],
            "priority": 3,
            "data": {"invoice": "INV-1"}
          }
          """;

      var envelope = reader.read(structuredHeaders(), utf8(body));

      assertThat(envelope.get("source")).contains("/billing");
      assertThat(envelope.extensionAttributes())
          .containsEntry("email_to", List.of("a@example.com", "b@example.com"))
          .containsEntry("priority", 3)
          .doesNotContainKey("data");
      assertThat(envelope.data())
          .isEqualTo(new EventPayload.StructuredData(Map.of("invoice", "INV-1")));
    }

    @Test
    void data_base64_is_decoded_to_bytes() {
      var body =
          """
          {"specversion":"1.0","id":"1","source":"/s","type":"t","data_base64":"aGVsbG8="}
          """;

      var envelope = reader.read(structuredHeaders(), utf8(body));

      assertThat(envelope.data()).isInstanceOf(EventPayload.ByteData.class);
      assertThat(((EventPayload.ByteData) envelope.data()).bytes()).isEqualTo(utf8("hello"));
      assertThat(envelope.extensionAttributes()).doesNotContainKey("data_base64");
    }

    @Test
    void invalid_base64_is_rejected() {
      var body =
          """
          {"specversion":"1.0","id":"1","source":"/s","type":"t","data_base64":"***"}
          """;

      assertThatExceptionOfType(MalformedEventException.class)
          .isThrownBy(() -> reader.read(structuredHeaders(), utf8(body)));
    }

    @Test
    void string_data_is_text_and_other_scalars_keep_their_json_form() {
      var stringBody =
          """
          {"specversion":"1.0","id":"1","source":"/s","type":"t","data":"plain"}
          """;
      var numberBody =
          """
          {"specversion":"1.0","id":"1","source":"/s","type":"t","data":42}
          """;

      assertThat(reader.read(structuredHeaders(), utf8(stringBody)).data())
          .isEqualTo(new EventPayload.TextData("plain"));
      assertThat(reader.read(structuredHeaders(), utf8(numberBody)).data())
          .isEqualTo(new EventPayload.TextData("42"));
    }

    @Test
    void null_data_is_absent() {
      var body =
          """
          {"specversion":"1.0","id":"1","source":"/s","type":"t","data":null}
          """;

      assertThat(reader.read(structuredHeaders(), utf8(body)).data().isAbsent()).isTrue();
    }

    @Test
    void missing_specversion_is_rejected() {
      var body =
          """
          {"id":"1","source":"/s","type":"t"}
          """;

      assertThatExceptionOfType(MalformedEventException.class)
          .isThrownBy(() -> reader.read(structuredHeaders(), utf8(body)))
          .satisfies(e -> assertThat(e.getBody().getDetail()).contains("specversion"));
    }

    @Test
    void invalid_json_is_rejected() {
      assertThatExceptionOfType(MalformedEventException.class)
          .isThrownBy(() -> reader.read(structuredHeaders(), utf8("{not json")));
    }

    @Test
    void non_object_json_is_rejected() {
      assertThatExceptionOfType(MalformedEventException.class)
          .isThrownBy(() -> reader.read(structuredHeaders(), utf8("[]")));
    }

    @Test
    void empty_request_is_rejected() {
      assertThatExceptionOfType(MalformedEventException.class)
          .isThrownBy(() -> reader.read(new HttpHeaders(), null));
    }

    @Test
    void batch_mode_is_rejected() {
      var headers = new HttpHeaders();
      headers.add(HttpHeaders.CONTENT_TYPE, "application/cloudevents-batch+json");

      assertThatExceptionOfType(MalformedEventException.class)
          .isThrownBy(() -> reader.read(headers, utf8("[]")))
          .satisfies(e -> assertThat(e.getBody().getDetail()).contains("Batch"));
    }
  }
}
