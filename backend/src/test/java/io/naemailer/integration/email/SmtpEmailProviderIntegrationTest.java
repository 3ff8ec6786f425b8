package io.naemailer.integration.email;

import static org.assertj.core.api.Assertions.assertThat;

import com.icegreen.greenmail.junit5.GreenMailExtension;
import com.icegreen.greenmail.util.GreenMailUtil;
import com.icegreen.greenmail.util.ServerSetupTest;
import io.naemailer.message.OutboundMessage;
import jakarta.mail.Message;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.mail.javamail.JavaMailSenderImpl;

class SmtpEmailProviderIntegrationTest {

  @RegisterExtension
  static GreenMailExtension greenMail = new GreenMailExtension(ServerSetupTest.SMTP);

  private static final Map<String, String> TRACING_HEADERS =
      Map.of(
          "X-CloudEvent-ID", "evt-1",
          "X-CloudEvent-Type", "com.example.order.created",
          "X-CloudEvent-Source", "/orders");

  private SmtpEmailProvider provider;

  @BeforeEach
  void setUp() {
    var mailSender = new JavaMailSenderImpl();
    mailSender.setHost(greenMail.getSmtp().getBindTo());
    mailSender.setPort(greenMail.getSmtp().getPort());
    provider = new SmtpEmailProvider(mailSender);
  }

  private static OutboundMessage templated(String text, String html) {
    return new OutboundMessage(
        "Order created",
        text,
        html,
        null,
        "na@example.com",
        List.of("to1@example.com", "to2@example.com"),
        List.of("cc@example.com"),
        List.of("bcc@example.com"),
        TRACING_HEADERS);
  }

  private static String addresses(MimeMessage message, Message.RecipientType type)
      throws Exception {
    var recipients = message.getRecipients(type);
    return recipients == null ? "" : Arrays.toString(recipients);
  }

  @Test
  void send_delivers_templated_message_to_every_recipient() throws Exception {
    var result = provider.send(templated("Hello", "<h1>Hello</h1>"));

    assertThat(result.success()).isTrue();
    assertThat(result.providerMessageId()).isNotBlank();
    MimeMessage[] received = greenMail.getReceivedMessages();
    // one copy per envelope recipient: to1, to2, cc, bcc
    assertThat(received).hasSize(4);
    var first = received[0];
    assertThat(first.getSubject()).isEqualTo("Order created");
    assertThat(first.getFrom()[0].toString()).isEqualTo("na@example.com");
    assertThat(addresses(first, Message.RecipientType.TO))
        .contains("to1@example.com", "to2@example.com");
    assertThat(addresses(first, Message.RecipientType.CC)).contains("cc@example.com");
    assertThat(first.getHeader("X-CloudEvent-ID", null)).isEqualTo("evt-1");
    assertThat(first.getHeader("X-CloudEvent-Source", null)).isEqualTo("/orders");
    assertThat(first.getContent()).isInstanceOf(MimeMultipart.class);
  }

  @Test
  void send_text_only_message() throws Exception {
    var result = provider.send(templated("Just text", null));

    assertThat(result.success()).isTrue();
    var received = greenMail.getReceivedMessages()[0];
    assertThat(GreenMailUtil.getBody(received)).contains("Just text").doesNotContain("text/html");
  }

  @Test
  void send_raw_mime_replaces_recipients_and_keeps_body() throws Exception {
    var rawMime =
        """
        From: app@example.com\r
        To: original@example.com\r
        Subject: Raw hello\r
        Content-Type: text/plain; charset=UTF-8\r
        \r
        Raw body\r
        """;
    var message =
        new OutboundMessage(
            "Raw hello",
            null,
            null,
            rawMime,
            "na@example.com",
            List.of("resolved@example.com"),
            List.of(),
            List.of(),
            TRACING_HEADERS);

    var result = provider.send(message);

    assertThat(result.success()).isTrue();
    MimeMessage[] received = greenMail.getReceivedMessages();
    assertThat(received).hasSize(1);
    assertThat(received[0].getSubject()).isEqualTo("Raw hello");
    assertThat(received[0].getFrom()[0].toString()).isEqualTo("app@example.com");
    assertThat(addresses(received[0], Message.RecipientType.TO))
        .contains("resolved@example.com")
        .doesNotContain("original@example.com");
    assertThat(received[0].getHeader("X-CloudEvent-Type", null))
        .isEqualTo("com.example.order.created");
    assertThat(((String) received[0].getContent()).strip()).isEqualTo("Raw body");
  }

  @Test
  void send_raw_mime_without_from_uses_configured_sender() throws Exception {
    var message =
        new OutboundMessage(
            "",
            null,
            null,
            "Subject: No sender\r\n\r\nbody\r\n",
            "na@example.com",
            List.of("resolved@example.com"),
            List.of(),
            List.of(),
            TRACING_HEADERS);

    var result = provider.send(message);

    assertThat(result.success()).isTrue();
    var received = greenMail.getReceivedMessages()[0];
    assertThat(received.getFrom()[0].toString()).isEqualTo("na@example.com");
  }

  @Test
  void send_failure_returns_error_result() {
    // Provider pointing to an unreachable host
    var badMailSender = new JavaMailSenderImpl();
    badMailSender.setHost("unreachable.invalid");
    badMailSender.setPort(9999);
    var badProvider = new SmtpEmailProvider(badMailSender);

    var result = badProvider.send(templated("test", null));

    assertThat(result.success()).isFalse();
    assertThat(result.providerMessageId()).isNull();
    assertThat(result.errorMessage()).isNotNull();
  }
}
