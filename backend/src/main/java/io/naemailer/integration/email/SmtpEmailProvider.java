package io.naemailer.integration.email;

import io.naemailer.message.OutboundMessage;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * SMTP-based email provider that sends messages via {@link JavaMailSender}. Only active when {@code
 * spring.mail.host} is non-empty (see {@code NA_SMTP_HOST}).
 *
 * <p>Templated messages are built with {@link MimeMessageHelper}. Raw MIME documents are parsed
 * as-is; their To, Cc and Bcc are replaced by the assembled recipients, a missing From is filled
 * with the configured sender, and the tracing headers are added.
 */
@Component
@ConditionalOnExpression("'${spring.mail.host:}' != ''")
public class SmtpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(SmtpEmailProvider.class);

  private final JavaMailSender mailSender;

  public SmtpEmailProvider(JavaMailSender mailSender) {
    this.mailSender = mailSender;
  }

  @Override
  public String providerId() {
    return "smtp";
  }

  @Override
  public SendResult send(OutboundMessage message) {
    try {
      MimeMessage mimeMessage =
          message.isRawMime() ? fromRawMime(message) : fromRenderedContent(message);
      mailSender.send(mimeMessage);
      String messageId = mimeMessage.getMessageID();
      log.debug("SMTP email sent to {} with Message-ID: {}", message.to(), messageId);
      return new SendResult(true, messageId, null);
    } catch (MailException | MessagingException e) {
      log.error("Failed to send SMTP email to {}: {}", message.to(), e.getMessage());
      return new SendResult(false, null, e.getMessage());
    }
  }

  private MimeMessage fromRenderedContent(OutboundMessage message) throws MessagingException {
    MimeMessage mimeMessage = mailSender.createMimeMessage();
    MimeMessageHelper helper =
        new MimeMessageHelper(mimeMessage, true, StandardCharsets.UTF_8.name());
    helper.setFrom(message.sender());
    if (!message.to().isEmpty()) {
      helper.setTo(message.to().toArray(String[]::new));
    }
    if (!message.cc().isEmpty()) {
      helper.setCc(message.cc().toArray(String[]::new));
    }
    if (!message.bcc().isEmpty()) {
      helper.setBcc(message.bcc().toArray(String[]::new));
    }
    helper.setSubject(message.subject());
    if (message.html() != null && message.text() != null) {
      helper.setText(message.text(), message.html());
    } else if (message.html() != null) {
      helper.setText(message.html(), true);
    } else {
      helper.setText(message.text(), false);
    }
    addHeaders(mimeMessage, message);
    return mimeMessage;
  }

  private MimeMessage fromRawMime(OutboundMessage message) throws MessagingException {
    MimeMessage mimeMessage =
        mailSender.createMimeMessage(
            new ByteArrayInputStream(message.rawMime().getBytes(StandardCharsets.UTF_8)));
    setRecipients(mimeMessage, Message.RecipientType.TO, message.to());
    setRecipients(mimeMessage, Message.RecipientType.CC, message.cc());
    setRecipients(mimeMessage, Message.RecipientType.BCC, message.bcc());
    if (mimeMessage.getFrom() == null) {
      mimeMessage.setFrom(message.sender());
    }
    addHeaders(mimeMessage, message);
    return mimeMessage;
  }

  // An empty list removes the header the document may have carried.
  private static void setRecipients(
      MimeMessage mimeMessage, Message.RecipientType type, List<String> addresses)
      throws MessagingException {
    mimeMessage.setRecipients(type, addresses.isEmpty() ? null : String.join(", ", addresses));
  }

  private static void addHeaders(MimeMessage mimeMessage, OutboundMessage message)
      throws MessagingException {
    for (var header : message.headers().entrySet()) {
      mimeMessage.setHeader(header.getKey(), header.getValue());
    }
  }
}
