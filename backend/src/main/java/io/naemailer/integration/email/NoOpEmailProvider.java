package io.naemailer.integration.email;

import io.naemailer.message.OutboundMessage;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

/**
 * No-op email provider used when no SMTP host is configured. Logs message details instead of
 * sending them.
 */
@Component
@ConditionalOnExpression("'${spring.mail.host:}' == ''")
public class NoOpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpEmailProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public SendResult send(OutboundMessage message) {
    log.info(
        "NoOp email: would send {} message to={} cc={} bcc={} with subject '{}'",
        message.isRawMime() ? "raw MIME" : "templated",
        message.to(),
        message.cc(),
        message.bcc(),
        message.subject());
    return new SendResult(true, "NOOP-" + UUID.randomUUID(), null);
  }
}
