package io.naemailer.integration.email;

import io.naemailer.message.OutboundMessage;

/** Port for delivering assembled messages. Exactly one implementation is active per process. */
public interface EmailProvider {

  /** Provider identifier (e.g., "smtp", "noop"). */
  String providerId();

  /**
   * Delivers one message. Delivery problems are reported through {@link SendResult#success()}
   * rather than thrown.
   */
  SendResult send(OutboundMessage message);
}
