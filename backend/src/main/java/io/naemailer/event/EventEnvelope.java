package io.naemailer.event;

import java.util.Map;
import java.util.Optional;

/**
 * A parsed CloudEvent envelope as delivered by the transport. Implemented once per transport (see
 * {@link CloudEventHttpReader}); the rest of the pipeline only sees {@link EventContext}.
 */
public interface EventEnvelope {

  /** Looks up any attribute, reserved or extension, by its CloudEvents name. */
  Optional<Object> get(String name);

  /** Every attribute not in {@link CloudEventAttributes#RESERVED}, in arrival order. */
  Map<String, Object> extensionAttributes();

  EventPayload data();
}
