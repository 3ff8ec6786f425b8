package io.naemailer.pipeline;

import io.naemailer.config.EmailerProperties;
import io.naemailer.content.ContentSelector;
import io.naemailer.content.MessageContent;
import io.naemailer.event.EventContext;
import io.naemailer.event.EventEnvelope;
import io.naemailer.event.EventNormalizer;
import io.naemailer.exception.DeliveryException;
import io.naemailer.filter.FilterEngine;
import io.naemailer.filter.FilterSpec;
import io.naemailer.integration.email.EmailProvider;
import io.naemailer.integration.email.SendResult;
import io.naemailer.logging.EventLoggingFilter;
import io.naemailer.logging.LogLevelManager;
import io.naemailer.message.Disposition;
import io.naemailer.message.MessageAssembler;
import io.naemailer.message.OutboundMessage;
import io.naemailer.recipient.RecipientResolver;
import io.naemailer.recipient.ResolvedRecipients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Runs one event through the bridge: normalize, filter, select content, resolve recipients,
 * assemble, then send unless the disposition says otherwise. Stateless; every call works only on
 * the event it was given.
 */
@Service
public class EventPipeline {

  private static final Logger log = LoggerFactory.getLogger(EventPipeline.class);

  private final EventNormalizer normalizer;
  private final FilterEngine filterEngine;
  private final FilterSpec filterSpec;
  private final ContentSelector contentSelector;
  private final RecipientResolver recipientResolver;
  private final MessageAssembler messageAssembler;
  private final EmailProvider emailProvider;
  private final LogLevelManager logLevelManager;
  private final EmailerProperties properties;

  public EventPipeline(
      EventNormalizer normalizer,
      FilterEngine filterEngine,
      FilterSpec filterSpec,
      ContentSelector contentSelector,
      RecipientResolver recipientResolver,
      MessageAssembler messageAssembler,
      EmailProvider emailProvider,
      LogLevelManager logLevelManager,
      EmailerProperties properties) {
    this.normalizer = normalizer;
    this.filterEngine = filterEngine;
    this.filterSpec = filterSpec;
    this.contentSelector = contentSelector;
    this.recipientResolver = recipientResolver;
    this.messageAssembler = messageAssembler;
    this.emailProvider = emailProvider;
    this.logLevelManager = logLevelManager;
    this.properties = properties;
  }

  public EventOutcome process(EventEnvelope envelope) {
    logLevelManager.ensureConfigured();

    EventContext ctx = normalizer.normalize(envelope);
    MDC.put(EventLoggingFilter.MDC_EVENT_ID, ctx.id());
    MDC.put(EventLoggingFilter.MDC_EVENT_TYPE, ctx.type());
    MDC.put(EventLoggingFilter.MDC_EVENT_SOURCE, ctx.source());
    log.info("Received event: ceId={}, type={}, source={}", ctx.id(), ctx.type(), ctx.source());

    if (!filterEngine.matches(ctx, filterSpec, properties.filterMode())) {
      log.info("Event filtered out: ceId={}, type={}", ctx.id(), ctx.type());
      return EventOutcome.FILTERED;
    }

    MessageContent content = contentSelector.select(ctx);
    ResolvedRecipients recipients = recipientResolver.resolveAll(ctx);
    OutboundMessage message = messageAssembler.assemble(ctx, content, recipients);

    Disposition disposition = messageAssembler.disposition(message);
    return switch (disposition) {
      case NO_RECIPIENTS -> {
        log.warn("No recipients for event ceId={}; nothing sent", ctx.id());
        yield EventOutcome.SKIPPED_NO_RECIPIENTS;
      }
      case DRY_RUN -> {
        log.info(
            "Dry run: would send '{}' to={} cc={} bcc={} for ceId={}",
            message.subject(),
            message.to(),
            message.cc(),
            message.bcc(),
            ctx.id());
        yield EventOutcome.SKIPPED_DRY_RUN;
      }
      case SEND -> {
        deliver(ctx, message);
        yield EventOutcome.SENT;
      }
    };
  }

  private void deliver(EventContext ctx, OutboundMessage message) {
    SendResult result;
    try {
      result = emailProvider.send(message);
    } catch (RuntimeException e) {
      throw new DeliveryException(
          "Provider '" + emailProvider.providerId() + "' failed: " + e.getMessage(), e);
    }
    if (!result.success()) {
      throw new DeliveryException(
          "Provider '" + emailProvider.providerId() + "' failed: " + result.errorMessage());
    }
    log.info(
        "Email sent: ceId={}, provider={}, messageId={}, to={}",
        ctx.id(),
        emailProvider.providerId(),
        result.providerMessageId(),
        message.to());
  }
}
