package io.naemailer.message;

/** What happens to an assembled message. */
public enum Disposition {
  /** Hand the message to the delivery provider. */
  SEND,
  /** Neither the event nor the configuration named a recipient. */
  NO_RECIPIENTS,
  /** Dry-run mode: the message is logged but never sent. */
  DRY_RUN
}
