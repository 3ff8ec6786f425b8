package io.naemailer.pipeline;

/** How the pipeline finished with an event that did not fail. */
public enum EventOutcome {
  /** The filter rejected the event before any content was produced. */
  FILTERED,
  /** Neither the event nor the configuration named a recipient. */
  SKIPPED_NO_RECIPIENTS,
  /** Dry-run mode: the message was assembled and logged, not sent. */
  SKIPPED_DRY_RUN,
  /** The delivery provider accepted the message. */
  SENT
}
