package io.naemailer.integration.email;

/** Outcome of a single delivery attempt. */
public record SendResult(boolean success, String providerMessageId, String errorMessage) {}
