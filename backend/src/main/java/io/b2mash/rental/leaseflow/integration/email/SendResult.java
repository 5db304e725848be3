package io.b2mash.rental.leaseflow.integration.email;

/** Result of an email send attempt. */
public record SendResult(boolean success, String providerMessageId, String errorMessage) {}
