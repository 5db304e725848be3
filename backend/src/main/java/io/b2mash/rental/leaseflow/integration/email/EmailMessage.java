package io.b2mash.rental.leaseflow.integration.email;

import java.util.Map;
import java.util.Objects;

/** Provider-agnostic email payload with optional metadata for tracking. */
public record EmailMessage(
    String to, String subject, String plainTextBody, Map<String, String> metadata) {

  /** Compact constructor, validates required fields. */
  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
  }

  /**
   * Builds a message tagged with the contract it concerns.
   *
   * @param referenceType the kind of notification (e.g., "INVITATION", "OBJECTIONS")
   * @param contractId the contract the email is about
   */
  public static EmailMessage forContract(
      String to, String subject, String plainTextBody, String referenceType, String contractId) {
    Objects.requireNonNull(referenceType, "referenceType");
    Objects.requireNonNull(contractId, "contractId");
    return new EmailMessage(
        to,
        subject,
        plainTextBody,
        Map.of("referenceType", referenceType, "contractId", contractId));
  }
}
