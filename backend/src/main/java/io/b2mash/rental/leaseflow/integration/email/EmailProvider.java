package io.b2mash.rental.leaseflow.integration.email;

/** Port for sending workflow notifications through an external email provider. */
public interface EmailProvider {

  /** Provider identifier (e.g., "smtp", "sendgrid", "noop"). */
  String providerId();

  /** Send an email message. */
  SendResult sendEmail(EmailMessage message);
}
