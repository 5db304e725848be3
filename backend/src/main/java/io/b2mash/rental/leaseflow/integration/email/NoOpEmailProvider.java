package io.b2mash.rental.leaseflow.integration.email;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Default email provider. Logs email details instead of sending them. */
@Component
@ConditionalOnProperty(
    name = "leaseflow.email.provider",
    havingValue = "noop",
    matchIfMissing = true)
public class NoOpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpEmailProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    log.info(
        "NoOp email: would send to {} with subject '{}' ({})",
        message.to(),
        message.subject(),
        message.metadata().get("referenceType"));
    return new SendResult(true, "NOOP-" + UUID.randomUUID(), null);
  }
}
