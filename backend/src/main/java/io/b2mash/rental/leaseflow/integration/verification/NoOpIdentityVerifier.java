package io.b2mash.rental.leaseflow.integration.verification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Default verifier used when no provider is configured. Accepts every sub-step with full
 * confidence and logs what it would have checked.
 */
@Component
@ConditionalOnProperty(
    name = "leaseflow.verification.provider",
    havingValue = "noop",
    matchIfMissing = true)
public class NoOpIdentityVerifier implements IdentityVerifier {

  private static final Logger log = LoggerFactory.getLogger(NoOpIdentityVerifier.class);

  @Override
  public String verifierId() {
    return "noop";
  }

  @Override
  public VerificationResult verify(VerificationRequest request) {
    log.info(
        "NoOp verifier: would verify {} for {} on contract {} (payload {})",
        request.step(),
        request.partyRole(),
        request.contractId(),
        request.payloadRef());
    return VerificationResult.pass(1.0);
  }
}
