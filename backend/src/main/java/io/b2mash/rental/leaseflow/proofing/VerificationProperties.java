package io.b2mash.rental.leaseflow.proofing;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for identity verification calls.
 *
 * @param minConfidence lowest verifier confidence accepted as a pass
 * @param timeout how long a single verifier call may take before it counts as a failed attempt
 * @param maxConcurrentCalls size of the thread pool that runs verifier calls
 */
@ConfigurationProperties(prefix = "leaseflow.verification")
public record VerificationProperties(
    double minConfidence, Duration timeout, int maxConcurrentCalls) {

  public VerificationProperties {
    if (minConfidence <= 0) {
      minConfidence = 0.7;
    }
    if (timeout == null) {
      timeout = Duration.ofSeconds(10);
    }
    if (maxConcurrentCalls <= 0) {
      maxConcurrentCalls = 8;
    }
  }
}
