package io.b2mash.rental.leaseflow.integration.verification;

import java.util.Map;

/**
 * Verdict of the verifier for one sub-step.
 *
 * @param passed the verifier's own pass/fail judgment
 * @param confidence match confidence in [0, 1]
 * @param reason failure reason reported by the verifier; null on success
 * @param metadata provider-specific data, stored nowhere but logs
 */
public record VerificationResult(
    boolean passed, double confidence, String reason, Map<String, String> metadata) {

  public VerificationResult {
    metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
  }

  public static VerificationResult pass(double confidence) {
    return new VerificationResult(true, confidence, null, Map.of());
  }

  public static VerificationResult fail(double confidence, String reason) {
    return new VerificationResult(false, confidence, reason, Map.of());
  }
}
