package io.b2mash.rental.leaseflow.proofing;

/**
 * What the proofing aggregator records for one verifier call. Timeouts, verifier exceptions and
 * low-confidence passes all become failed outcomes.
 */
public record VerificationOutcome(boolean passed, double confidence, String failureReason) {

  public static VerificationOutcome passed(double confidence) {
    return new VerificationOutcome(true, confidence, null);
  }

  public static VerificationOutcome failed(double confidence, String reason) {
    return new VerificationOutcome(false, confidence, reason);
  }
}
