package io.b2mash.rental.leaseflow.integration.verification;

/**
 * Port for the external identity verifier (face, document and voice matching, signature capture
 * validation). Implementations only judge one sub-step; sequencing belongs to the caller.
 *
 * <p>Implementations may block. Callers invoke them under a timeout and treat any exception as a
 * failed attempt.
 */
public interface IdentityVerifier {

  /** Verifier identifier (e.g., "onfido", "noop"). */
  String verifierId();

  VerificationResult verify(VerificationRequest request);
}
