package io.b2mash.rental.leaseflow.proofing;

import io.b2mash.rental.leaseflow.contract.ContractStatus;

/**
 * Result of one proofing step submission.
 *
 * @param accepted true when the step is recorded (now or by an earlier identical submission)
 * @param duplicate true when the step had already been recorded and nothing changed
 * @param partyComplete true when the submitting party has completed all four steps
 * @param contractStatus contract status after the call
 * @param version contract version after the call
 * @param nextStep the party's next expected step, null when its record is complete
 * @param attempts verification attempts made on the submitted step so far
 * @param failureReason why verification failed; null when accepted
 */
public record ProofStepResult(
    boolean accepted,
    boolean duplicate,
    ProofStepName step,
    boolean partyComplete,
    ContractStatus contractStatus,
    int version,
    ProofStepName nextStep,
    int attempts,
    String failureReason) {}
