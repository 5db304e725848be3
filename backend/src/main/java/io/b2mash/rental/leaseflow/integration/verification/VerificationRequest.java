package io.b2mash.rental.leaseflow.integration.verification;

import io.b2mash.rental.leaseflow.contract.PartyRole;
import io.b2mash.rental.leaseflow.proofing.ProofStepName;
import java.util.UUID;

/**
 * One sub-step submitted for verification.
 *
 * @param payloadRef opaque reference to the captured material (an object key, not the bytes)
 */
public record VerificationRequest(
    UUID contractId, PartyRole partyRole, UUID partyId, ProofStepName step, String payloadRef) {}
