package io.b2mash.rental.leaseflow.contract;

import io.b2mash.rental.leaseflow.proofing.ProofStepName;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Read model for clients rendering the workflow: whose turn it is, how far along each party is and
 * which statuses can follow.
 *
 * @param turn role allowed to submit the next proofing step; null outside proofing
 * @param waitingFor party id of the role holding the turn; null outside proofing
 * @param invitationLapsed the active invitation is past its deadline but not yet expired; the
 *     contract moves to EXPIRED on the next token use or sweep, so approval is no longer offered
 */
public record WorkflowStatus(
    UUID contractId,
    ContractStatus status,
    int version,
    PartyRole turn,
    UUID waitingFor,
    int progressPercent,
    boolean invitationLapsed,
    List<PartyProgress> parties,
    Set<ContractStatus> nextStatuses) {

  /**
   * Identity-proofing progress of one required party.
   *
   * @param stepsCompleted 0 to 4
   * @param nextStep next expected step; null before the party's record is opened or once complete
   */
  public record PartyProgress(
      PartyRole role,
      UUID partyId,
      boolean recordOpened,
      int stepsCompleted,
      boolean complete,
      ProofStepName nextStep) {}
}
