package io.b2mash.rental.leaseflow.contract;

import io.b2mash.rental.leaseflow.invitation.InvitationRepository;
import io.b2mash.rental.leaseflow.invitation.InvitationStatus;
import io.b2mash.rental.leaseflow.proofing.ProofRecord;
import io.b2mash.rental.leaseflow.proofing.ProofRecordRepository;
import io.b2mash.rental.leaseflow.proofing.ProofSequence;
import io.b2mash.rental.leaseflow.proofing.ProofStep;
import io.b2mash.rental.leaseflow.proofing.ProofStepName;
import io.b2mash.rental.leaseflow.proofing.ProofStepRepository;
import io.b2mash.rental.leaseflow.proofing.TurnGuard;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Builds {@link WorkflowStatus} views. Progress counts one unit for submission to review, one for
 * tenant approval, one per completed proofing step of every required party and one for activation.
 */
@Service
public class WorkflowStatusService {

  private static final int STEPS_PER_PARTY = ProofStepName.values().length;

  private final ContractStore contractStore;
  private final ProofRecordRepository proofRecordRepository;
  private final ProofStepRepository proofStepRepository;
  private final TurnGuard turnGuard;
  private final InvitationRepository invitationRepository;
  private final Clock clock;

  public WorkflowStatusService(
      ContractStore contractStore,
      ProofRecordRepository proofRecordRepository,
      ProofStepRepository proofStepRepository,
      TurnGuard turnGuard,
      InvitationRepository invitationRepository,
      Clock clock) {
    this.contractStore = contractStore;
    this.proofRecordRepository = proofRecordRepository;
    this.proofStepRepository = proofStepRepository;
    this.turnGuard = turnGuard;
    this.invitationRepository = invitationRepository;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public WorkflowStatus getStatus(UUID contractId) {
    var contract = contractStore.require(contractId);
    var records =
        proofRecordRepository.findByContractId(contractId).stream()
            .collect(Collectors.toMap(ProofRecord::getPartyRole, Function.identity()));
    var stepsByRecord =
        records.isEmpty()
            ? Map.<UUID, List<ProofStep>>of()
            : proofStepRepository
                .findByProofRecordIdIn(records.values().stream().map(ProofRecord::getId).toList())
                .stream()
                .collect(Collectors.groupingBy(ProofStep::getProofRecordId));

    var parties = new ArrayList<WorkflowStatus.PartyProgress>();
    for (var role : contract.requiredProofingRoles()) {
      var record = records.get(role);
      if (record == null) {
        parties.add(
            new WorkflowStatus.PartyProgress(
                role, contract.partyIdFor(role), false, 0, false, null));
        continue;
      }
      var sequence =
          new ProofSequence(record, stepsByRecord.getOrDefault(record.getId(), List.of()));
      parties.add(
          new WorkflowStatus.PartyProgress(
              role,
              record.getPartyId(),
              true,
              sequence.completedCount(),
              record.isComplete(),
              sequence.nextExpectedStep()));
    }

    var turn = turnGuard.turnFor(contract.getStatus());
    boolean lapsed = invitationLapsed(contract);
    return new WorkflowStatus(
        contract.getId(),
        contract.getStatus(),
        contract.getVersion(),
        turn,
        turn != null ? contract.partyIdFor(turn) : null,
        progressPercent(contract, parties),
        lapsed,
        List.copyOf(parties),
        nextStatuses(contract.getStatus(), lapsed));
  }

  private boolean invitationLapsed(RentalContract contract) {
    if (contract.getStatus() != ContractStatus.TENANT_REVIEW || contract.getTenantId() != null) {
      return false;
    }
    return invitationRepository
        .findByContractIdAndStatus(contract.getId(), InvitationStatus.ACTIVE)
        .map(invitation -> invitation.isExpiredAt(clock.instant()))
        .orElse(false);
  }

  private static Set<ContractStatus> nextStatuses(ContractStatus status, boolean lapsed) {
    var targets = ContractTransition.targetsFrom(status);
    if (!lapsed) {
      return targets;
    }
    // Approval and objections need a tenant, who can no longer join through this invitation.
    var remaining = EnumSet.copyOf(targets);
    remaining.remove(ContractStatus.TENANT_APPROVED);
    remaining.remove(ContractStatus.OBJECTIONS_PENDING);
    remaining.add(ContractStatus.EXPIRED);
    return remaining;
  }

  static int progressPercent(RentalContract contract, List<WorkflowStatus.PartyProgress> parties) {
    int total = 2 + STEPS_PER_PARTY * parties.size() + 1;
    int done = 0;
    if (contract.getSubmittedForReviewAt() != null) {
      done++;
    }
    if (contract.getTenantApprovedAt() != null) {
      done++;
    }
    for (var party : parties) {
      done += party.stepsCompleted();
    }
    if (contract.getStatus() == ContractStatus.ACTIVE) {
      done++;
    }
    return done * 100 / total;
  }
}
