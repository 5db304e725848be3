package io.b2mash.rental.leaseflow.proofing;

import io.b2mash.rental.leaseflow.audit.AuditEventBuilder;
import io.b2mash.rental.leaseflow.audit.AuditService;
import io.b2mash.rental.leaseflow.contract.Actor;
import io.b2mash.rental.leaseflow.contract.ContractStateMachine;
import io.b2mash.rental.leaseflow.contract.ContractStatus;
import io.b2mash.rental.leaseflow.contract.ContractStore;
import io.b2mash.rental.leaseflow.contract.ContractTransition;
import io.b2mash.rental.leaseflow.contract.PartyRole;
import io.b2mash.rental.leaseflow.contract.RentalContract;
import io.b2mash.rental.leaseflow.event.ProofRecordCompletedEvent;
import io.b2mash.rental.leaseflow.exception.NotYourTurnException;
import io.b2mash.rental.leaseflow.exception.OutOfOrderStepException;
import io.b2mash.rental.leaseflow.integration.verification.VerificationRequest;
import java.time.Clock;
import java.util.Arrays;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Sequences identity proofing: accepts one sub-step at a time from the party holding the turn,
 * records the verifier's verdict, and hands the turn on when a party's record completes.
 *
 * <p>Submission checks run in this order: turn, record already complete, step already recorded
 * (idempotent success, version not checked), step out of order, version, verifier call.
 */
@Service
public class IdentityProofingService {

  private static final Logger log = LoggerFactory.getLogger(IdentityProofingService.class);

  private final ContractStore contractStore;
  private final ContractStateMachine stateMachine;
  private final TurnGuard turnGuard;
  private final ProofRecordRepository proofRecordRepository;
  private final ProofStepRepository proofStepRepository;
  private final VerificationGateway verificationGateway;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public IdentityProofingService(
      ContractStore contractStore,
      ContractStateMachine stateMachine,
      TurnGuard turnGuard,
      ProofRecordRepository proofRecordRepository,
      ProofStepRepository proofStepRepository,
      VerificationGateway verificationGateway,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.contractStore = contractStore;
    this.stateMachine = stateMachine;
    this.turnGuard = turnGuard;
    this.proofRecordRepository = proofRecordRepository;
    this.proofStepRepository = proofStepRepository;
    this.verificationGateway = verificationGateway;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  @Transactional
  public ProofStepResult submitStep(
      UUID contractId, int expectedVersion, Actor actor, ProofStepName step, String payloadRef) {
    var contract = contractStore.lockForUpdate(contractId);
    turnGuard.check(contract, actor);

    var sequence = loadSequence(contract, actor.role());
    var record = sequence.record();
    if (record.isComplete()) {
      throw new NotYourTurnException(
          turnGuard.turnFor(contract.getStatus()),
          null,
          "The " + actor.role() + " has already completed identity proofing");
    }

    if (sequence.isRecorded(step)) {
      log.debug(
          "Duplicate {} submission for {} on contract {} ignored", step, actor.role(), contractId);
      return result(contract, sequence, step, true, true, null);
    }

    var expected = sequence.nextExpectedStep();
    if (step != expected) {
      log.warn(
          "Out of order step on contract {}: {} submitted {} but {} is next",
          contractId,
          actor.role(),
          step,
          expected);
      throw new OutOfOrderStepException(expected, step);
    }

    contractStore.requireVersion(contract, expectedVersion);

    var proofStep = sequence.step(step);
    var outcome =
        verificationGateway.verify(
            new VerificationRequest(contractId, actor.role(), actor.partyId(), step, payloadRef));

    if (!outcome.passed()) {
      proofStep.recordFailure(outcome.failureReason());
      proofStepRepository.save(proofStep);
      auditService.log(
          stepAudit("proof_step.failed", contract, actor, record, step)
              .detail("attempts", proofStep.getAttempts())
              .detail("reason", outcome.failureReason())
              .build());
      return result(contract, sequence, step, false, false, outcome.failureReason());
    }

    var now = clock.instant();
    proofStep.recordPass(payloadRef, outcome.confidence(), now);
    proofStepRepository.save(proofStep);
    auditService.log(
        stepAudit("proof_step.completed", contract, actor, record, step)
            .detail("attempts", proofStep.getAttempts())
            .detail("confidence", outcome.confidence())
            .build());
    log.info("Contract {}: {} completed {}", contractId, actor.role(), step);

    if (sequence.allStepsCompleted()) {
      completeRecord(contract, record, actor);
    }
    contractStore.save(contract);
    return result(contract, sequence, step, true, false, null);
  }

  /**
   * Opens the tenant's proofing slot right after approval. The caller holds the contract lock and
   * saves the contract.
   */
  public void openTenantProofing(RentalContract contract) {
    openRecord(contract, PartyRole.TENANT);
    stateMachine.advance(contract, ContractTransition.OPEN_TENANT_PROOFING, Map.of());
  }

  private void completeRecord(RentalContract contract, ProofRecord record, Actor actor) {
    var now = clock.instant();
    record.markComplete(now);
    proofRecordRepository.save(record);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("proof_record.completed")
            .entityType("proof_record")
            .entityId(record.getId())
            .contractId(contract.getId())
            .actor(actor)
            .detail("party_role", record.getPartyRole().name())
            .build());
    eventPublisher.publishEvent(
        new ProofRecordCompletedEvent(
            "proof_record.completed",
            contract.getId(),
            actor.role(),
            actor.partyId(),
            now,
            record.getId()));
    handOver(contract, record.getPartyRole());
  }

  private void handOver(RentalContract contract, PartyRole completedRole) {
    switch (completedRole) {
      case TENANT -> {
        if (contract.hasGuarantor()) {
          stateMachine.advance(contract, ContractTransition.HAND_OVER_TO_GUARANTOR, Map.of());
          openRecord(contract, PartyRole.GUARANTOR);
        } else {
          stateMachine.advance(contract, ContractTransition.HAND_OVER_TO_LANDLORD, Map.of());
          openRecord(contract, PartyRole.LANDLORD);
        }
      }
      case GUARANTOR -> {
        stateMachine.advance(contract, ContractTransition.HAND_OVER_TO_LANDLORD, Map.of());
        openRecord(contract, PartyRole.LANDLORD);
      }
      case LANDLORD -> {
        stateMachine.advance(contract, ContractTransition.COMPLETE_PROOFING, Map.of());
        activateIfProven(contract);
      }
    }
  }

  private void activateIfProven(RentalContract contract) {
    var records = proofRecordRepository.findByContractId(contract.getId());
    var missing =
        contract.requiredProofingRoles().stream()
            .filter(
                role ->
                    records.stream()
                        .noneMatch(r -> r.getPartyRole() == role && r.isComplete()))
            .toList();
    if (!missing.isEmpty()) {
      log.error(
          "Contract {} reached {} with incomplete proof records for {}",
          contract.getId(),
          ContractStatus.READY_TO_ACTIVATE,
          missing);
      return;
    }
    contract.recordActivation(clock.instant());
    stateMachine.advance(contract, ContractTransition.ACTIVATE, Map.of());
  }

  private ProofRecord openRecord(RentalContract contract, PartyRole role) {
    var partyId = contract.partyIdFor(role);
    if (partyId == null) {
      throw new IllegalStateException(
          "Cannot open proofing for " + role + " on contract " + contract.getId());
    }
    var record = proofRecordRepository.save(new ProofRecord(contract.getId(), role, partyId));
    proofStepRepository.saveAll(
        Arrays.stream(ProofStepName.values()).map(n -> new ProofStep(record.getId(), n)).toList());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("proof_record.opened")
            .entityType("proof_record")
            .entityId(record.getId())
            .contractId(contract.getId())
            .detail("party_role", role.name())
            .build());
    log.info("Contract {}: opened proofing for {}", contract.getId(), role);
    return record;
  }

  private ProofSequence loadSequence(RentalContract contract, PartyRole role) {
    var record =
        proofRecordRepository
            .findByContractIdAndPartyRole(contract.getId(), role)
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "No proof record for " + role + " on contract " + contract.getId()));
    return new ProofSequence(
        record, proofStepRepository.findByProofRecordIdOrderByPositionAsc(record.getId()));
  }

  private static AuditEventBuilder stepAudit(
      String eventType,
      RentalContract contract,
      Actor actor,
      ProofRecord record,
      ProofStepName step) {
    return AuditEventBuilder.builder()
        .eventType(eventType)
        .entityType("proof_record")
        .entityId(record.getId())
        .contractId(contract.getId())
        .actor(actor)
        .detail("step", step.name());
  }

  private static ProofStepResult result(
      RentalContract contract,
      ProofSequence sequence,
      ProofStepName step,
      boolean accepted,
      boolean duplicate,
      String failureReason) {
    return new ProofStepResult(
        accepted,
        duplicate,
        step,
        sequence.record().isComplete(),
        contract.getStatus(),
        contract.getVersion(),
        sequence.nextExpectedStep(),
        sequence.step(step).getAttempts(),
        failureReason);
  }
}
