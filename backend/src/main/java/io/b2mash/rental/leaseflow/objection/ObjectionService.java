package io.b2mash.rental.leaseflow.objection;

import io.b2mash.rental.leaseflow.audit.AuditEventBuilder;
import io.b2mash.rental.leaseflow.audit.AuditService;
import io.b2mash.rental.leaseflow.contract.Actor;
import io.b2mash.rental.leaseflow.contract.ContractStateMachine;
import io.b2mash.rental.leaseflow.contract.ContractStore;
import io.b2mash.rental.leaseflow.contract.ContractTerms;
import io.b2mash.rental.leaseflow.contract.ContractTransition;
import io.b2mash.rental.leaseflow.contract.RentalContract;
import io.b2mash.rental.leaseflow.event.ObjectionsSubmittedEvent;
import io.b2mash.rental.leaseflow.exception.PreconditionFailedException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The review loop: the tenant raises objections from TENANT_REVIEW, the landlord answers by
 * revising the terms (or just acknowledging) and re-submitting. There is no limit on rounds.
 */
@Service
public class ObjectionService {

  private static final Logger log = LoggerFactory.getLogger(ObjectionService.class);

  private final ObjectionRepository objectionRepository;
  private final ContractStore contractStore;
  private final ContractStateMachine stateMachine;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public ObjectionService(
      ObjectionRepository objectionRepository,
      ContractStore contractStore,
      ContractStateMachine stateMachine,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.objectionRepository = objectionRepository;
    this.contractStore = contractStore;
    this.stateMachine = stateMachine;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  @Transactional
  public RentalContract submitObjections(
      UUID contractId, int expectedVersion, Actor actor, List<ObjectionSubmission> objections) {
    var contract = contractStore.lockAtVersion(contractId, expectedVersion);
    stateMachine.authorize(contract, ContractTransition.RAISE_OBJECTIONS, actor);
    requireText(objections);

    int sequence = (int) objectionRepository.countByContractId(contractId);
    var saved = new ArrayList<ContractObjection>();
    for (var submission : objections) {
      var objection =
          objectionRepository.save(
              new ContractObjection(
                  contractId,
                  ++sequence,
                  actor.partyId(),
                  submission.text().strip(),
                  blankToNull(submission.fieldReference()),
                  blankToNull(submission.proposedModification())));
      saved.add(objection);
      auditService.log(
          AuditEventBuilder.builder()
              .eventType("objection.created")
              .entityType("objection")
              .entityId(objection.getId())
              .contractId(contractId)
              .actor(actor)
              .detail("sequence", objection.getSequenceNumber())
              .detail("field_reference", objection.getFieldReference())
              .build());
    }

    stateMachine.apply(
        contract,
        ContractTransition.RAISE_OBJECTIONS,
        actor,
        Map.of("objection_count", saved.size()));
    eventPublisher.publishEvent(
        new ObjectionsSubmittedEvent(
            "objections.submitted",
            contractId,
            actor.role(),
            actor.partyId(),
            clock.instant(),
            saved.size(),
            contract.getLandlordEmail()));
    log.info("Tenant raised {} objection(s) on contract {}", saved.size(), contractId);
    return contractStore.save(contract);
  }

  /**
   * Sends the contract back to the tenant. {@code newTerms} replaces the terms when present; null
   * means the landlord keeps the terms and only acknowledges the objections.
   */
  @Transactional
  public RentalContract reviseAndResubmit(
      UUID contractId, int expectedVersion, Actor actor, ContractTerms newTerms, String response) {
    var contract = contractStore.lockAtVersion(contractId, expectedVersion);
    stateMachine.authorize(contract, ContractTransition.RESUBMIT_FOR_REVIEW, actor);

    boolean termsChanged = newTerms != null && !newTerms.equals(contract.getTerms());
    if (newTerms != null) {
      contract.reviseTerms(newTerms);
    }

    var now = clock.instant();
    var unresolved =
        objectionRepository.findByContractIdAndResolvedFalseOrderBySequenceNumberAsc(contractId);
    var trimmedResponse = blankToNull(response);
    for (var objection : unresolved) {
      objection.resolve(trimmedResponse, now);
    }
    objectionRepository.saveAll(unresolved);

    stateMachine.apply(
        contract,
        ContractTransition.RESUBMIT_FOR_REVIEW,
        actor,
        Map.of("resolved_objections", unresolved.size(), "terms_changed", termsChanged));
    log.info(
        "Landlord resubmitted contract {} resolving {} objection(s), terms changed: {}",
        contractId,
        unresolved.size(),
        termsChanged);
    return contractStore.save(contract);
  }

  @Transactional(readOnly = true)
  public List<ContractObjection> listObjections(UUID contractId) {
    contractStore.require(contractId);
    return objectionRepository.findByContractIdOrderBySequenceNumberAsc(contractId);
  }

  private static void requireText(List<ObjectionSubmission> objections) {
    if (objections == null || objections.isEmpty()) {
      throw new PreconditionFailedException(
          "At least one objection is required", List.of("objections"));
    }
    var violations = new ArrayList<String>();
    for (int i = 0; i < objections.size(); i++) {
      var submission = objections.get(i);
      if (submission == null || submission.text() == null || submission.text().isBlank()) {
        violations.add("objections[" + i + "].text");
      }
    }
    if (!violations.isEmpty()) {
      throw new PreconditionFailedException("Objection text must not be empty", violations);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.strip();
  }
}
