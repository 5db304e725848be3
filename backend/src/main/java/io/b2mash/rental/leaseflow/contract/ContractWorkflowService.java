package io.b2mash.rental.leaseflow.contract;

import io.b2mash.rental.leaseflow.audit.AuditEventBuilder;
import io.b2mash.rental.leaseflow.audit.AuditService;
import io.b2mash.rental.leaseflow.exception.PreconditionFailedException;
import io.b2mash.rental.leaseflow.exception.WrongActorException;
import io.b2mash.rental.leaseflow.invitation.InvitationService;
import io.b2mash.rental.leaseflow.proofing.IdentityProofingService;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Landlord and tenant operations on the contract itself: drafting, review submission, approval and
 * termination. Every mutating method locks the contract, checks the caller's expected version and
 * bumps it once on success.
 */
@Service
public class ContractWorkflowService {

  private static final Logger log = LoggerFactory.getLogger(ContractWorkflowService.class);

  private final ContractStore contractStore;
  private final ContractStateMachine stateMachine;
  private final InvitationService invitationService;
  private final IdentityProofingService identityProofingService;
  private final AuditService auditService;
  private final Clock clock;

  public ContractWorkflowService(
      ContractStore contractStore,
      ContractStateMachine stateMachine,
      InvitationService invitationService,
      IdentityProofingService identityProofingService,
      AuditService auditService,
      Clock clock) {
    this.contractStore = contractStore;
    this.stateMachine = stateMachine;
    this.invitationService = invitationService;
    this.identityProofingService = identityProofingService;
    this.auditService = auditService;
    this.clock = clock;
  }

  @Transactional
  public RentalContract createDraft(
      Actor actor, String landlordEmail, String tenantEmail, ContractTerms terms) {
    if (actor.role() != PartyRole.LANDLORD) {
      throw new WrongActorException(actor.role(), "Only a landlord can create a contract");
    }
    var contract =
        contractStore.create(
            new RentalContract(actor.partyId(), landlordEmail, tenantEmail, terms));
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("contract.created")
            .entityType("contract")
            .entityId(contract.getId())
            .contractId(contract.getId())
            .actor(actor)
            .detail("terms_complete", contract.getTerms().isComplete())
            .build());
    log.info("Landlord {} created draft contract {}", actor.partyId(), contract.getId());
    return contract;
  }

  @Transactional
  public RentalContract updateTerms(
      UUID contractId, int expectedVersion, Actor actor, ContractTerms terms) {
    var contract = contractStore.lockAtVersion(contractId, expectedVersion);
    stateMachine.requireParty(contract, actor, PartyRole.LANDLORD);
    contract.updateTerms(terms);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("contract.terms_updated")
            .entityType("contract")
            .entityId(contractId)
            .contractId(contractId)
            .actor(actor)
            .detail("terms", terms)
            .build());
    return contractStore.save(contract);
  }

  @Transactional
  public RentalContract attachGuarantor(
      UUID contractId, int expectedVersion, Actor actor, UUID guarantorId) {
    var contract = contractStore.lockAtVersion(contractId, expectedVersion);
    stateMachine.requireParty(contract, actor, PartyRole.LANDLORD);
    contract.attachGuarantor(guarantorId);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("contract.guarantor_attached")
            .entityType("contract")
            .entityId(contractId)
            .contractId(contractId)
            .actor(actor)
            .detail("guarantor_id", guarantorId)
            .build());
    log.info("Guarantor {} attached to contract {}", guarantorId, contractId);
    return contractStore.save(contract);
  }

  /** Moves a complete draft to tenant review and invites the tenant. */
  @Transactional
  public ReviewSubmission submitForReview(UUID contractId, int expectedVersion, Actor actor) {
    var contract = contractStore.lockAtVersion(contractId, expectedVersion);
    stateMachine.authorize(contract, ContractTransition.SUBMIT_FOR_REVIEW, actor);

    var missing = contract.getTerms().missingFields();
    if (!missing.isEmpty()) {
      throw new PreconditionFailedException("Contract terms are incomplete", missing);
    }
    boolean inviteTenant = contract.getTenantId() == null;
    if (inviteTenant
        && (contract.getTenantEmail() == null || contract.getTenantEmail().isBlank())) {
      throw new PreconditionFailedException(
          "A tenant email is required to invite the tenant", List.of("tenantEmail"));
    }

    stateMachine.apply(contract, ContractTransition.SUBMIT_FOR_REVIEW, actor, Map.of());
    contract.recordSubmittedForReview(clock.instant());
    var invitation = inviteTenant ? invitationService.issue(contract, actor, false) : null;
    contractStore.save(contract);
    return new ReviewSubmission(
        contract,
        invitation != null ? invitation.withContractVersion(contract.getVersion()) : null);
  }

  /** Tenant approval. Opens the tenant's identity proofing in the same call. */
  @Transactional
  public RentalContract approve(UUID contractId, int expectedVersion, Actor actor) {
    var contract = contractStore.lockAtVersion(contractId, expectedVersion);
    stateMachine.apply(contract, ContractTransition.APPROVE, actor, Map.of());
    contract.recordTenantApproval(clock.instant());
    identityProofingService.openTenantProofing(contract);
    return contractStore.save(contract);
  }

  @Transactional
  public RentalContract terminate(
      UUID contractId, int expectedVersion, Actor actor, String reason) {
    if (reason == null || reason.isBlank()) {
      throw new PreconditionFailedException("A termination reason is required", List.of("reason"));
    }
    var contract = contractStore.lockAtVersion(contractId, expectedVersion);
    stateMachine.apply(
        contract, ContractTransition.TERMINATE, actor, Map.of("reason", reason.strip()));
    contract.recordClosure(actor.role(), reason.strip(), clock.instant());
    invitationService.revokeActive(contract, actor);
    return contractStore.save(contract);
  }

  @Transactional(readOnly = true)
  public RentalContract getContract(UUID contractId) {
    return contractStore.require(contractId);
  }
}
