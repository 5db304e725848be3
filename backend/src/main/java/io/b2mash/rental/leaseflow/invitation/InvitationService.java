package io.b2mash.rental.leaseflow.invitation;

import io.b2mash.rental.leaseflow.audit.AuditEventBuilder;
import io.b2mash.rental.leaseflow.audit.AuditService;
import io.b2mash.rental.leaseflow.contract.Actor;
import io.b2mash.rental.leaseflow.contract.ContractStateMachine;
import io.b2mash.rental.leaseflow.contract.ContractStatus;
import io.b2mash.rental.leaseflow.contract.ContractStore;
import io.b2mash.rental.leaseflow.contract.ContractTransition;
import io.b2mash.rental.leaseflow.contract.PartyRole;
import io.b2mash.rental.leaseflow.contract.RentalContract;
import io.b2mash.rental.leaseflow.event.InvitationIssuedEvent;
import io.b2mash.rental.leaseflow.exception.PreconditionFailedException;
import io.b2mash.rental.leaseflow.exception.ResourceNotFoundException;
import io.b2mash.rental.leaseflow.exception.TokenAlreadyConsumedException;
import io.b2mash.rental.leaseflow.exception.TokenExpiredException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Token lifecycle for tenant invitations: issue, re-issue, accept (exactly once) and expire.
 *
 * <p>Expiry is checked lazily when a token is presented. {@link InvitationExpiryProcessor} only
 * makes the same transition earlier for contracts nobody touches.
 */
@Service
public class InvitationService {

  private static final Logger log = LoggerFactory.getLogger(InvitationService.class);

  private final InvitationRepository invitationRepository;
  private final InvitationTokens invitationTokens;
  private final InvitationProperties properties;
  private final ContractStore contractStore;
  private final ContractStateMachine stateMachine;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public InvitationService(
      InvitationRepository invitationRepository,
      InvitationTokens invitationTokens,
      InvitationProperties properties,
      ContractStore contractStore,
      ContractStateMachine stateMachine,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.invitationRepository = invitationRepository;
    this.invitationTokens = invitationTokens;
    this.properties = properties;
    this.contractStore = contractStore;
    this.stateMachine = stateMachine;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /**
   * Issues a new invitation for the contract's tenant email, revoking any active one first. Runs in
   * the caller's transaction; the caller holds the contract lock and saves the contract.
   */
  public IssuedInvitation issue(RentalContract contract, Actor issuedBy, boolean reissue) {
    if (contract.getTenantEmail() == null || contract.getTenantEmail().isBlank()) {
      throw new PreconditionFailedException(
          "Contract has no tenant email to invite", List.of("tenantEmail"));
    }
    revokeActive(contract, issuedBy);

    var now = clock.instant();
    var rawToken = invitationTokens.generate();
    var expiresAt = now.plus(Duration.ofDays(properties.expiryDays()));
    var invitation =
        invitationRepository.save(
            new ContractInvitation(
                contract.getId(),
                invitationTokens.hash(rawToken),
                contract.getTenantEmail(),
                issuedBy.partyId(),
                expiresAt));

    auditService.log(
        AuditEventBuilder.builder()
            .eventType(reissue ? "invitation.reissued" : "invitation.issued")
            .entityType("invitation")
            .entityId(invitation.getId())
            .contractId(contract.getId())
            .actor(issuedBy)
            .detail("expires_at", expiresAt)
            .build());
    eventPublisher.publishEvent(
        new InvitationIssuedEvent(
            reissue ? "invitation.reissued" : "invitation.issued",
            contract.getId(),
            issuedBy.role(),
            issuedBy.partyId(),
            now,
            invitation.getId(),
            contract.getTenantEmail(),
            rawToken,
            expiresAt,
            reissue));
    log.info(
        "Issued invitation {} for contract {}, expires {}",
        invitation.getId(),
        contract.getId(),
        expiresAt);
    return new IssuedInvitation(
        invitation.getId(), contract.getId(), rawToken, expiresAt, contract.getVersion());
  }

  /**
   * Replaces the contract's invitation with a new one. Allowed while the tenant has not joined and
   * the contract is in review, or after the contract expired because an invitation lapsed.
   */
  @Transactional
  public IssuedInvitation reissue(UUID contractId, int expectedVersion, Actor actor) {
    var contract = contractStore.lockAtVersion(contractId, expectedVersion);
    if (contract.getStatus() == ContractStatus.EXPIRED) {
      stateMachine.apply(
          contract, ContractTransition.REISSUE_AFTER_EXPIRY, actor, Map.of("reason", "reissue"));
      contract.clearClosure();
    } else if (contract.getStatus() == ContractStatus.TENANT_REVIEW) {
      stateMachine.requireParty(contract, actor, PartyRole.LANDLORD);
      if (contract.getTenantId() != null) {
        throw new PreconditionFailedException(
            "The tenant has already joined contract " + contractId);
      }
    } else {
      throw new PreconditionFailedException(
          "Invitations can only be re-issued in TENANT_REVIEW or EXPIRED (status is "
              + contract.getStatus()
              + ")");
    }
    var issued = issue(contract, actor, true);
    contractStore.save(contract);
    return issued.withContractVersion(contract.getVersion());
  }

  /**
   * Consumes an invitation token and attaches {@code tenantId} to its contract.
   *
   * <p>A token presented after its deadline expires the invitation and, if the contract is still
   * waiting for its tenant, the contract too. That change is committed before {@link
   * TokenExpiredException} reaches the caller.
   *
   * @throws TokenAlreadyConsumedException if the token was used before
   * @throws TokenExpiredException if the token lapsed or was superseded
   */
  @Transactional(noRollbackFor = TokenExpiredException.class)
  public AcceptedInvitation accept(String rawToken, UUID tenantId) {
    var tokenHash = invitationTokens.hash(rawToken);
    var contractId =
        invitationRepository
            .findByTokenHash(tokenHash)
            .map(ContractInvitation::getContractId)
            .orElseThrow(() -> new ResourceNotFoundException("Invitation", "the provided token"));

    // Contract lock first, then invitation lock: same order as every other writer.
    var contract = contractStore.lockForUpdate(contractId);
    var invitation =
        invitationRepository
            .findByTokenHashForUpdate(tokenHash)
            .orElseThrow(() -> new ResourceNotFoundException("Invitation", "the provided token"));

    switch (invitation.getStatus()) {
      case CONSUMED -> {
        log.warn("Invitation {} presented again after use", invitation.getId());
        throw new TokenAlreadyConsumedException();
      }
      case EXPIRED -> throw expiredToken(invitation, "This invitation has expired");
      case REVOKED ->
          throw expiredToken(invitation, "This invitation was replaced or withdrawn");
      case ACTIVE -> {
        // handled below
      }
    }

    var now = clock.instant();
    if (invitation.isExpiredAt(now)) {
      expire(contract, invitation, null);
      throw expiredToken(invitation, "This invitation has expired");
    }
    if (contract.getStatus() != ContractStatus.TENANT_REVIEW) {
      throw new PreconditionFailedException(
          "Contract is not awaiting its tenant (status is " + contract.getStatus() + ")");
    }

    contract.attachTenant(tenantId, now);
    invitation.markConsumed(tenantId, now);
    invitationRepository.save(invitation);
    var tenant = Actor.tenant(tenantId);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invitation.accepted")
            .entityType("invitation")
            .entityId(invitation.getId())
            .contractId(contractId)
            .actor(tenant)
            .build());
    contractStore.save(contract);
    log.info("Invitation {} accepted, tenant joined contract {}", invitation.getId(), contractId);
    return new AcceptedInvitation(contractId, contract.getVersion());
  }

  /**
   * Expires the contract's active invitation if its deadline has passed. Used by the sweep.
   *
   * @return true if an invitation was expired
   */
  @Transactional
  public boolean expireIfLapsed(UUID contractId) {
    var contract = contractStore.lockForUpdate(contractId);
    var active =
        invitationRepository.findByContractIdAndStatus(contractId, InvitationStatus.ACTIVE);
    if (active.isEmpty() || !active.get().isExpiredAt(clock.instant())) {
      return false;
    }
    expire(contract, active.get(), "SCHEDULED");
    return true;
  }

  /** Revokes the active invitation, if any. Runs in the caller's transaction. */
  public void revokeActive(RentalContract contract, Actor actor) {
    invitationRepository
        .findByContractIdAndStatus(contract.getId(), InvitationStatus.ACTIVE)
        .ifPresent(
            invitation -> {
              invitation.markRevoked(clock.instant());
              invitationRepository.saveAndFlush(invitation);
              auditService.log(
                  AuditEventBuilder.builder()
                      .eventType("invitation.revoked")
                      .entityType("invitation")
                      .entityId(invitation.getId())
                      .contractId(contract.getId())
                      .actor(actor)
                      .build());
              log.info(
                  "Revoked invitation {} for contract {}", invitation.getId(), contract.getId());
            });
  }

  @Transactional(readOnly = true)
  public List<ContractInvitation> listForContract(UUID contractId) {
    contractStore.require(contractId);
    return invitationRepository.findByContractIdOrderByCreatedAtDesc(contractId);
  }

  private void expire(RentalContract contract, ContractInvitation invitation, String source) {
    var now = clock.instant();
    invitation.markExpired(now);
    invitationRepository.save(invitation);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invitation.expired")
            .entityType("invitation")
            .entityId(invitation.getId())
            .contractId(contract.getId())
            .source(source)
            .detail("expires_at", invitation.getExpiresAt())
            .build());

    if (contract.getStatus() == ContractStatus.TENANT_REVIEW && contract.getTenantId() == null) {
      stateMachine.advance(
          contract, ContractTransition.EXPIRE_INVITATION, Map.of("invitation", invitation.getId()));
      contract.recordClosure(null, "Invitation expired before the tenant joined", now);
    }
    contractStore.save(contract);
    log.info("Invitation {} for contract {} expired", invitation.getId(), contract.getId());
  }

  private static TokenExpiredException expiredToken(ContractInvitation invitation, String detail) {
    log.warn("Invitation {} rejected: {}", invitation.getId(), detail);
    return new TokenExpiredException(invitation.getExpiresAt(), detail);
  }
}
