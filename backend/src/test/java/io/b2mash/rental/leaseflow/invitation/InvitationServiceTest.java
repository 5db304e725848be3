package io.b2mash.rental.leaseflow.invitation;

import static io.b2mash.rental.leaseflow.testutil.TestContractFactory.LANDLORD_ID;
import static io.b2mash.rental.leaseflow.testutil.TestContractFactory.TENANT_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.rental.leaseflow.audit.AuditService;
import io.b2mash.rental.leaseflow.contract.Actor;
import io.b2mash.rental.leaseflow.contract.ContractStateMachine;
import io.b2mash.rental.leaseflow.contract.ContractStatus;
import io.b2mash.rental.leaseflow.contract.ContractStore;
import io.b2mash.rental.leaseflow.contract.RentalContract;
import io.b2mash.rental.leaseflow.event.InvitationIssuedEvent;
import io.b2mash.rental.leaseflow.exception.PreconditionFailedException;
import io.b2mash.rental.leaseflow.exception.ResourceNotFoundException;
import io.b2mash.rental.leaseflow.exception.TokenAlreadyConsumedException;
import io.b2mash.rental.leaseflow.exception.TokenExpiredException;
import io.b2mash.rental.leaseflow.testutil.TestContractFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class InvitationServiceTest {

  private static final Instant NOW = Instant.parse("2026-10-01T10:00:00Z");
  private static final String RAW_TOKEN = "raw-token";

  @Mock private InvitationRepository invitationRepository;
  @Mock private ContractStore contractStore;
  @Mock private AuditService auditService;
  @Mock private ApplicationEventPublisher eventPublisher;

  private final InvitationTokens invitationTokens =
      new InvitationTokens(new InvitationProperties(7, 32));
  private InvitationService service;

  @BeforeEach
  void setUp() {
    var clock = Clock.fixed(NOW, ZoneOffset.UTC);
    service =
        new InvitationService(
            invitationRepository,
            invitationTokens,
            new InvitationProperties(7, 32),
            contractStore,
            new ContractStateMachine(auditService, eventPublisher, clock),
            auditService,
            eventPublisher,
            clock);
  }

  @Test
  void issue_revokesPreviousAndStoresOnlyTheHash() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_REVIEW);
    var previous = invitation(contract, "old", NOW.plus(Duration.ofDays(3)));
    when(invitationRepository.findByContractIdAndStatus(contract.getId(), InvitationStatus.ACTIVE))
        .thenReturn(Optional.of(previous));
    stubSave();

    var issued = service.issue(contract, landlord(), true);

    assertThat(previous.getStatus()).isEqualTo(InvitationStatus.REVOKED);
    verify(invitationRepository).saveAndFlush(previous);
    assertThat(issued.expiresAt()).isEqualTo(NOW.plus(Duration.ofDays(7)));
    var saved = ArgumentCaptor.forClass(ContractInvitation.class);
    verify(invitationRepository).save(saved.capture());
    assertThat(saved.getValue().getTokenHash()).isEqualTo(invitationTokens.hash(issued.token()));
    assertThat(saved.getValue().getTokenHash()).isNotEqualTo(issued.token());
    assertThat(saved.getValue().getIssuedTo()).isEqualTo("tenant@example.com");
    var event = ArgumentCaptor.forClass(InvitationIssuedEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().rawToken()).isEqualTo(issued.token());
    assertThat(event.getValue().reissue()).isTrue();
  }

  @Test
  void issue_withoutTenantEmail_isRejected() {
    var contract = new RentalContract(LANDLORD_ID, null, " ", TestContractFactory.completeTerms());

    assertThatThrownBy(() -> service.issue(contract, landlord(), false))
        .isInstanceOf(PreconditionFailedException.class);
    verify(invitationRepository, never()).save(any());
  }

  @Test
  void accept_activeToken_attachesTenantAndConsumes() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_REVIEW);
    var invitation = stubToken(contract, NOW.plus(Duration.ofDays(1)));

    var accepted = service.accept(RAW_TOKEN, TENANT_ID);

    assertThat(accepted.contractId()).isEqualTo(contract.getId());
    assertThat(contract.getTenantId()).isEqualTo(TENANT_ID);
    assertThat(contract.getTenantJoinedAt()).isEqualTo(NOW);
    assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.CONSUMED);
    assertThat(invitation.getConsumedBy()).isEqualTo(TENANT_ID);
    verify(contractStore).save(contract);
  }

  @Test
  void accept_consumedToken_isRejected() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_REVIEW);
    var invitation = stubToken(contract, NOW.plus(Duration.ofDays(1)));
    invitation.markConsumed(UUID.randomUUID(), NOW);

    assertThatThrownBy(() -> service.accept(RAW_TOKEN, TENANT_ID))
        .isInstanceOf(TokenAlreadyConsumedException.class);
    verify(contractStore, never()).save(any());
  }

  @Test
  void accept_lapsedToken_expiresInvitationAndContract() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_REVIEW);
    var invitation = stubToken(contract, NOW.minusSeconds(1));

    assertThatThrownBy(() -> service.accept(RAW_TOKEN, TENANT_ID))
        .isInstanceOf(TokenExpiredException.class);

    assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.EXPIRED);
    assertThat(contract.getStatus()).isEqualTo(ContractStatus.EXPIRED);
    assertThat(contract.getTenantId()).isNull();
    assertThat(contract.getClosedAt()).isEqualTo(NOW);
    verify(contractStore).save(contract);
  }

  @Test
  void accept_revokedToken_isTreatedAsExpired() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_REVIEW);
    var invitation = stubToken(contract, NOW.plus(Duration.ofDays(1)));
    invitation.markRevoked(NOW);

    assertThatThrownBy(() -> service.accept(RAW_TOKEN, TENANT_ID))
        .isInstanceOf(TokenExpiredException.class);
    assertThat(contract.getStatus()).isEqualTo(ContractStatus.TENANT_REVIEW);
  }

  @Test
  void accept_unknownToken_isNotFound() {
    when(invitationRepository.findByTokenHash(invitationTokens.hash("nope")))
        .thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.accept("nope", TENANT_ID))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void reissue_afterExpiry_reopensReviewWithNewInvitation() {
    var contract = TestContractFactory.inStatus(ContractStatus.EXPIRED);
    contract.recordClosure(null, "lapsed", NOW.minusSeconds(60));
    when(contractStore.lockAtVersion(contract.getId(), 4)).thenReturn(contract);
    when(invitationRepository.findByContractIdAndStatus(contract.getId(), InvitationStatus.ACTIVE))
        .thenReturn(Optional.empty());
    stubSave();

    var issued = service.reissue(contract.getId(), 4, landlord());

    assertThat(issued.token()).isNotBlank();
    assertThat(contract.getStatus()).isEqualTo(ContractStatus.TENANT_REVIEW);
    assertThat(contract.getClosedAt()).isNull();
    verify(contractStore).save(contract);
  }

  @Test
  void reissue_afterTenantJoined_isRejected() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_REVIEW);
    TestContractFactory.attachTenant(contract);
    when(contractStore.lockAtVersion(contract.getId(), 2)).thenReturn(contract);

    assertThatThrownBy(() -> service.reissue(contract.getId(), 2, landlord()))
        .isInstanceOf(PreconditionFailedException.class);
    verify(invitationRepository, never()).save(any());
  }

  @Test
  void reissue_fromDraft_isRejected() {
    var contract = TestContractFactory.draft();
    when(contractStore.lockAtVersion(contract.getId(), 0)).thenReturn(contract);

    assertThatThrownBy(() -> service.reissue(contract.getId(), 0, landlord()))
        .isInstanceOf(PreconditionFailedException.class);
  }

  @Test
  void expireIfLapsed_notYetDue_doesNothing() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_REVIEW);
    var invitation = invitation(contract, "h", NOW.plusSeconds(1));
    when(contractStore.lockForUpdate(contract.getId())).thenReturn(contract);
    when(invitationRepository.findByContractIdAndStatus(contract.getId(), InvitationStatus.ACTIVE))
        .thenReturn(Optional.of(invitation));

    assertThat(service.expireIfLapsed(contract.getId())).isFalse();
    assertThat(contract.getStatus()).isEqualTo(ContractStatus.TENANT_REVIEW);
    verify(contractStore, never()).save(any());
  }

  @Test
  void expireIfLapsed_due_expiresContract() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_REVIEW);
    var invitation = invitation(contract, "h", NOW);
    when(contractStore.lockForUpdate(contract.getId())).thenReturn(contract);
    when(invitationRepository.findByContractIdAndStatus(contract.getId(), InvitationStatus.ACTIVE))
        .thenReturn(Optional.of(invitation));

    assertThat(service.expireIfLapsed(contract.getId())).isTrue();
    assertThat(contract.getStatus()).isEqualTo(ContractStatus.EXPIRED);
    assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.EXPIRED);
  }

  private ContractInvitation stubToken(RentalContract contract, Instant expiresAt) {
    var hash = invitationTokens.hash(RAW_TOKEN);
    var invitation = invitation(contract, hash, expiresAt);
    when(invitationRepository.findByTokenHash(hash)).thenReturn(Optional.of(invitation));
    when(contractStore.lockForUpdate(contract.getId())).thenReturn(contract);
    when(invitationRepository.findByTokenHashForUpdate(hash)).thenReturn(Optional.of(invitation));
    return invitation;
  }

  private static ContractInvitation invitation(
      RentalContract contract, String hash, Instant expiresAt) {
    var invitation =
        new ContractInvitation(
            contract.getId(), hash, contract.getTenantEmail(), LANDLORD_ID, expiresAt);
    ReflectionTestUtils.setField(invitation, "id", UUID.randomUUID());
    return invitation;
  }

  private void stubSave() {
    when(invitationRepository.save(any(ContractInvitation.class)))
        .thenAnswer(
            inv -> {
              ContractInvitation invitation = inv.getArgument(0);
              ReflectionTestUtils.setField(invitation, "id", UUID.randomUUID());
              return invitation;
            });
  }

  private static Actor landlord() {
    return Actor.landlord(LANDLORD_ID);
  }
}
