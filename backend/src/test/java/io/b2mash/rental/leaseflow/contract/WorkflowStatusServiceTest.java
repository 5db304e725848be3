package io.b2mash.rental.leaseflow.contract;

import static io.b2mash.rental.leaseflow.testutil.TestContractFactory.TENANT_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;

import io.b2mash.rental.leaseflow.invitation.ContractInvitation;
import io.b2mash.rental.leaseflow.invitation.InvitationRepository;
import io.b2mash.rental.leaseflow.invitation.InvitationStatus;
import io.b2mash.rental.leaseflow.proofing.ProofRecordRepository;
import io.b2mash.rental.leaseflow.proofing.ProofStepName;
import io.b2mash.rental.leaseflow.proofing.ProofStepRepository;
import io.b2mash.rental.leaseflow.proofing.TurnGuard;
import io.b2mash.rental.leaseflow.testutil.TestContractFactory;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WorkflowStatusServiceTest {

  private static final Instant NOW = Instant.parse("2026-10-01T10:00:00Z");

  @Mock private ContractStore contractStore;
  @Mock private ProofRecordRepository proofRecordRepository;
  @Mock private ProofStepRepository proofStepRepository;
  @Mock private InvitationRepository invitationRepository;

  private WorkflowStatusService service;

  @BeforeEach
  void setUp() {
    service =
        new WorkflowStatusService(
            contractStore,
            proofRecordRepository,
            proofStepRepository,
            new TurnGuard(),
            invitationRepository,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void getStatus_draft_hasNoTurnAndZeroProgress() {
    var contract = TestContractFactory.draft();
    when(contractStore.require(contract.getId())).thenReturn(contract);
    when(proofRecordRepository.findByContractId(contract.getId())).thenReturn(List.of());

    var status = service.getStatus(contract.getId());

    assertThat(status.status()).isEqualTo(ContractStatus.DRAFT);
    assertThat(status.turn()).isNull();
    assertThat(status.waitingFor()).isNull();
    assertThat(status.progressPercent()).isZero();
    assertThat(status.nextStatuses())
        .containsExactlyInAnyOrder(ContractStatus.TENANT_REVIEW, ContractStatus.TERMINATED);
    assertThat(status.parties())
        .extracting(WorkflowStatus.PartyProgress::role)
        .containsExactly(PartyRole.TENANT, PartyRole.LANDLORD);
  }

  @Test
  void getStatus_reviewWithLapsedInvitation_flagsItAndDropsApproval() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_REVIEW);
    stubReview(contract, NOW.minusSeconds(60));

    var status = service.getStatus(contract.getId());

    assertThat(status.status()).isEqualTo(ContractStatus.TENANT_REVIEW);
    assertThat(status.invitationLapsed()).isTrue();
    assertThat(status.nextStatuses())
        .contains(ContractStatus.EXPIRED, ContractStatus.TERMINATED)
        .doesNotContain(ContractStatus.TENANT_APPROVED, ContractStatus.OBJECTIONS_PENDING);
  }

  @Test
  void getStatus_reviewWithLiveInvitation_offersApproval() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_REVIEW);
    stubReview(contract, NOW);

    var status = service.getStatus(contract.getId());

    assertThat(status.invitationLapsed()).isFalse();
    assertThat(status.nextStatuses()).contains(ContractStatus.TENANT_APPROVED);
  }

  @Test
  void getStatus_tenantProofingHalfDone_reportsTurnAndNextStep() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_PROOFING);
    contract.recordSubmittedForReview(NOW);
    contract.recordTenantApproval(NOW);
    var record = TestContractFactory.proofRecord(contract, PartyRole.TENANT);
    when(contractStore.require(contract.getId())).thenReturn(contract);
    when(proofRecordRepository.findByContractId(contract.getId())).thenReturn(List.of(record));
    when(proofStepRepository.findByProofRecordIdIn(anyCollection()))
        .thenReturn(TestContractFactory.steps(record, 2));

    var status = service.getStatus(contract.getId());

    assertThat(status.turn()).isEqualTo(PartyRole.TENANT);
    assertThat(status.waitingFor()).isEqualTo(TENANT_ID);
    var tenant = status.parties().get(0);
    assertThat(tenant.recordOpened()).isTrue();
    assertThat(tenant.stepsCompleted()).isEqualTo(2);
    assertThat(tenant.nextStep()).isEqualTo(ProofStepName.VOICE);
    var landlord = status.parties().get(1);
    assertThat(landlord.recordOpened()).isFalse();
    assertThat(landlord.nextStep()).isNull();
    // submitted + approved + 2 steps, out of 2 + 4 * 2 + 1
    assertThat(status.progressPercent()).isEqualTo(4 * 100 / 11);
  }

  @Test
  void progressPercent_activeContract_isComplete() {
    var contract = TestContractFactory.inStatus(ContractStatus.ACTIVE, true);
    contract.recordSubmittedForReview(NOW);
    contract.recordTenantApproval(NOW);
    var parties =
        contract.requiredProofingRoles().stream()
            .map(
                role ->
                    new WorkflowStatus.PartyProgress(
                        role, contract.partyIdFor(role), true, 4, true, null))
            .toList();

    assertThat(WorkflowStatusService.progressPercent(contract, parties)).isEqualTo(100);
  }

  @Test
  void progressPercent_guarantorAddsToTheDenominator() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_PROOFING, true);
    contract.recordSubmittedForReview(NOW);
    contract.recordTenantApproval(NOW);
    var parties =
        contract.requiredProofingRoles().stream()
            .map(
                role ->
                    new WorkflowStatus.PartyProgress(
                        role, contract.partyIdFor(role), false, 0, false, null))
            .toList();

    // 2 done out of 2 + 4 * 3 + 1
    assertThat(WorkflowStatusService.progressPercent(contract, parties)).isEqualTo(13);
  }

  private void stubReview(RentalContract contract, Instant invitationExpiresAt) {
    var invitation =
        new ContractInvitation(
            contract.getId(),
            "hash",
            contract.getTenantEmail(),
            contract.getLandlordId(),
            invitationExpiresAt);
    when(contractStore.require(contract.getId())).thenReturn(contract);
    when(proofRecordRepository.findByContractId(contract.getId())).thenReturn(List.of());
    when(invitationRepository.findByContractIdAndStatus(contract.getId(), InvitationStatus.ACTIVE))
        .thenReturn(Optional.of(invitation));
  }
}
