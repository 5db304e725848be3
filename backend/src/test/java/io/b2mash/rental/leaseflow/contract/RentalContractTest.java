package io.b2mash.rental.leaseflow.contract;

import static io.b2mash.rental.leaseflow.testutil.TestContractFactory.GUARANTOR_ID;
import static io.b2mash.rental.leaseflow.testutil.TestContractFactory.LANDLORD_ID;
import static io.b2mash.rental.leaseflow.testutil.TestContractFactory.TENANT_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.rental.leaseflow.exception.PreconditionFailedException;
import io.b2mash.rental.leaseflow.testutil.TestContractFactory;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class RentalContractTest {

  private static final Instant NOW = Instant.parse("2026-10-01T10:00:00Z");

  @Test
  void newContract_startsAsDraftAtVersionZero() {
    var contract = TestContractFactory.draft();

    assertThat(contract.getStatus()).isEqualTo(ContractStatus.DRAFT);
    assertThat(contract.getVersion()).isZero();
    assertThat(contract.getLandlordId()).isEqualTo(LANDLORD_ID);
    assertThat(contract.getTenantId()).isNull();
  }

  @Test
  void recordAcceptedMutation_incrementsVersionOnce() {
    var contract = TestContractFactory.draft();

    contract.recordAcceptedMutation(NOW);

    assertThat(contract.getVersion()).isEqualTo(1);
    assertThat(contract.getLastActivityAt()).isEqualTo(NOW);
  }

  @Test
  void updateTerms_outsideDraft_isRejected() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_REVIEW);

    assertThatThrownBy(() -> contract.updateTerms(TestContractFactory.completeTerms()))
        .isInstanceOf(PreconditionFailedException.class);
  }

  @Test
  void reviseTerms_withIncompleteTerms_listsMissingFields() {
    var contract = TestContractFactory.inStatus(ContractStatus.OBJECTIONS_PENDING);

    assertThatThrownBy(() -> contract.reviseTerms(ContractTerms.empty()))
        .isInstanceOfSatisfying(
            PreconditionFailedException.class,
            ex -> assertThat(ex.getViolations()).contains("monthlyRent", "startDate"));
  }

  @Test
  void attachTenant_twice_isRejected() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_REVIEW);
    contract.attachTenant(TENANT_ID, NOW);

    assertThatThrownBy(() -> contract.attachTenant(UUID.randomUUID(), NOW))
        .isInstanceOf(PreconditionFailedException.class);
    assertThat(contract.getTenantId()).isEqualTo(TENANT_ID);
    assertThat(contract.getTenantJoinedAt()).isEqualTo(NOW);
  }

  @Test
  void attachTenant_landlordAsTenant_isRejected() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_REVIEW);

    assertThatThrownBy(() -> contract.attachTenant(LANDLORD_ID, NOW))
        .isInstanceOf(PreconditionFailedException.class);
  }

  @Test
  void attachGuarantor_afterApproval_isRejected() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_PROOFING);

    assertThatThrownBy(() -> contract.attachGuarantor(GUARANTOR_ID))
        .isInstanceOf(PreconditionFailedException.class);
    assertThat(contract.hasGuarantor()).isFalse();
  }

  @Test
  void attachGuarantor_sameAsTenant_isRejected() {
    var contract = TestContractFactory.inStatus(ContractStatus.OBJECTIONS_PENDING);

    assertThatThrownBy(() -> contract.attachGuarantor(TENANT_ID))
        .isInstanceOf(PreconditionFailedException.class);
  }

  @Test
  void requiredProofingRoles_includeGuarantorOnlyWhenAttached() {
    var withoutGuarantor = TestContractFactory.draft();
    var withGuarantor = TestContractFactory.draft();
    withGuarantor.attachGuarantor(GUARANTOR_ID);

    assertThat(withoutGuarantor.requiredProofingRoles())
        .containsExactly(PartyRole.TENANT, PartyRole.LANDLORD);
    assertThat(withGuarantor.requiredProofingRoles())
        .containsExactly(PartyRole.TENANT, PartyRole.GUARANTOR, PartyRole.LANDLORD);
    assertThat(withGuarantor.partyIdFor(PartyRole.GUARANTOR)).isEqualTo(GUARANTOR_ID);
  }

  @Test
  void clearClosure_removesClosureData() {
    var contract = TestContractFactory.inStatus(ContractStatus.EXPIRED);
    contract.recordClosure(null, "lapsed", NOW);

    contract.clearClosure();

    assertThat(contract.getClosedAt()).isNull();
    assertThat(contract.getClosureReason()).isNull();
    assertThat(contract.getClosedByRole()).isNull();
  }
}
