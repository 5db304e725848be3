package io.b2mash.rental.leaseflow.objection;

import static io.b2mash.rental.leaseflow.testutil.TestContractFactory.LANDLORD_ID;
import static io.b2mash.rental.leaseflow.testutil.TestContractFactory.TENANT_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.rental.leaseflow.audit.AuditService;
import io.b2mash.rental.leaseflow.contract.Actor;
import io.b2mash.rental.leaseflow.contract.ContractStateMachine;
import io.b2mash.rental.leaseflow.contract.ContractStatus;
import io.b2mash.rental.leaseflow.contract.ContractStore;
import io.b2mash.rental.leaseflow.contract.ContractTerms;
import io.b2mash.rental.leaseflow.contract.RentalContract;
import io.b2mash.rental.leaseflow.event.ObjectionsSubmittedEvent;
import io.b2mash.rental.leaseflow.exception.IllegalTransitionException;
import io.b2mash.rental.leaseflow.exception.PreconditionFailedException;
import io.b2mash.rental.leaseflow.exception.WrongActorException;
import io.b2mash.rental.leaseflow.testutil.TestContractFactory;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
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
class ObjectionServiceTest {

  private static final Instant NOW = Instant.parse("2026-10-01T10:00:00Z");

  @Mock private ObjectionRepository objectionRepository;
  @Mock private ContractStore contractStore;
  @Mock private AuditService auditService;
  @Mock private ApplicationEventPublisher eventPublisher;

  private ObjectionService service;

  @BeforeEach
  void setUp() {
    var clock = Clock.fixed(NOW, ZoneOffset.UTC);
    service =
        new ObjectionService(
            objectionRepository,
            contractStore,
            new ContractStateMachine(auditService, eventPublisher, clock),
            auditService,
            eventPublisher,
            clock);
  }

  @Test
  void submitObjections_storesEachInSequenceAndMovesToPending() {
    var contract = reviewWithTenant();
    when(objectionRepository.countByContractId(contract.getId())).thenReturn(2L);
    stubSave();

    service.submitObjections(
        contract.getId(),
        3,
        tenant(),
        List.of(
            new ObjectionSubmission(" Rent too high ", "monthlyRent", "1000.00"),
            ObjectionSubmission.of("Start later")));

    assertThat(contract.getStatus()).isEqualTo(ContractStatus.OBJECTIONS_PENDING);
    var saved = ArgumentCaptor.forClass(ContractObjection.class);
    verify(objectionRepository, times(2)).save(saved.capture());
    assertThat(saved.getAllValues())
        .extracting(ContractObjection::getSequenceNumber)
        .containsExactly(3, 4);
    assertThat(saved.getAllValues().get(0).getText()).isEqualTo("Rent too high");
    assertThat(saved.getAllValues().get(1).getFieldReference()).isNull();
    var event = ArgumentCaptor.forClass(ObjectionsSubmittedEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().objectionCount()).isEqualTo(2);
    verify(contractStore).save(contract);
  }

  @Test
  void submitObjections_emptyList_isRejected() {
    var contract = reviewWithTenant();

    assertThatThrownBy(() -> service.submitObjections(contract.getId(), 3, tenant(), List.of()))
        .isInstanceOf(PreconditionFailedException.class);
    assertThat(contract.getStatus()).isEqualTo(ContractStatus.TENANT_REVIEW);
  }

  @Test
  void submitObjections_blankText_listsOffendingEntries() {
    var contract = reviewWithTenant();
    var objections = new ArrayList<ObjectionSubmission>();
    objections.add(ObjectionSubmission.of("fine"));
    objections.add(ObjectionSubmission.of("   "));

    assertThatThrownBy(() -> service.submitObjections(contract.getId(), 3, tenant(), objections))
        .isInstanceOfSatisfying(
            PreconditionFailedException.class,
            ex -> assertThat(ex.getViolations()).containsExactly("objections[1].text"));
    verify(objectionRepository, never()).save(any());
  }

  @Test
  void submitObjections_byLandlord_isWrongActor() {
    var contract = reviewWithTenant();

    assertThatThrownBy(
            () ->
                service.submitObjections(
                    contract.getId(),
                    3,
                    Actor.landlord(LANDLORD_ID),
                    List.of(ObjectionSubmission.of("x"))))
        .isInstanceOf(WrongActorException.class);
  }

  @Test
  void submitObjections_outsideReview_isIllegalTransition() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_PROOFING);
    when(contractStore.lockAtVersion(contract.getId(), 5)).thenReturn(contract);

    assertThatThrownBy(
            () ->
                service.submitObjections(
                    contract.getId(), 5, tenant(), List.of(ObjectionSubmission.of("late"))))
        .isInstanceOf(IllegalTransitionException.class);
  }

  @Test
  void reviseAndResubmit_withNewTerms_resolvesObjectionsAndReturnsToReview() {
    var contract = pendingWithTenant();
    var open = objection(contract, 1);
    when(objectionRepository.findByContractIdAndResolvedFalseOrderBySequenceNumberAsc(
            contract.getId()))
        .thenReturn(List.of(open));
    var revised =
        new ContractTerms(new BigDecimal("1000.00"), BigDecimal.ZERO, 12, LocalDate.of(2027, 1, 1));

    service.reviseAndResubmit(contract.getId(), 4, landlord(), revised, " Lowered the rent ");

    assertThat(contract.getStatus()).isEqualTo(ContractStatus.TENANT_REVIEW);
    assertThat(contract.getTerms()).isEqualTo(revised);
    assertThat(open.isResolved()).isTrue();
    assertThat(open.getResolvedAt()).isEqualTo(NOW);
    assertThat(open.getLandlordResponse()).isEqualTo("Lowered the rent");
    verify(contractStore).save(contract);
  }

  @Test
  void reviseAndResubmit_withoutTerms_keepsTerms() {
    var contract = pendingWithTenant();
    var original = contract.getTerms();
    when(objectionRepository.findByContractIdAndResolvedFalseOrderBySequenceNumberAsc(
            contract.getId()))
        .thenReturn(List.of());

    service.reviseAndResubmit(contract.getId(), 4, landlord(), null, null);

    assertThat(contract.getStatus()).isEqualTo(ContractStatus.TENANT_REVIEW);
    assertThat(contract.getTerms()).isEqualTo(original);
  }

  @Test
  void reviseAndResubmit_incompleteTerms_isRejected() {
    var contract = pendingWithTenant();

    assertThatThrownBy(
            () ->
                service.reviseAndResubmit(
                    contract.getId(), 4, landlord(), ContractTerms.empty(), "x"))
        .isInstanceOf(PreconditionFailedException.class);
    assertThat(contract.getStatus()).isEqualTo(ContractStatus.OBJECTIONS_PENDING);
  }

  @Test
  void resolve_isIdempotent() {
    var objection = objection(TestContractFactory.draft(), 1);
    objection.resolve("first", NOW);
    objection.resolve("second", NOW.plusSeconds(5));

    assertThat(objection.getLandlordResponse()).isEqualTo("first");
    assertThat(objection.getResolvedAt()).isEqualTo(NOW);
  }

  private RentalContract reviewWithTenant() {
    var contract = TestContractFactory.inStatus(ContractStatus.TENANT_REVIEW);
    TestContractFactory.attachTenant(contract);
    when(contractStore.lockAtVersion(contract.getId(), 3)).thenReturn(contract);
    return contract;
  }

  private RentalContract pendingWithTenant() {
    var contract = TestContractFactory.inStatus(ContractStatus.OBJECTIONS_PENDING);
    when(contractStore.lockAtVersion(contract.getId(), 4)).thenReturn(contract);
    return contract;
  }

  private static ContractObjection objection(RentalContract contract, int sequence) {
    var objection =
        new ContractObjection(contract.getId(), sequence, TENANT_ID, "Rent too high", null, null);
    ReflectionTestUtils.setField(objection, "id", UUID.randomUUID());
    return objection;
  }

  private void stubSave() {
    when(objectionRepository.save(any(ContractObjection.class)))
        .thenAnswer(
            inv -> {
              ContractObjection objection = inv.getArgument(0);
              ReflectionTestUtils.setField(objection, "id", UUID.randomUUID());
              return objection;
            });
  }

  private static Actor tenant() {
    return Actor.tenant(TENANT_ID);
  }

  private static Actor landlord() {
    return Actor.landlord(LANDLORD_ID);
  }
}
