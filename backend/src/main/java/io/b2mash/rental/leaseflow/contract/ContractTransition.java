package io.b2mash.rental.leaseflow.contract;

import static io.b2mash.rental.leaseflow.contract.ContractStatus.ACTIVE;
import static io.b2mash.rental.leaseflow.contract.ContractStatus.DRAFT;
import static io.b2mash.rental.leaseflow.contract.ContractStatus.EXPIRED;
import static io.b2mash.rental.leaseflow.contract.ContractStatus.GUARANTOR_PROOFING;
import static io.b2mash.rental.leaseflow.contract.ContractStatus.LANDLORD_PROOFING;
import static io.b2mash.rental.leaseflow.contract.ContractStatus.OBJECTIONS_PENDING;
import static io.b2mash.rental.leaseflow.contract.ContractStatus.READY_TO_ACTIVATE;
import static io.b2mash.rental.leaseflow.contract.ContractStatus.TENANT_APPROVED;
import static io.b2mash.rental.leaseflow.contract.ContractStatus.TENANT_PROOFING;
import static io.b2mash.rental.leaseflow.contract.ContractStatus.TENANT_REVIEW;
import static io.b2mash.rental.leaseflow.contract.ContractStatus.TERMINATED;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The complete edge table of the contract lifecycle. Every status change goes through exactly one
 * of these edges; {@link ContractStateMachine} refuses anything else.
 *
 * <p>Edges with no permitted roles are automatic: they are taken by the workflow itself as a
 * consequence of another accepted action, never requested directly by a party.
 */
public enum ContractTransition {
  SUBMIT_FOR_REVIEW(EnumSet.of(DRAFT), TENANT_REVIEW, EnumSet.of(PartyRole.LANDLORD)),
  APPROVE(EnumSet.of(TENANT_REVIEW), TENANT_APPROVED, EnumSet.of(PartyRole.TENANT)),
  RAISE_OBJECTIONS(EnumSet.of(TENANT_REVIEW), OBJECTIONS_PENDING, EnumSet.of(PartyRole.TENANT)),
  RESUBMIT_FOR_REVIEW(
      EnumSet.of(OBJECTIONS_PENDING), TENANT_REVIEW, EnumSet.of(PartyRole.LANDLORD)),
  EXPIRE_INVITATION(EnumSet.of(TENANT_REVIEW), EXPIRED, EnumSet.noneOf(PartyRole.class)),
  REISSUE_AFTER_EXPIRY(EnumSet.of(EXPIRED), TENANT_REVIEW, EnumSet.of(PartyRole.LANDLORD)),
  OPEN_TENANT_PROOFING(
      EnumSet.of(TENANT_APPROVED), TENANT_PROOFING, EnumSet.noneOf(PartyRole.class)),
  HAND_OVER_TO_GUARANTOR(
      EnumSet.of(TENANT_PROOFING), GUARANTOR_PROOFING, EnumSet.noneOf(PartyRole.class)),
  HAND_OVER_TO_LANDLORD(
      EnumSet.of(TENANT_PROOFING, GUARANTOR_PROOFING),
      LANDLORD_PROOFING,
      EnumSet.noneOf(PartyRole.class)),
  COMPLETE_PROOFING(
      EnumSet.of(LANDLORD_PROOFING), READY_TO_ACTIVATE, EnumSet.noneOf(PartyRole.class)),
  ACTIVATE(EnumSet.of(READY_TO_ACTIVATE), ACTIVE, EnumSet.noneOf(PartyRole.class)),
  TERMINATE(
      EnumSet.complementOf(EnumSet.of(ACTIVE, TERMINATED)),
      TERMINATED,
      EnumSet.of(PartyRole.LANDLORD, PartyRole.TENANT));

  private final Set<ContractStatus> sources;
  private final ContractStatus target;
  private final Set<PartyRole> permittedRoles;

  ContractTransition(
      Set<ContractStatus> sources, ContractStatus target, Set<PartyRole> permittedRoles) {
    this.sources = Set.copyOf(sources);
    this.target = target;
    this.permittedRoles = Set.copyOf(permittedRoles);
  }

  public ContractStatus target() {
    return target;
  }

  public boolean isAllowedFrom(ContractStatus status) {
    return sources.contains(status);
  }

  public boolean permits(PartyRole role) {
    return permittedRoles.contains(role);
  }

  public boolean isAutomatic() {
    return permittedRoles.isEmpty();
  }

  /** All statuses reachable in one step from {@code status}. */
  public static Set<ContractStatus> targetsFrom(ContractStatus status) {
    return Arrays.stream(values())
        .filter(t -> t.isAllowedFrom(status))
        .map(ContractTransition::target)
        .collect(Collectors.toCollection(() -> EnumSet.noneOf(ContractStatus.class)));
  }
}
