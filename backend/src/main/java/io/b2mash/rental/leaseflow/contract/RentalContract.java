package io.b2mash.rental.leaseflow.contract;

import io.b2mash.rental.leaseflow.exception.PreconditionFailedException;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Aggregate root of the contract workflow. Status only changes through {@link
 * ContractStateMachine}. {@link #getVersion()} is the caller-facing concurrency token: {@link
 * ContractStore#save} increments it once per accepted call while the row lock is held.
 */
@Entity
@Table(name = "rental_contracts")
public class RentalContract {

  private static final Set<ContractStatus> GUARANTOR_ATTACHABLE_STATUSES =
      Set.of(ContractStatus.DRAFT, ContractStatus.TENANT_REVIEW, ContractStatus.OBJECTIONS_PENDING);

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "version", nullable = false)
  private int version;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 30)
  private ContractStatus status;

  @Column(name = "landlord_id", nullable = false)
  private UUID landlordId;

  @Column(name = "landlord_email", length = 255)
  private String landlordEmail;

  @Column(name = "tenant_id")
  private UUID tenantId;

  @Column(name = "tenant_email", length = 255)
  private String tenantEmail;

  @Column(name = "guarantor_id")
  private UUID guarantorId;

  @Embedded private ContractTerms terms;

  @Column(name = "submitted_for_review_at")
  private Instant submittedForReviewAt;

  @Column(name = "tenant_joined_at")
  private Instant tenantJoinedAt;

  @Column(name = "tenant_approved_at")
  private Instant tenantApprovedAt;

  @Column(name = "activated_at")
  private Instant activatedAt;

  @Column(name = "closed_at")
  private Instant closedAt;

  @Column(name = "closure_reason", length = 1000)
  private String closureReason;

  @Enumerated(EnumType.STRING)
  @Column(name = "closed_by_role", length = 20)
  private PartyRole closedByRole;

  @Column(name = "last_activity_at", nullable = false)
  private Instant lastActivityAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  /** JPA-required no-arg constructor. */
  protected RentalContract() {}

  public RentalContract(
      UUID landlordId, String landlordEmail, String tenantEmail, ContractTerms terms) {
    this.landlordId = Objects.requireNonNull(landlordId, "landlordId must not be null");
    this.landlordEmail = landlordEmail;
    this.tenantEmail = tenantEmail;
    this.terms = terms != null ? terms : ContractTerms.empty();
    this.status = ContractStatus.DRAFT;
    this.lastActivityAt = Instant.now();
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  // --- Lifecycle methods ---

  /** Only {@link ContractStateMachine} moves the status. */
  void moveTo(ContractStatus target, Instant at) {
    this.status = target;
    this.lastActivityAt = at;
  }

  void recordAcceptedMutation(Instant at) {
    this.version++;
    this.lastActivityAt = at;
  }

  /** Replaces the draft terms. Only valid while the contract is a draft. */
  public void updateTerms(ContractTerms newTerms) {
    if (status != ContractStatus.DRAFT) {
      throw new PreconditionFailedException(
          "Terms can only be edited while the contract is a draft (status is " + status + ")");
    }
    this.terms = Objects.requireNonNull(newTerms, "newTerms must not be null");
  }

  /** Replaces the terms in answer to tenant objections. */
  public void reviseTerms(ContractTerms newTerms) {
    if (status != ContractStatus.OBJECTIONS_PENDING) {
      throw new PreconditionFailedException(
          "Terms can only be revised while objections are pending (status is " + status + ")");
    }
    var missing = newTerms.missingFields();
    if (!missing.isEmpty()) {
      throw new PreconditionFailedException("Revised terms are incomplete", missing);
    }
    this.terms = newTerms;
  }

  /** Binds the tenant who accepted the invitation. */
  public void attachTenant(UUID tenantId, Instant at) {
    if (this.tenantId != null) {
      throw new PreconditionFailedException("A tenant has already joined this contract");
    }
    if (landlordId.equals(tenantId)) {
      throw new PreconditionFailedException("The landlord cannot join as tenant");
    }
    this.tenantId = Objects.requireNonNull(tenantId, "tenantId must not be null");
    this.tenantJoinedAt = at;
    this.lastActivityAt = at;
  }

  /**
   * Attaches a guarantor. The set of parties that must prove their identity is frozen once the
   * tenant approves, so this is refused from {@code TENANT_APPROVED} onwards.
   */
  public void attachGuarantor(UUID guarantorId) {
    if (!GUARANTOR_ATTACHABLE_STATUSES.contains(status)) {
      throw new PreconditionFailedException(
          "The guarantor can no longer change (status is " + status + ")");
    }
    Objects.requireNonNull(guarantorId, "guarantorId must not be null");
    if (guarantorId.equals(landlordId) || guarantorId.equals(tenantId)) {
      throw new PreconditionFailedException(
          "The guarantor must be a different party from the landlord and tenant");
    }
    this.guarantorId = guarantorId;
  }

  public void recordSubmittedForReview(Instant at) {
    if (submittedForReviewAt == null) {
      this.submittedForReviewAt = at;
    }
  }

  public void recordTenantApproval(Instant at) {
    this.tenantApprovedAt = at;
  }

  public void recordActivation(Instant at) {
    this.activatedAt = at;
  }

  /** Records why the contract left the main lifecycle. {@code closedBy} is null for the system. */
  public void recordClosure(PartyRole closedBy, String reason, Instant at) {
    this.closedByRole = closedBy;
    this.closureReason = reason;
    this.closedAt = at;
  }

  /** Clears closure data when an expired contract is reopened by a new invitation. */
  public void clearClosure() {
    this.closedByRole = null;
    this.closureReason = null;
    this.closedAt = null;
  }

  // --- Queries ---

  /** The party id bound to {@code role}, or null if nobody holds that role yet. */
  public UUID partyIdFor(PartyRole role) {
    return switch (role) {
      case LANDLORD -> landlordId;
      case TENANT -> tenantId;
      case GUARANTOR -> guarantorId;
    };
  }

  public boolean hasGuarantor() {
    return guarantorId != null;
  }

  /** Roles that must complete identity proofing, in the order they take their turn. */
  public List<PartyRole> requiredProofingRoles() {
    var roles = new ArrayList<PartyRole>();
    roles.add(PartyRole.TENANT);
    if (hasGuarantor()) {
      roles.add(PartyRole.GUARANTOR);
    }
    roles.add(PartyRole.LANDLORD);
    return roles;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public int getVersion() {
    return version;
  }

  public ContractStatus getStatus() {
    return status;
  }

  public UUID getLandlordId() {
    return landlordId;
  }

  public String getLandlordEmail() {
    return landlordEmail;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public String getTenantEmail() {
    return tenantEmail;
  }

  public UUID getGuarantorId() {
    return guarantorId;
  }

  public ContractTerms getTerms() {
    return terms != null ? terms : ContractTerms.empty();
  }

  public Instant getSubmittedForReviewAt() {
    return submittedForReviewAt;
  }

  public Instant getTenantJoinedAt() {
    return tenantJoinedAt;
  }

  public Instant getTenantApprovedAt() {
    return tenantApprovedAt;
  }

  public Instant getActivatedAt() {
    return activatedAt;
  }

  public Instant getClosedAt() {
    return closedAt;
  }

  public String getClosureReason() {
    return closureReason;
  }

  public PartyRole getClosedByRole() {
    return closedByRole;
  }

  public Instant getLastActivityAt() {
    return lastActivityAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
