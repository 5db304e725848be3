package io.b2mash.rental.leaseflow.proofing;

import io.b2mash.rental.leaseflow.contract.PartyRole;
import jakarta.persistence.Column;
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
import java.util.Objects;
import java.util.UUID;

/**
 * One party's identity-proofing record on a contract. Created empty when that party's turn opens;
 * immutable once {@link #isComplete()}. The four {@link ProofStep} rows reference it by id.
 */
@Entity
@Table(name = "proof_records")
public class ProofRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  // Parent FK stored as plain UUID, no @ManyToOne.
  @Column(name = "contract_id", nullable = false, updatable = false)
  private UUID contractId;

  @Enumerated(EnumType.STRING)
  @Column(name = "party_role", nullable = false, length = 20, updatable = false)
  private PartyRole partyRole;

  @Column(name = "party_id", nullable = false, updatable = false)
  private UUID partyId;

  @Column(name = "complete", nullable = false)
  private boolean complete;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  /** JPA-required no-arg constructor. */
  protected ProofRecord() {}

  public ProofRecord(UUID contractId, PartyRole partyRole, UUID partyId) {
    this.contractId = Objects.requireNonNull(contractId, "contractId must not be null");
    this.partyRole = Objects.requireNonNull(partyRole, "partyRole must not be null");
    this.partyId = Objects.requireNonNull(partyId, "partyId must not be null");
    this.complete = false;
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

  /**
   * Marks the record complete.
   *
   * @throws IllegalStateException if it is already complete
   */
  public void markComplete(Instant at) {
    if (complete) {
      throw new IllegalStateException("Proof record " + id + " is already complete");
    }
    this.complete = true;
    this.completedAt = at;
  }

  public UUID getId() {
    return id;
  }

  public UUID getContractId() {
    return contractId;
  }

  public PartyRole getPartyRole() {
    return partyRole;
  }

  public UUID getPartyId() {
    return partyId;
  }

  public boolean isComplete() {
    return complete;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
