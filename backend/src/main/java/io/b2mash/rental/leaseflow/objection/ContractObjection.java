package io.b2mash.rental.leaseflow.objection;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A tenant's request for a change before approving. Append-only: the content never changes, only
 * the resolution fields are filled in when the landlord re-submits the contract.
 */
@Entity
@Table(name = "contract_objections")
public class ContractObjection {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "contract_id", nullable = false, updatable = false)
  private UUID contractId;

  @Column(name = "sequence_number", nullable = false, updatable = false)
  private int sequenceNumber;

  @Column(name = "author_id", nullable = false, updatable = false)
  private UUID authorId;

  @Column(name = "text", nullable = false, columnDefinition = "TEXT", updatable = false)
  private String text;

  @Column(name = "field_reference", length = 100, updatable = false)
  private String fieldReference;

  @Column(name = "proposed_modification", columnDefinition = "TEXT", updatable = false)
  private String proposedModification;

  @Column(name = "resolved", nullable = false)
  private boolean resolved;

  @Column(name = "resolved_at")
  private Instant resolvedAt;

  @Column(name = "landlord_response", columnDefinition = "TEXT")
  private String landlordResponse;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  /** JPA-required no-arg constructor. */
  protected ContractObjection() {}

  public ContractObjection(
      UUID contractId,
      int sequenceNumber,
      UUID authorId,
      String text,
      String fieldReference,
      String proposedModification) {
    this.contractId = Objects.requireNonNull(contractId, "contractId must not be null");
    this.sequenceNumber = sequenceNumber;
    this.authorId = Objects.requireNonNull(authorId, "authorId must not be null");
    this.text = Objects.requireNonNull(text, "text must not be null");
    this.fieldReference = fieldReference;
    this.proposedModification = proposedModification;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
  }

  /** Marks the objection resolved. No-op if it already is. */
  public void resolve(String response, Instant at) {
    if (resolved) {
      return;
    }
    this.resolved = true;
    this.resolvedAt = at;
    this.landlordResponse = response;
  }

  public UUID getId() {
    return id;
  }

  public UUID getContractId() {
    return contractId;
  }

  public int getSequenceNumber() {
    return sequenceNumber;
  }

  public UUID getAuthorId() {
    return authorId;
  }

  public String getText() {
    return text;
  }

  public String getFieldReference() {
    return fieldReference;
  }

  public String getProposedModification() {
    return proposedModification;
  }

  public boolean isResolved() {
    return resolved;
  }

  public Instant getResolvedAt() {
    return resolvedAt;
  }

  public String getLandlordResponse() {
    return landlordResponse;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
