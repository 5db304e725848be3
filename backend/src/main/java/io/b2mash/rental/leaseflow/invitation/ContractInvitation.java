package io.b2mash.rental.leaseflow.invitation;

import io.b2mash.rental.leaseflow.exception.InvalidStateException;
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
 * Single-use invitation letting a tenant join a contract. Only the SHA-256 hash of the token is
 * stored. At most one invitation per contract is {@link InvitationStatus#ACTIVE}; older ones stay
 * as history.
 */
@Entity
@Table(name = "contract_invitations")
public class ContractInvitation {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "contract_id", nullable = false, updatable = false)
  private UUID contractId;

  @Column(name = "token_hash", nullable = false, unique = true, length = 64, updatable = false)
  private String tokenHash;

  @Column(name = "issued_to", nullable = false, length = 255, updatable = false)
  private String issuedTo;

  @Column(name = "issued_by", nullable = false, updatable = false)
  private UUID issuedBy;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InvitationStatus status;

  @Column(name = "expires_at", nullable = false, updatable = false)
  private Instant expiresAt;

  @Column(name = "consumed_at")
  private Instant consumedAt;

  @Column(name = "consumed_by")
  private UUID consumedBy;

  @Column(name = "closed_at")
  private Instant closedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  /** JPA-required no-arg constructor. */
  protected ContractInvitation() {}

  public ContractInvitation(
      UUID contractId, String tokenHash, String issuedTo, UUID issuedBy, Instant expiresAt) {
    this.contractId = Objects.requireNonNull(contractId, "contractId must not be null");
    this.tokenHash = Objects.requireNonNull(tokenHash, "tokenHash must not be null");
    this.issuedTo = Objects.requireNonNull(issuedTo, "issuedTo must not be null");
    this.issuedBy = Objects.requireNonNull(issuedBy, "issuedBy must not be null");
    this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt must not be null");
    this.status = InvitationStatus.ACTIVE;
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

  /** Marks the invitation as used by {@code tenantId}. Only valid while ACTIVE. */
  public void markConsumed(UUID tenantId, Instant at) {
    requireActive("consume");
    this.status = InvitationStatus.CONSUMED;
    this.consumedBy = Objects.requireNonNull(tenantId, "tenantId must not be null");
    this.consumedAt = at;
  }

  /** Marks the invitation as lapsed. Only valid while ACTIVE. */
  public void markExpired(Instant at) {
    requireActive("expire");
    this.status = InvitationStatus.EXPIRED;
    this.closedAt = at;
  }

  /** Invalidates the invitation before use. Only valid while ACTIVE. */
  public void markRevoked(Instant at) {
    requireActive("revoke");
    this.status = InvitationStatus.REVOKED;
    this.closedAt = at;
  }

  public boolean isActive() {
    return status == InvitationStatus.ACTIVE;
  }

  /** True once {@code now} is past the expiry deadline; the deadline instant itself is valid. */
  public boolean isExpiredAt(Instant now) {
    return now.isAfter(expiresAt);
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getContractId() {
    return contractId;
  }

  public String getTokenHash() {
    return tokenHash;
  }

  public String getIssuedTo() {
    return issuedTo;
  }

  public UUID getIssuedBy() {
    return issuedBy;
  }

  public InvitationStatus getStatus() {
    return status;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getConsumedAt() {
    return consumedAt;
  }

  public UUID getConsumedBy() {
    return consumedBy;
  }

  public Instant getClosedAt() {
    return closedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  // --- Private helpers ---

  private void requireActive(String action) {
    if (status != InvitationStatus.ACTIVE) {
      throw new InvalidStateException(
          "Invalid invitation state", "Cannot " + action + " invitation in status " + status);
    }
  }
}
