package io.b2mash.rental.leaseflow.proofing;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Result slot for one sub-step of a {@link ProofRecord}. Write-once: after a passing verification
 * is recorded the step never changes again. Failed attempts only bump {@link #getAttempts()}.
 */
@Entity
@Table(name = "proof_steps")
public class ProofStep {

  private static final int MAX_REASON_LENGTH = 500;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "proof_record_id", nullable = false, updatable = false)
  private UUID proofRecordId;

  @Enumerated(EnumType.STRING)
  @Column(name = "step_name", nullable = false, length = 20, updatable = false)
  private ProofStepName stepName;

  @Column(name = "position", nullable = false, updatable = false)
  private int position;

  @Column(name = "completed", nullable = false)
  private boolean completed;

  @Column(name = "payload_ref", length = 500)
  private String payloadRef;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "confidence")
  private Double confidence;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  @Column(name = "last_failure_reason", length = MAX_REASON_LENGTH)
  private String lastFailureReason;

  /** JPA-required no-arg constructor. */
  protected ProofStep() {}

  public ProofStep(UUID proofRecordId, ProofStepName stepName) {
    this.proofRecordId = Objects.requireNonNull(proofRecordId, "proofRecordId must not be null");
    this.stepName = Objects.requireNonNull(stepName, "stepName must not be null");
    this.position = stepName.position();
  }

  /** Records a passing verification. */
  public void recordPass(String payloadRef, double confidence, Instant at) {
    requireOpen();
    this.attempts++;
    this.completed = true;
    this.payloadRef = payloadRef;
    this.confidence = confidence;
    this.completedAt = at;
  }

  /** Records a failed attempt. The step stays open for a retry. */
  public void recordFailure(String reason) {
    requireOpen();
    this.attempts++;
    this.lastFailureReason =
        reason != null && reason.length() > MAX_REASON_LENGTH
            ? reason.substring(0, MAX_REASON_LENGTH)
            : reason;
  }

  private void requireOpen() {
    if (completed) {
      throw new IllegalStateException(stepName + " is already recorded on " + proofRecordId);
    }
  }

  public UUID getId() {
    return id;
  }

  public UUID getProofRecordId() {
    return proofRecordId;
  }

  public ProofStepName getStepName() {
    return stepName;
  }

  public int getPosition() {
    return position;
  }

  public boolean isCompleted() {
    return completed;
  }

  public String getPayloadRef() {
    return payloadRef;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Double getConfidence() {
    return confidence;
  }

  public int getAttempts() {
    return attempts;
  }

  public String getLastFailureReason() {
    return lastFailureReason;
  }
}
