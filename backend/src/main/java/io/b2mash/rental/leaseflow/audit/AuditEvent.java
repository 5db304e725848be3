package io.b2mash.rental.leaseflow.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Immutable entry of a contract's workflow history, persisted to {@code workflow_history}. Once
 * created, entries cannot be updated (enforced by a database trigger). Each entry carries a
 * SHA-256 hash over its own content and the hash of the previous entry for the same contract, so a
 * rewritten or removed entry breaks the chain.
 *
 * @see AuditEventRecord
 */
@Entity
@Table(name = "workflow_history")
public class AuditEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "contract_id", nullable = false, updatable = false)
  private UUID contractId;

  @Column(name = "sequence_number", nullable = false, updatable = false)
  private long sequenceNumber;

  @Column(name = "event_type", nullable = false, length = 100)
  private String eventType;

  @Column(name = "entity_type", nullable = false, length = 50)
  private String entityType;

  @Column(name = "entity_id", nullable = false)
  private UUID entityId;

  @Column(name = "actor_id")
  private UUID actorId;

  @Column(name = "actor_type", nullable = false, length = 20)
  private String actorType;

  @Column(name = "source", nullable = false, length = 30)
  private String source;

  @Column(name = "ip_address", length = 45)
  private String ipAddress;

  @Column(name = "user_agent", length = 500)
  private String userAgent;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "details", columnDefinition = "jsonb")
  private Map<String, String> details;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  @Column(name = "previous_hash", length = 64)
  private String previousHash;

  @Column(name = "integrity_hash", nullable = false, length = 64)
  private String integrityHash;

  /** Protected no-arg constructor required by JPA. */
  protected AuditEvent() {}

  /**
   * Creates an immutable history entry. {@code occurredAt} is truncated to microseconds so the hash
   * survives a round trip through a {@code timestamptz} column.
   */
  public AuditEvent(
      AuditEventRecord record, long sequenceNumber, String previousHash, Instant occurredAt) {
    this.contractId = record.contractId();
    this.sequenceNumber = sequenceNumber;
    this.eventType = record.eventType();
    this.entityType = record.entityType();
    this.entityId = record.entityId();
    this.actorId = record.actorId();
    this.actorType = record.actorType();
    this.source = record.source();
    this.ipAddress = record.ipAddress();
    this.userAgent = record.userAgent();
    this.details = stringify(record.details());
    this.occurredAt = occurredAt.truncatedTo(ChronoUnit.MICROS);
    this.previousHash = previousHash;
    this.integrityHash = computeHash();
  }

  /** True when the stored hash still matches the entry's content. */
  public boolean hasValidHash() {
    return computeHash().equals(integrityHash);
  }

  String computeHash() {
    var canonical =
        String.join(
            "|",
            String.valueOf(contractId),
            String.valueOf(sequenceNumber),
            eventType,
            entityType,
            String.valueOf(entityId),
            String.valueOf(actorId),
            actorType,
            occurredAt.toString(),
            new TreeMap<>(details != null ? details : Map.of()).toString(),
            String.valueOf(previousHash));
    try {
      var digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private static Map<String, String> stringify(Map<String, Object> details) {
    var result = new LinkedHashMap<String, String>();
    if (details != null) {
      details.forEach((key, value) -> result.put(key, String.valueOf(value)));
    }
    return result;
  }

  public UUID getId() {
    return id;
  }

  public UUID getContractId() {
    return contractId;
  }

  public long getSequenceNumber() {
    return sequenceNumber;
  }

  public String getEventType() {
    return eventType;
  }

  public String getEntityType() {
    return entityType;
  }

  public UUID getEntityId() {
    return entityId;
  }

  public UUID getActorId() {
    return actorId;
  }

  public String getActorType() {
    return actorType;
  }

  public String getSource() {
    return source;
  }

  public String getIpAddress() {
    return ipAddress;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public Map<String, String> getDetails() {
    return details;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }

  public String getPreviousHash() {
    return previousHash;
  }

  public String getIntegrityHash() {
    return integrityHash;
  }
}
