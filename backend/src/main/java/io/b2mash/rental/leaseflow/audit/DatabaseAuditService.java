package io.b2mash.rental.leaseflow.audit;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Database-backed implementation of {@link AuditService}.
 *
 * <p>Transaction semantics: {@code log()} participates in the caller's transaction (no
 * REQUIRES_NEW). If the workflow operation rolls back, its history entries roll back too.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final Clock clock;

  public DatabaseAuditService(AuditEventRepository auditEventRepository, Clock clock) {
    this.auditEventRepository = auditEventRepository;
    this.clock = clock;
  }

  @Override
  @Transactional
  public void log(AuditEventRecord record) {
    Objects.requireNonNull(record.contractId(), "contractId must not be null");
    var previous =
        auditEventRepository.findFirstByContractIdOrderBySequenceNumberDesc(record.contractId());
    long sequence = previous.map(e -> e.getSequenceNumber() + 1).orElse(1L);
    String previousHash = previous.map(AuditEvent::getIntegrityHash).orElse(null);

    var event = new AuditEvent(record, sequence, previousHash, clock.instant());
    auditEventRepository.save(event);
    log.debug(
        "Recorded history entry: type={}, entity={}/{}, contract={}, seq={}, actor={}",
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.contractId(),
        sequence,
        record.actorType());
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditEvent> findHistory(UUID contractId) {
    return auditEventRepository.findByContractIdOrderBySequenceNumberAsc(contractId);
  }

  @Override
  public AuditEvent findFirstTamperedEntry(List<AuditEvent> history) {
    String expectedPrevious = null;
    long expectedSequence = 1;
    for (var entry : history) {
      if (!entry.hasValidHash()
          || entry.getSequenceNumber() != expectedSequence
          || !Objects.equals(entry.getPreviousHash(), expectedPrevious)) {
        log.warn(
            "Workflow history integrity check failed: contract={}, seq={}",
            entry.getContractId(),
            entry.getSequenceNumber());
        return entry;
      }
      expectedPrevious = entry.getIntegrityHash();
      expectedSequence++;
    }
    return null;
  }
}
