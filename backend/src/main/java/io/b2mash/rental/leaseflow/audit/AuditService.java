package io.b2mash.rental.leaseflow.audit;

import java.util.List;
import java.util.UUID;

/** Records and reads the workflow history of contracts. */
public interface AuditService {

  /**
   * Records a single history entry within the current transaction. If the enclosing transaction
   * rolls back, the entry is also rolled back (no REQUIRES_NEW). Callers hold the contract's row
   * lock, which keeps sequence numbers gap-free.
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);

  /** All entries of a contract's history, oldest first. */
  List<AuditEvent> findHistory(UUID contractId);

  /**
   * Re-checks every entry's hash and the chain links between consecutive entries.
   *
   * @return the first entry that fails verification, or null when the history is intact
   */
  AuditEvent findFirstTamperedEntry(List<AuditEvent> history);
}
