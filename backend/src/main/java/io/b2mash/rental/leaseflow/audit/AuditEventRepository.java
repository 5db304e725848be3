package io.b2mash.rental.leaseflow.audit;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  List<AuditEvent> findByContractIdOrderBySequenceNumberAsc(UUID contractId);

  Optional<AuditEvent> findFirstByContractIdOrderBySequenceNumberDesc(UUID contractId);
}
