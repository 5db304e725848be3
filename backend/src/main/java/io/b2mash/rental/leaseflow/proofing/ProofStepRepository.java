package io.b2mash.rental.leaseflow.proofing;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProofStepRepository extends JpaRepository<ProofStep, UUID> {

  List<ProofStep> findByProofRecordIdOrderByPositionAsc(UUID proofRecordId);

  List<ProofStep> findByProofRecordIdIn(Collection<UUID> proofRecordIds);
}
