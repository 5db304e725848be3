package io.b2mash.rental.leaseflow.objection;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ObjectionRepository extends JpaRepository<ContractObjection, UUID> {

  List<ContractObjection> findByContractIdOrderBySequenceNumberAsc(UUID contractId);

  List<ContractObjection> findByContractIdAndResolvedFalseOrderBySequenceNumberAsc(
      UUID contractId);

  long countByContractId(UUID contractId);
}
