package io.b2mash.rental.leaseflow.proofing;

import io.b2mash.rental.leaseflow.contract.PartyRole;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProofRecordRepository extends JpaRepository<ProofRecord, UUID> {

  Optional<ProofRecord> findByContractIdAndPartyRole(UUID contractId, PartyRole partyRole);

  List<ProofRecord> findByContractId(UUID contractId);
}
