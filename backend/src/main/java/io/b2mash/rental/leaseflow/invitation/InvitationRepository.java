package io.b2mash.rental.leaseflow.invitation;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvitationRepository extends JpaRepository<ContractInvitation, UUID> {

  Optional<ContractInvitation> findByTokenHash(String tokenHash);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT i FROM ContractInvitation i WHERE i.tokenHash = :tokenHash")
  Optional<ContractInvitation> findByTokenHashForUpdate(@Param("tokenHash") String tokenHash);

  Optional<ContractInvitation> findByContractIdAndStatus(UUID contractId, InvitationStatus status);

  List<ContractInvitation> findByContractIdOrderByCreatedAtDesc(UUID contractId);

  @Query(
      """
      SELECT DISTINCT i.contractId FROM ContractInvitation i
      WHERE i.status = :status AND i.expiresAt < :now
      """)
  List<UUID> findContractIdsWithLapsedInvitations(
      @Param("status") InvitationStatus status, @Param("now") Instant now);
}
