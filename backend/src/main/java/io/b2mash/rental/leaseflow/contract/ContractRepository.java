package io.b2mash.rental.leaseflow.contract;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

/** Repository for {@link RentalContract} aggregates. */
public interface ContractRepository extends JpaRepository<RentalContract, UUID> {

  /**
   * Loads a contract with a row lock so that the version check and the write that follows form one
   * atomic read-modify-write. A concurrent caller blocks here and then sees the bumped version.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
  @Query("SELECT c FROM RentalContract c WHERE c.id = :id")
  Optional<RentalContract> findByIdForUpdate(@Param("id") UUID id);
}
