package io.b2mash.rental.leaseflow.contract;

import io.b2mash.rental.leaseflow.exception.ResourceNotFoundException;
import io.b2mash.rental.leaseflow.exception.VersionConflictException;
import java.time.Clock;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;

/**
 * Loads and saves contracts for the workflow services. Every mutating call follows the same
 * pattern: {@link #lockAtVersion} inside the caller's transaction, mutate, then {@link #save}.
 */
@Component
public class ContractStore {

  private static final Logger log = LoggerFactory.getLogger(ContractStore.class);

  private final ContractRepository contractRepository;
  private final Clock clock;

  public ContractStore(ContractRepository contractRepository, Clock clock) {
    this.contractRepository = contractRepository;
    this.clock = clock;
  }

  /** Read-only load. */
  public RentalContract require(UUID contractId) {
    return contractRepository
        .findById(contractId)
        .orElseThrow(() -> new ResourceNotFoundException("Contract", contractId));
  }

  /** Loads the contract holding its row lock until the surrounding transaction ends. */
  public RentalContract lockForUpdate(UUID contractId) {
    try {
      return contractRepository
          .findByIdForUpdate(contractId)
          .orElseThrow(() -> new ResourceNotFoundException("Contract", contractId));
    } catch (PessimisticLockingFailureException e) {
      log.warn("Timed out waiting for contract lock: contract={}", contractId);
      throw new VersionConflictException(contractId, e);
    }
  }

  /**
   * Locks the contract and checks the caller's expected version against the stored one.
   *
   * @throws VersionConflictException if the versions differ; nothing has been mutated
   */
  public RentalContract lockAtVersion(UUID contractId, int expectedVersion) {
    var contract = lockForUpdate(contractId);
    requireVersion(contract, expectedVersion);
    return contract;
  }

  public void requireVersion(RentalContract contract, int expectedVersion) {
    if (contract.getVersion() != expectedVersion) {
      log.warn(
          "Stale version: contract={}, expected={}, current={}",
          contract.getId(),
          expectedVersion,
          contract.getVersion());
      throw new VersionConflictException(contract.getId(), expectedVersion, contract.getVersion());
    }
  }

  /** Persists an accepted mutation, incrementing the version exactly once. */
  public RentalContract save(RentalContract contract) {
    contract.recordAcceptedMutation(clock.instant());
    return contractRepository.save(contract);
  }

  /** Persists a newly created draft at version 0. */
  public RentalContract create(RentalContract contract) {
    return contractRepository.save(contract);
  }
}
