package io.b2mash.rental.leaseflow.contract;

import java.util.UUID;

/** Minimal reply to a mutating call: where the contract is now and the version to send next. */
public record TransitionResponse(UUID contractId, ContractStatus status, int version) {

  public static TransitionResponse from(RentalContract contract) {
    return new TransitionResponse(contract.getId(), contract.getStatus(), contract.getVersion());
  }
}
