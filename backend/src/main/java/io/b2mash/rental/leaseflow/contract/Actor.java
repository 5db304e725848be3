package io.b2mash.rental.leaseflow.contract;

import java.util.Objects;
import java.util.UUID;

/**
 * The party performing a workflow call. Passed explicitly to every mutating operation; nothing in
 * the workflow reads the acting identity from ambient request state.
 */
public record Actor(PartyRole role, UUID partyId) {

  public Actor {
    Objects.requireNonNull(role, "role must not be null");
    Objects.requireNonNull(partyId, "partyId must not be null");
  }

  public static Actor landlord(UUID partyId) {
    return new Actor(PartyRole.LANDLORD, partyId);
  }

  public static Actor tenant(UUID partyId) {
    return new Actor(PartyRole.TENANT, partyId);
  }

  public static Actor guarantor(UUID partyId) {
    return new Actor(PartyRole.GUARANTOR, partyId);
  }
}
