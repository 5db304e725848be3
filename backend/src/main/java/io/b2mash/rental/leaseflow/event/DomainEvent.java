package io.b2mash.rental.leaseflow.event;

import io.b2mash.rental.leaseflow.contract.PartyRole;
import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for all domain events published via Spring ApplicationEventPublisher. All
 * implementations must be records with primitive/UUID/enum fields only, no JPA entity references.
 * Events stay valid after the publishing transaction commits and the persistence context closes.
 *
 * <p>{@code actorRole} and {@code actorId} are null for transitions the workflow takes on its own.
 */
public sealed interface DomainEvent
    permits ContractStatusChangedEvent,
        InvitationIssuedEvent,
        ObjectionsSubmittedEvent,
        ProofRecordCompletedEvent {

  String eventType();

  UUID contractId();

  PartyRole actorRole();

  UUID actorId();

  Instant occurredAt();
}
