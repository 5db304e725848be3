package io.b2mash.rental.leaseflow.event;

import io.b2mash.rental.leaseflow.contract.PartyRole;
import java.time.Instant;
import java.util.UUID;

/** Published when a party has completed all four identity proofing steps. */
public record ProofRecordCompletedEvent(
    String eventType,
    UUID contractId,
    PartyRole actorRole,
    UUID actorId,
    Instant occurredAt,
    UUID proofRecordId)
    implements DomainEvent {}
