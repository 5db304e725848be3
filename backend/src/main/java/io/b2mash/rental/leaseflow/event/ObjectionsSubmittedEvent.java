package io.b2mash.rental.leaseflow.event;

import io.b2mash.rental.leaseflow.contract.PartyRole;
import java.time.Instant;
import java.util.UUID;

public record ObjectionsSubmittedEvent(
    String eventType,
    UUID contractId,
    PartyRole actorRole,
    UUID actorId,
    Instant occurredAt,
    int objectionCount,
    String landlordEmail)
    implements DomainEvent {}
