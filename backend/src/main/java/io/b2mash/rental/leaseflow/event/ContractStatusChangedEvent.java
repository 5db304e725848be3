package io.b2mash.rental.leaseflow.event;

import io.b2mash.rental.leaseflow.contract.ContractStatus;
import io.b2mash.rental.leaseflow.contract.PartyRole;
import java.time.Instant;
import java.util.UUID;

/** Published for every accepted status change, automatic ones included. */
public record ContractStatusChangedEvent(
    String eventType,
    UUID contractId,
    PartyRole actorRole,
    UUID actorId,
    Instant occurredAt,
    ContractStatus fromStatus,
    ContractStatus toStatus,
    String transition,
    UUID landlordId,
    String landlordEmail,
    String tenantEmail)
    implements DomainEvent {}
