package io.b2mash.rental.leaseflow.event;

import io.b2mash.rental.leaseflow.contract.PartyRole;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a tenant invitation is issued or re-issued. Carries the raw token because it is
 * the only moment the token exists in clear; only its hash is stored.
 */
public record InvitationIssuedEvent(
    String eventType,
    UUID contractId,
    PartyRole actorRole,
    UUID actorId,
    Instant occurredAt,
    UUID invitationId,
    String tenantEmail,
    String rawToken,
    Instant expiresAt,
    boolean reissue)
    implements DomainEvent {}
