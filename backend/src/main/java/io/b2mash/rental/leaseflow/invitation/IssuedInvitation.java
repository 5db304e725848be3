package io.b2mash.rental.leaseflow.invitation;

import java.time.Instant;
import java.util.UUID;

/**
 * A freshly issued invitation. {@code token} is the only copy of the raw token; it is not
 * recoverable afterwards.
 */
public record IssuedInvitation(
    UUID invitationId, UUID contractId, String token, Instant expiresAt, int contractVersion) {

  public IssuedInvitation withContractVersion(int version) {
    return new IssuedInvitation(invitationId, contractId, token, expiresAt, version);
  }
}
