package io.b2mash.rental.leaseflow.invitation;

public enum InvitationStatus {
  ACTIVE,
  CONSUMED,
  EXPIRED,
  /** Superseded by a re-issued invitation, or withdrawn when the contract was terminated. */
  REVOKED
}
