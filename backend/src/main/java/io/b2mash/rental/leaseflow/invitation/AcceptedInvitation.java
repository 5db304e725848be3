package io.b2mash.rental.leaseflow.invitation;

import java.util.UUID;

public record AcceptedInvitation(UUID contractId, int version) {}
