package io.b2mash.rental.leaseflow.contract;

import io.b2mash.rental.leaseflow.invitation.IssuedInvitation;

/**
 * Outcome of submitting a draft for review.
 *
 * @param invitation the tenant invitation issued with it; null when the tenant had already joined
 */
public record ReviewSubmission(RentalContract contract, IssuedInvitation invitation) {}
