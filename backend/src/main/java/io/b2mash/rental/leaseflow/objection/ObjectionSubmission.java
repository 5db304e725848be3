package io.b2mash.rental.leaseflow.objection;

/**
 * One objection as submitted by the tenant.
 *
 * @param fieldReference optional name of the term the objection targets (e.g., "monthlyRent")
 * @param proposedModification optional change the tenant would accept
 */
public record ObjectionSubmission(
    String text, String fieldReference, String proposedModification) {

  public static ObjectionSubmission of(String text) {
    return new ObjectionSubmission(text, null, null);
  }
}
