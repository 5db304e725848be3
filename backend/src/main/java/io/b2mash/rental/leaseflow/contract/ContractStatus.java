package io.b2mash.rental.leaseflow.contract;

/** Lifecycle status of a rental contract. */
public enum ContractStatus {
  /** Landlord is authoring the contract; terms are editable. */
  DRAFT,

  /** Sent to the tenant for review. */
  TENANT_REVIEW,

  /** Tenant accepted the terms (transient: proofing opens immediately). */
  TENANT_APPROVED,

  /** Tenant raised objections; waiting for the landlord to revise or acknowledge. */
  OBJECTIONS_PENDING,

  /** Tenant holds the identity-proofing turn. */
  TENANT_PROOFING,

  /** Guarantor holds the identity-proofing turn. */
  GUARANTOR_PROOFING,

  /** Landlord holds the identity-proofing turn. */
  LANDLORD_PROOFING,

  /** Every required party completed proofing. */
  READY_TO_ACTIVATE,

  /** Contract is legally in force. */
  ACTIVE,

  /** Closed early by one of the parties. */
  TERMINATED,

  /** The tenant invitation lapsed before it was accepted. */
  EXPIRED
}
