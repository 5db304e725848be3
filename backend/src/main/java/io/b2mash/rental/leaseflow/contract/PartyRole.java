package io.b2mash.rental.leaseflow.contract;

/** The roles a party can play on a rental contract. */
public enum PartyRole {
  LANDLORD,
  TENANT,
  GUARANTOR
}
