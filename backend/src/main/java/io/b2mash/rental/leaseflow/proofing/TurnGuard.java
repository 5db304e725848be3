package io.b2mash.rental.leaseflow.proofing;

import io.b2mash.rental.leaseflow.contract.Actor;
import io.b2mash.rental.leaseflow.contract.ContractStatus;
import io.b2mash.rental.leaseflow.contract.PartyRole;
import io.b2mash.rental.leaseflow.contract.RentalContract;
import io.b2mash.rental.leaseflow.exception.NotYourTurnException;
import io.b2mash.rental.leaseflow.exception.WrongActorException;
import org.springframework.stereotype.Component;

/**
 * Decides which party may submit the next proofing step. The turn is a function of the contract
 * status alone, so a party whose record completed can never act again: the status has already
 * moved past its turn.
 */
@Component
public class TurnGuard {

  /** The role holding the proofing turn in {@code status}, or null when no proofing is open. */
  public PartyRole turnFor(ContractStatus status) {
    return switch (status) {
      case TENANT_PROOFING -> PartyRole.TENANT;
      case GUARANTOR_PROOFING -> PartyRole.GUARANTOR;
      case LANDLORD_PROOFING -> PartyRole.LANDLORD;
      default -> null;
    };
  }

  /**
   * Rejects {@code actor} unless it is the party holding the turn.
   *
   * @throws NotYourTurnException if another role holds the turn, or nobody does
   * @throws WrongActorException if the role matches but the party id is not the contract's party
   */
  public void check(RentalContract contract, Actor actor) {
    var turn = turnFor(contract.getStatus());
    if (turn == null) {
      throw new NotYourTurnException(
          null,
          null,
          "No identity proofing is open while the contract is " + contract.getStatus());
    }
    if (actor.role() != turn) {
      throw new NotYourTurnException(
          turn, contract.partyIdFor(turn), "Waiting for the " + turn + " to complete proofing");
    }
    if (!actor.partyId().equals(contract.partyIdFor(turn))) {
      throw new WrongActorException(
          actor.role(), "Party " + actor.partyId() + " is not this contract's " + turn);
    }
  }
}
