package io.b2mash.rental.leaseflow.contract;

import io.b2mash.rental.leaseflow.audit.AuditEventBuilder;
import io.b2mash.rental.leaseflow.audit.AuditService;
import io.b2mash.rental.leaseflow.event.ContractStatusChangedEvent;
import io.b2mash.rental.leaseflow.exception.IllegalTransitionException;
import io.b2mash.rental.leaseflow.exception.PreconditionFailedException;
import io.b2mash.rental.leaseflow.exception.WrongActorException;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * The single authority over contract status. Party-requested edges go through {@link #apply};
 * automatic edges through {@link #advance}. Both record the move in the workflow history and
 * publish a {@link ContractStatusChangedEvent}.
 *
 * <p>Checks run in a fixed order so callers see a stable error: undefined edge, then role, then
 * whether the role's party has joined, then whether the acting party is that party.
 */
@Component
public class ContractStateMachine {

  private static final Logger log = LoggerFactory.getLogger(ContractStateMachine.class);

  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public ContractStateMachine(
      AuditService auditService, ApplicationEventPublisher eventPublisher, Clock clock) {
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /** Validates a party-requested transition without performing it. */
  public void authorize(RentalContract contract, ContractTransition transition, Actor actor) {
    if (!transition.isAllowedFrom(contract.getStatus())) {
      throw new IllegalTransitionException(contract.getStatus(), transition.target());
    }
    if (transition.isAutomatic() || !transition.permits(actor.role())) {
      throw new WrongActorException(
          actor.role(), actor.role() + " may not perform " + transition + " on this contract");
    }
    requireParty(contract, actor);
  }

  /**
   * Checks that {@code actor} is the party bound to its role on this contract.
   *
   * @throws PreconditionFailedException if nobody holds the role yet
   * @throws WrongActorException if a different party holds it
   */
  public void requireParty(RentalContract contract, Actor actor) {
    var boundParty = contract.partyIdFor(actor.role());
    if (boundParty == null) {
      throw new PreconditionFailedException(
          "No " + actor.role() + " has joined contract " + contract.getId());
    }
    if (!boundParty.equals(actor.partyId())) {
      throw new WrongActorException(
          actor.role(), "Party " + actor.partyId() + " is not this contract's " + actor.role());
    }
  }

  /** Checks that {@code actor} is the bound party for {@code role}. */
  public void requireParty(RentalContract contract, Actor actor, PartyRole role) {
    if (actor.role() != role) {
      throw new WrongActorException(actor.role(), "Only the " + role + " may do this");
    }
    requireParty(contract, actor);
  }

  /** Authorizes and performs a party-requested transition. */
  public void apply(
      RentalContract contract,
      ContractTransition transition,
      Actor actor,
      Map<String, Object> details) {
    authorize(contract, transition, actor);
    move(contract, transition, actor, details);
  }

  /** Performs an automatic transition taken by the workflow itself. */
  public void advance(
      RentalContract contract, ContractTransition transition, Map<String, Object> details) {
    if (!transition.isAutomatic()) {
      throw new IllegalStateException(transition + " must be requested by a party");
    }
    if (!transition.isAllowedFrom(contract.getStatus())) {
      throw new IllegalTransitionException(contract.getStatus(), transition.target());
    }
    move(contract, transition, null, details);
  }

  private void move(
      RentalContract contract,
      ContractTransition transition,
      Actor actor,
      Map<String, Object> details) {
    var from = contract.getStatus();
    var to = transition.target();
    var now = clock.instant();
    contract.moveTo(to, now);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("contract.status_changed")
            .entityType("contract")
            .entityId(contract.getId())
            .contractId(contract.getId())
            .actor(actor)
            .detail("transition", transition.name())
            .detail("from", from.name())
            .detail("to", to.name())
            .details(details)
            .build());

    eventPublisher.publishEvent(
        new ContractStatusChangedEvent(
            "contract.status_changed",
            contract.getId(),
            actor != null ? actor.role() : null,
            actor != null ? actor.partyId() : null,
            now,
            from,
            to,
            transition.name(),
            contract.getLandlordId(),
            contract.getLandlordEmail(),
            contract.getTenantEmail()));

    log.info(
        "Contract {} moved {} -> {} via {} by {}",
        contract.getId(),
        from,
        to,
        transition,
        actor != null ? actor.role() : "SYSTEM");
  }
}
