package io.b2mash.rental.leaseflow.exception;

import io.b2mash.rental.leaseflow.contract.PartyRole;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A proofing action was attempted by a party that does not hold the turn. Rendered as 423 Locked,
 * never as a conflict: callers show a wait state instead of re-fetching.
 *
 * <p>{@code currentTurn} is null when no party may submit proofing steps in the current status.
 * {@code waitingFor} is the id of the party holding the turn, when one is attached.
 */
public class NotYourTurnException extends ErrorResponseException {

  public static final String CODE = "NOT_YOUR_TURN";

  private final PartyRole currentTurn;
  private final UUID waitingFor;

  public NotYourTurnException(PartyRole currentTurn, UUID waitingFor, String detail) {
    super(HttpStatus.LOCKED, createProblem(currentTurn, waitingFor, detail), null);
    this.currentTurn = currentTurn;
    this.waitingFor = waitingFor;
  }

  public PartyRole getCurrentTurn() {
    return currentTurn;
  }

  public UUID getWaitingFor() {
    return waitingFor;
  }

  private static ProblemDetail createProblem(
      PartyRole currentTurn, UUID waitingFor, String detail) {
    var problem = WorkflowProblems.create(HttpStatus.LOCKED, CODE, "Not your turn", detail);
    problem.setProperty("currentTurn", currentTurn);
    problem.setProperty("waitingFor", waitingFor);
    return problem;
  }
}
