package io.b2mash.rental.leaseflow.exception;

import io.b2mash.rental.leaseflow.contract.PartyRole;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The acting party is not authorized for this edge of the lifecycle. */
public class WrongActorException extends ErrorResponseException {

  public static final String CODE = "WRONG_ACTOR";

  public WrongActorException(PartyRole actorRole, String detail) {
    super(HttpStatus.FORBIDDEN, createProblem(actorRole, detail), null);
  }

  private static ProblemDetail createProblem(PartyRole actorRole, String detail) {
    var problem =
        WorkflowProblems.create(HttpStatus.FORBIDDEN, CODE, "Actor not authorized", detail);
    problem.setProperty("actorRole", actorRole);
    return problem;
  }
}
