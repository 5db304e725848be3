package io.b2mash.rental.leaseflow.exception;

import io.b2mash.rental.leaseflow.contract.ContractStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** No edge of the contract lifecycle leads from the current status to the requested one. */
public class IllegalTransitionException extends ErrorResponseException {

  public static final String CODE = "ILLEGAL_TRANSITION";

  private final ContractStatus currentStatus;

  public IllegalTransitionException(ContractStatus currentStatus, ContractStatus targetStatus) {
    super(HttpStatus.CONFLICT, createProblem(currentStatus, targetStatus), null);
    this.currentStatus = currentStatus;
  }

  public ContractStatus getCurrentStatus() {
    return currentStatus;
  }

  private static ProblemDetail createProblem(ContractStatus current, ContractStatus target) {
    var problem =
        WorkflowProblems.create(
            HttpStatus.CONFLICT,
            CODE,
            "Illegal transition",
            "Cannot move contract from " + current + " to " + target);
    problem.setProperty("currentStatus", current);
    problem.setProperty("targetStatus", target);
    return problem;
  }
}
