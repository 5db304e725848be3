package io.b2mash.rental.leaseflow.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A transition is defined and the actor is right, but the contract does not satisfy the
 * transition's precondition (incomplete terms, empty objections, tenant not attached...).
 */
public class PreconditionFailedException extends ErrorResponseException {

  public static final String CODE = "PRECONDITION_FAILED";

  private final List<String> violations;

  public PreconditionFailedException(String detail, List<String> violations) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(detail, violations), null);
    this.violations = List.copyOf(violations);
  }

  public PreconditionFailedException(String detail) {
    this(detail, List.of());
  }

  public List<String> getViolations() {
    return violations;
  }

  private static ProblemDetail createProblem(String detail, List<String> violations) {
    var problem =
        WorkflowProblems.create(
            HttpStatus.UNPROCESSABLE_ENTITY, CODE, "Precondition failed", detail);
    problem.setProperty("violations", violations);
    return problem;
  }
}
