package io.b2mash.rental.leaseflow.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The caller's expected version is stale. The caller must re-fetch the contract and decide whether
 * to retry; nothing was mutated.
 */
public class VersionConflictException extends ErrorResponseException {

  public static final String CODE = "VERSION_CONFLICT";

  private final UUID contractId;

  public VersionConflictException(UUID contractId, int expectedVersion, int currentVersion) {
    super(HttpStatus.CONFLICT, createProblem(contractId, expectedVersion, currentVersion), null);
    this.contractId = contractId;
  }

  /** Raised when a concurrent writer committed first and the actual version is unknown. */
  public VersionConflictException(UUID contractId, Throwable cause) {
    super(
        HttpStatus.CONFLICT,
        WorkflowProblems.create(
            HttpStatus.CONFLICT,
            CODE,
            "Concurrent modification",
            "Contract " + contractId + " was modified concurrently. Re-fetch and retry."),
        cause);
    this.contractId = contractId;
  }

  public UUID getContractId() {
    return contractId;
  }

  private static ProblemDetail createProblem(UUID contractId, int expected, int current) {
    var problem =
        WorkflowProblems.create(
            HttpStatus.CONFLICT,
            CODE,
            "Version conflict",
            "Contract "
                + contractId
                + " is at version "
                + current
                + " but version "
                + expected
                + " was expected");
    problem.setProperty("expectedVersion", expected);
    problem.setProperty("currentVersion", current);
    return problem;
  }
}
