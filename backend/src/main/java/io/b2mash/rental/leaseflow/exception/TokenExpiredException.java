package io.b2mash.rental.leaseflow.exception;

import java.time.Instant;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The invitation token is no longer usable. Terminal for the token; the landlord must re-issue. */
public class TokenExpiredException extends ErrorResponseException {

  public static final String CODE = "TOKEN_EXPIRED";

  public TokenExpiredException(Instant expiredAt, String detail) {
    super(HttpStatus.GONE, createProblem(expiredAt, detail), null);
  }

  private static ProblemDetail createProblem(Instant expiredAt, String detail) {
    var problem = WorkflowProblems.create(HttpStatus.GONE, CODE, "Invitation expired", detail);
    problem.setProperty("expiredAt", expiredAt);
    return problem;
  }
}
