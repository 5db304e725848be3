package io.b2mash.rental.leaseflow.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/**
 * Builds the {@link ProblemDetail} bodies shared by all workflow exceptions. Every body carries a
 * stable {@code code} property so callers can branch without parsing titles.
 */
final class WorkflowProblems {

  static final String CODE_PROPERTY = "code";

  private WorkflowProblems() {}

  static ProblemDetail create(HttpStatus status, String code, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty(CODE_PROPERTY, code);
    return problem;
  }
}
