package io.b2mash.rental.leaseflow.exception;

import io.b2mash.rental.leaseflow.proofing.ProofStepName;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class OutOfOrderStepException extends ErrorResponseException {

  public static final String CODE = "OUT_OF_ORDER_STEP";

  public OutOfOrderStepException(ProofStepName expectedStep, ProofStepName submittedStep) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(expectedStep, submittedStep), null);
  }

  private static ProblemDetail createProblem(ProofStepName expected, ProofStepName submitted) {
    var problem =
        WorkflowProblems.create(
            HttpStatus.UNPROCESSABLE_ENTITY,
            CODE,
            "Out of order step",
            "Expected step " + expected + " but received " + submitted);
    problem.setProperty("expectedStep", expected);
    problem.setProperty("submittedStep", submitted);
    return problem;
  }
}
