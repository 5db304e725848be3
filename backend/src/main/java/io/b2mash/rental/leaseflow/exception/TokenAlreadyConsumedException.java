package io.b2mash.rental.leaseflow.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class TokenAlreadyConsumedException extends ErrorResponseException {

  public static final String CODE = "TOKEN_ALREADY_CONSUMED";

  public TokenAlreadyConsumedException() {
    super(
        HttpStatus.GONE,
        WorkflowProblems.create(
            HttpStatus.GONE,
            CODE,
            "Invitation already used",
            "This invitation has already been accepted and cannot be used again"),
        null);
  }
}
