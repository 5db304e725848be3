package io.b2mash.rental.leaseflow.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** Malformed request that no workflow rule covers (e.g. an unknown step name). */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(
        HttpStatus.BAD_REQUEST,
        WorkflowProblems.create(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", title, detail),
        null);
  }
}
