package io.b2mash.rental.leaseflow.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler({
    VersionConflictException.class,
    NotYourTurnException.class,
    WrongActorException.class,
    TokenExpiredException.class,
    TokenAlreadyConsumedException.class
  })
  public ResponseEntity<ProblemDetail> handleRejectedWorkflowCall(
      ErrorResponseException ex, HttpServletRequest request) {
    log.warn(
        "Workflow call rejected: path={}, method={}, code={}, detail={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getBody().getProperties() != null
            ? ex.getBody().getProperties().get(WorkflowProblems.CODE_PROPERTY)
            : null,
        ex.getBody().getDetail());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }
}
