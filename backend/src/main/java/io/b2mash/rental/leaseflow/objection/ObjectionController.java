package io.b2mash.rental.leaseflow.objection;

import io.b2mash.rental.leaseflow.contract.Actor;
import io.b2mash.rental.leaseflow.contract.ContractController.ObjectionResponse;
import io.b2mash.rental.leaseflow.contract.ContractController.TermsRequest;
import io.b2mash.rental.leaseflow.contract.TransitionResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ObjectionController {

  private final ObjectionService objectionService;

  public ObjectionController(ObjectionService objectionService) {
    this.objectionService = objectionService;
  }

  @PostMapping("/api/contracts/{id}/objections")
  public ResponseEntity<TransitionResponse> submitObjections(
      @PathVariable UUID id, Actor actor, @Valid @RequestBody SubmitObjectionsRequest request) {
    var submissions =
        request.objections().stream()
            .map(
                o ->
                    new ObjectionSubmission(
                        o.text(), o.fieldReference(), o.proposedModification()))
            .toList();
    var contract =
        objectionService.submitObjections(id, request.expectedVersion(), actor, submissions);
    return ResponseEntity.ok(TransitionResponse.from(contract));
  }

  @GetMapping("/api/contracts/{id}/objections")
  public ResponseEntity<List<ObjectionResponse>> listObjections(@PathVariable UUID id) {
    return ResponseEntity.ok(
        objectionService.listObjections(id).stream().map(ObjectionResponse::from).toList());
  }

  @PostMapping("/api/contracts/{id}/revise")
  public ResponseEntity<TransitionResponse> reviseAndResubmit(
      @PathVariable UUID id, Actor actor, @Valid @RequestBody ReviseRequest request) {
    var contract =
        objectionService.reviseAndResubmit(
            id,
            request.expectedVersion(),
            actor,
            request.terms() != null ? request.terms().toTerms() : null,
            request.response());
    return ResponseEntity.ok(TransitionResponse.from(contract));
  }

  // --- DTOs ---

  public record ObjectionRequest(
      String text,
      @Size(max = 100) String fieldReference,
      @Size(max = 2000) String proposedModification) {}

  public record SubmitObjectionsRequest(
      @NotNull Integer expectedVersion, @NotEmpty List<@Valid ObjectionRequest> objections) {}

  public record ReviseRequest(
      @NotNull Integer expectedVersion,
      @Valid TermsRequest terms,
      @Size(max = 2000) String response) {}
}
