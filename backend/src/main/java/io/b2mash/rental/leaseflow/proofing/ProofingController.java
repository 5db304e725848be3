package io.b2mash.rental.leaseflow.proofing;

import io.b2mash.rental.leaseflow.contract.Actor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProofingController {

  private final IdentityProofingService identityProofingService;

  public ProofingController(IdentityProofingService identityProofingService) {
    this.identityProofingService = identityProofingService;
  }

  /**
   * Submits one proofing step. A failed verification is a normal 200 response with {@code
   * accepted=false}; the step can be retried.
   */
  @PostMapping("/api/contracts/{id}/proofing/steps")
  public ResponseEntity<ProofStepResult> submitStep(
      @PathVariable UUID id, Actor actor, @Valid @RequestBody SubmitStepRequest request) {
    var result =
        identityProofingService.submitStep(
            id,
            request.expectedVersion(),
            actor,
            ProofStepName.parse(request.step()),
            request.payloadRef());
    return ResponseEntity.ok(result);
  }

  public record SubmitStepRequest(
      @NotNull Integer expectedVersion,
      @NotBlank String step,
      @NotBlank @Size(max = 500) String payloadRef) {}
}
