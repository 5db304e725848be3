package io.b2mash.rental.leaseflow.invitation;

import io.b2mash.rental.leaseflow.contract.Actor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class InvitationController {

  private final InvitationService invitationService;

  public InvitationController(InvitationService invitationService) {
    this.invitationService = invitationService;
  }

  @PostMapping("/api/contracts/{id}/invitations")
  public ResponseEntity<IssuedInvitationResponse> reissueInvitation(
      @PathVariable UUID id, Actor actor, @Valid @RequestBody ReissueRequest request) {
    var issued = invitationService.reissue(id, request.expectedVersion(), actor);
    return ResponseEntity.created(URI.create("/api/contracts/" + id + "/invitations"))
        .body(IssuedInvitationResponse.from(issued));
  }

  @GetMapping("/api/contracts/{id}/invitations")
  public ResponseEntity<List<InvitationResponse>> listInvitations(@PathVariable UUID id) {
    return ResponseEntity.ok(
        invitationService.listForContract(id).stream().map(InvitationResponse::from).toList());
  }

  // --- DTOs ---

  public record ReissueRequest(@NotNull Integer expectedVersion) {}

  public record IssuedInvitationResponse(
      UUID invitationId, UUID contractId, String token, Instant expiresAt, int version) {

    public static IssuedInvitationResponse from(IssuedInvitation issued) {
      return new IssuedInvitationResponse(
          issued.invitationId(),
          issued.contractId(),
          issued.token(),
          issued.expiresAt(),
          issued.contractVersion());
    }
  }

  public record InvitationResponse(
      UUID id,
      InvitationStatus status,
      String issuedTo,
      Instant expiresAt,
      Instant consumedAt,
      UUID consumedBy,
      Instant closedAt,
      Instant createdAt) {

    public static InvitationResponse from(ContractInvitation invitation) {
      return new InvitationResponse(
          invitation.getId(),
          invitation.getStatus(),
          invitation.getIssuedTo(),
          invitation.getExpiresAt(),
          invitation.getConsumedAt(),
          invitation.getConsumedBy(),
          invitation.getClosedAt(),
          invitation.getCreatedAt());
    }
  }
}
