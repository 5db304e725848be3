package io.b2mash.rental.leaseflow.invitation;

import io.b2mash.rental.leaseflow.contract.Actor;
import io.b2mash.rental.leaseflow.contract.PartyRole;
import io.b2mash.rental.leaseflow.exception.WrongActorException;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Endpoint used by the invited tenant, who holds nothing but the token from the email link. */
@RestController
@RequestMapping("/api/portal/invitations")
public class PortalInvitationController {

  private final InvitationService invitationService;

  public PortalInvitationController(InvitationService invitationService) {
    this.invitationService = invitationService;
  }

  @PostMapping("/{token}/accept")
  public ResponseEntity<AcceptInvitationResponse> accept(
      @PathVariable String token, Actor actor) {
    if (actor.role() != PartyRole.TENANT) {
      throw new WrongActorException(actor.role(), "Only a tenant can accept an invitation");
    }
    var accepted = invitationService.accept(token, actor.partyId());
    return ResponseEntity.ok(
        new AcceptInvitationResponse(accepted.contractId(), accepted.version()));
  }

  public record AcceptInvitationResponse(UUID contractId, int version) {}
}
