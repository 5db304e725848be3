package io.b2mash.rental.leaseflow.invitation;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled job that expires lapsed invitations nobody presented, moving their contracts from
 * TENANT_REVIEW to EXPIRED. Each contract is handled in its own transaction so one failure does not
 * stop the sweep.
 */
@Component
@ConditionalOnProperty(
    name = "leaseflow.invitation.sweep-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class InvitationExpiryProcessor {

  private static final Logger log = LoggerFactory.getLogger(InvitationExpiryProcessor.class);

  private final InvitationRepository invitationRepository;
  private final InvitationService invitationService;
  private final Clock clock;

  public InvitationExpiryProcessor(
      InvitationRepository invitationRepository,
      InvitationService invitationService,
      Clock clock) {
    this.invitationRepository = invitationRepository;
    this.invitationService = invitationService;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${leaseflow.invitation.sweep-interval:3600000}")
  public void processExpired() {
    log.info("Invitation expiry processor started");
    var contractIds =
        invitationRepository.findContractIdsWithLapsedInvitations(
            InvitationStatus.ACTIVE, clock.instant());
    int expired = 0;

    for (var contractId : contractIds) {
      try {
        if (invitationService.expireIfLapsed(contractId)) {
          expired++;
        }
      } catch (Exception e) {
        log.error("Invitation expiry failed for contract {}", contractId, e);
      }
    }

    if (expired > 0) {
      log.info("Invitation expiry processor completed: {} invitations expired", expired);
    } else {
      log.info("Invitation expiry processor completed: no invitations expired");
    }
  }
}
