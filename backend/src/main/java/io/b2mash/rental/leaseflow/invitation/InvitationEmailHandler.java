package io.b2mash.rental.leaseflow.invitation;

import io.b2mash.rental.leaseflow.event.InvitationIssuedEvent;
import io.b2mash.rental.leaseflow.integration.email.EmailMessage;
import io.b2mash.rental.leaseflow.integration.email.EmailProvider;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/** Emails the invitation link to the tenant once the issuing transaction has committed. */
@Component
public class InvitationEmailHandler {

  private static final Logger log = LoggerFactory.getLogger(InvitationEmailHandler.class);

  private static final DateTimeFormatter EMAIL_DATE_FORMAT =
      DateTimeFormatter.ofPattern("d MMMM yyyy HH:mm 'UTC'").withZone(ZoneOffset.UTC);

  private final EmailProvider emailProvider;
  private final String portalBaseUrl;

  public InvitationEmailHandler(
      EmailProvider emailProvider,
      @Value("${leaseflow.portal.base-url:http://localhost:3000}") String portalBaseUrl) {
    this.emailProvider = emailProvider;
    this.portalBaseUrl = portalBaseUrl;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onInvitationIssued(InvitationIssuedEvent event) {
    var link = portalBaseUrl + "/invitations/" + event.rawToken();
    var body =
        "You have been invited to review a rental contract.\n\n"
            + "Open "
            + link
            + " to join. The link is valid until "
            + EMAIL_DATE_FORMAT.format(event.expiresAt())
            + " and can be used once.";
    try {
      var result =
          emailProvider.sendEmail(
              EmailMessage.forContract(
                  event.tenantEmail(),
                  event.reissue()
                      ? "Your rental contract invitation was renewed"
                      : "You are invited to a rental contract",
                  body,
                  "INVITATION",
                  event.contractId().toString()));
      if (!result.success()) {
        log.warn(
            "Invitation email for contract {} not delivered: {}",
            event.contractId(),
            result.errorMessage());
      }
    } catch (Exception e) {
      log.warn("Failed to send invitation email for contract {}", event.contractId(), e);
    }
  }
}
