package io.b2mash.rental.leaseflow.contract;

import io.b2mash.rental.leaseflow.event.ContractStatusChangedEvent;
import io.b2mash.rental.leaseflow.event.DomainEvent;
import io.b2mash.rental.leaseflow.event.ObjectionsSubmittedEvent;
import io.b2mash.rental.leaseflow.integration.email.EmailMessage;
import io.b2mash.rental.leaseflow.integration.email.EmailProvider;
import java.util.ArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Sends after-commit notices for the milestones parties care about: objections raised, contract
 * activated, terminated or expired. Delivery failures are logged and never affect the workflow.
 */
@Component
public class ContractNotificationHandler {

  private static final Logger log = LoggerFactory.getLogger(ContractNotificationHandler.class);

  private final EmailProvider emailProvider;

  public ContractNotificationHandler(EmailProvider emailProvider) {
    this.emailProvider = emailProvider;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onObjectionsSubmitted(ObjectionsSubmittedEvent event) {
    send(
        event.landlordEmail(),
        "Your tenant raised objections",
        "The tenant raised "
            + event.objectionCount()
            + " objection(s) on contract "
            + event.contractId()
            + ". Revise the terms or acknowledge them to send the contract back for review.",
        "OBJECTIONS",
        event);
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onStatusChanged(ContractStatusChangedEvent event) {
    var recipients = new ArrayList<String>();
    recipients.add(event.landlordEmail());
    switch (event.toStatus()) {
      case ACTIVE -> {
        recipients.add(event.tenantEmail());
        for (var to : recipients) {
          send(
              to,
              "Your rental contract is active",
              "All parties completed identity proofing. Contract "
                  + event.contractId()
                  + " is now legally active.",
              "ACTIVATED",
              event);
        }
      }
      case TERMINATED -> {
        recipients.add(event.tenantEmail());
        for (var to : recipients) {
          send(
              to,
              "Rental contract terminated",
              "Contract "
                  + event.contractId()
                  + " was terminated by the "
                  + event.actorRole()
                  + ".",
              "TERMINATED",
              event);
        }
      }
      case EXPIRED ->
          send(
              event.landlordEmail(),
              "Tenant invitation expired",
              "The invitation for contract "
                  + event.contractId()
                  + " expired before the tenant joined. You can re-issue it.",
              "EXPIRED",
              event);
      default -> {
        // other transitions are visible in the workflow status
      }
    }
  }

  private void send(
      String to,
      String subject,
      String body,
      String referenceType,
      DomainEvent event) {
    if (to == null || to.isBlank()) {
      return;
    }
    try {
      var result =
          emailProvider.sendEmail(
              EmailMessage.forContract(
                  to, subject, body, referenceType, event.contractId().toString()));
      if (!result.success()) {
        log.warn(
            "{} notice for contract {} not delivered: {}",
            referenceType,
            event.contractId(),
            result.errorMessage());
      }
    } catch (Exception e) {
      log.warn("Failed to send {} notice for contract {}", referenceType, event.contractId(), e);
    }
  }
}
