package io.b2mash.rental.leaseflow.audit;

import io.b2mash.rental.leaseflow.contract.ContractStore;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WorkflowHistoryController {

  private final AuditService auditService;
  private final ContractStore contractStore;

  public WorkflowHistoryController(AuditService auditService, ContractStore contractStore) {
    this.auditService = auditService;
    this.contractStore = contractStore;
  }

  @GetMapping("/api/contracts/{id}/history")
  public ResponseEntity<WorkflowHistoryResponse> getWorkflowHistory(@PathVariable UUID id) {
    contractStore.require(id);
    var history = auditService.findHistory(id);
    var tampered = auditService.findFirstTamperedEntry(history);
    return ResponseEntity.ok(
        new WorkflowHistoryResponse(
            id,
            tampered == null,
            tampered != null ? tampered.getSequenceNumber() : null,
            history.stream().map(HistoryEntryResponse::from).toList()));
  }

  // --- DTOs ---

  /**
   * @param intact false when an entry's hash or chain link no longer verifies
   * @param firstTamperedSequence sequence number of the first entry failing verification
   */
  public record WorkflowHistoryResponse(
      UUID contractId,
      boolean intact,
      Long firstTamperedSequence,
      List<HistoryEntryResponse> entries) {}

  public record HistoryEntryResponse(
      UUID id,
      long sequenceNumber,
      String eventType,
      String entityType,
      UUID entityId,
      UUID actorId,
      String actorType,
      String source,
      Map<String, String> details,
      Instant occurredAt,
      String integrityHash,
      boolean hashValid) {

    public static HistoryEntryResponse from(AuditEvent event) {
      return new HistoryEntryResponse(
          event.getId(),
          event.getSequenceNumber(),
          event.getEventType(),
          event.getEntityType(),
          event.getEntityId(),
          event.getActorId(),
          event.getActorType(),
          event.getSource(),
          event.getDetails(),
          event.getOccurredAt(),
          event.getIntegrityHash(),
          event.hasValidHash());
    }
  }
}
