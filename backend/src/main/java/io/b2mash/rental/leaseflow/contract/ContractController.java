package io.b2mash.rental.leaseflow.contract;

import io.b2mash.rental.leaseflow.invitation.IssuedInvitation;
import io.b2mash.rental.leaseflow.objection.ContractObjection;
import io.b2mash.rental.leaseflow.objection.ObjectionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/contracts")
public class ContractController {

  private final ContractWorkflowService workflowService;
  private final WorkflowStatusService workflowStatusService;
  private final ObjectionService objectionService;

  public ContractController(
      ContractWorkflowService workflowService,
      WorkflowStatusService workflowStatusService,
      ObjectionService objectionService) {
    this.workflowService = workflowService;
    this.workflowStatusService = workflowStatusService;
    this.objectionService = objectionService;
  }

  @PostMapping
  public ResponseEntity<ContractResponse> createDraft(
      Actor actor, @Valid @RequestBody CreateContractRequest request) {
    var contract =
        workflowService.createDraft(
            actor,
            request.landlordEmail(),
            request.tenantEmail(),
            request.terms() != null ? request.terms().toTerms() : null);
    return ResponseEntity.created(URI.create("/api/contracts/" + contract.getId()))
        .body(ContractResponse.from(contract, List.of()));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ContractResponse> getContract(@PathVariable UUID id) {
    var contract = workflowService.getContract(id);
    return ResponseEntity.ok(ContractResponse.from(contract, objectionService.listObjections(id)));
  }

  @PutMapping("/{id}/terms")
  public ResponseEntity<TransitionResponse> updateTerms(
      @PathVariable UUID id, Actor actor, @Valid @RequestBody UpdateTermsRequest request) {
    var contract =
        workflowService.updateTerms(
            id, request.expectedVersion(), actor, request.terms().toTerms());
    return ResponseEntity.ok(TransitionResponse.from(contract));
  }

  @PostMapping("/{id}/guarantor")
  public ResponseEntity<TransitionResponse> attachGuarantor(
      @PathVariable UUID id, Actor actor, @Valid @RequestBody AttachGuarantorRequest request) {
    var contract =
        workflowService.attachGuarantor(
            id, request.expectedVersion(), actor, request.guarantorId());
    return ResponseEntity.ok(TransitionResponse.from(contract));
  }

  @PostMapping("/{id}/submit-for-review")
  public ResponseEntity<SubmitForReviewResponse> submitForReview(
      @PathVariable UUID id, Actor actor, @Valid @RequestBody VersionedRequest request) {
    var submission = workflowService.submitForReview(id, request.expectedVersion(), actor);
    return ResponseEntity.ok(SubmitForReviewResponse.from(submission));
  }

  @PostMapping("/{id}/approve")
  public ResponseEntity<TransitionResponse> approve(
      @PathVariable UUID id, Actor actor, @Valid @RequestBody VersionedRequest request) {
    var contract = workflowService.approve(id, request.expectedVersion(), actor);
    return ResponseEntity.ok(TransitionResponse.from(contract));
  }

  @PostMapping("/{id}/terminate")
  public ResponseEntity<TransitionResponse> terminate(
      @PathVariable UUID id, Actor actor, @Valid @RequestBody TerminateRequest request) {
    var contract =
        workflowService.terminate(id, request.expectedVersion(), actor, request.reason());
    return ResponseEntity.ok(TransitionResponse.from(contract));
  }

  @GetMapping("/{id}/workflow-status")
  public ResponseEntity<WorkflowStatus> getWorkflowStatus(@PathVariable UUID id) {
    return ResponseEntity.ok(workflowStatusService.getStatus(id));
  }

  // --- DTOs ---

  public record TermsRequest(
      @DecimalMin(value = "0.00", inclusive = false) BigDecimal monthlyRent,
      @DecimalMin("0.00") BigDecimal securityDeposit,
      @Positive Integer durationMonths,
      LocalDate startDate) {

    public ContractTerms toTerms() {
      return new ContractTerms(monthlyRent, securityDeposit, durationMonths, startDate);
    }
  }

  public record CreateContractRequest(
      @Email @Size(max = 255) String landlordEmail,
      @Email @Size(max = 255) String tenantEmail,
      @Valid TermsRequest terms) {}

  public record UpdateTermsRequest(
      @NotNull Integer expectedVersion, @NotNull @Valid TermsRequest terms) {}

  public record AttachGuarantorRequest(
      @NotNull Integer expectedVersion, @NotNull UUID guarantorId) {}

  public record VersionedRequest(@NotNull Integer expectedVersion) {}

  public record TerminateRequest(
      @NotNull Integer expectedVersion, @NotBlank @Size(max = 1000) String reason) {}

  public record TermsResponse(
      BigDecimal monthlyRent,
      BigDecimal securityDeposit,
      Integer durationMonths,
      LocalDate startDate,
      boolean complete) {

    public static TermsResponse from(ContractTerms terms) {
      return new TermsResponse(
          terms.getMonthlyRent(),
          terms.getSecurityDeposit(),
          terms.getDurationMonths(),
          terms.getStartDate(),
          terms.isComplete());
    }
  }

  public record ObjectionResponse(
      UUID id,
      int sequenceNumber,
      UUID authorId,
      String text,
      String fieldReference,
      String proposedModification,
      boolean resolved,
      Instant resolvedAt,
      String landlordResponse,
      Instant createdAt) {

    public static ObjectionResponse from(ContractObjection objection) {
      return new ObjectionResponse(
          objection.getId(),
          objection.getSequenceNumber(),
          objection.getAuthorId(),
          objection.getText(),
          objection.getFieldReference(),
          objection.getProposedModification(),
          objection.isResolved(),
          objection.getResolvedAt(),
          objection.getLandlordResponse(),
          objection.getCreatedAt());
    }
  }

  public record ContractResponse(
      UUID id,
      int version,
      ContractStatus status,
      UUID landlordId,
      String landlordEmail,
      UUID tenantId,
      String tenantEmail,
      UUID guarantorId,
      TermsResponse terms,
      List<ObjectionResponse> objections,
      Instant submittedForReviewAt,
      Instant tenantJoinedAt,
      Instant tenantApprovedAt,
      Instant activatedAt,
      Instant closedAt,
      String closureReason,
      PartyRole closedByRole,
      Instant createdAt,
      Instant updatedAt) {

    public static ContractResponse from(
        RentalContract contract, List<ContractObjection> objections) {
      return new ContractResponse(
          contract.getId(),
          contract.getVersion(),
          contract.getStatus(),
          contract.getLandlordId(),
          contract.getLandlordEmail(),
          contract.getTenantId(),
          contract.getTenantEmail(),
          contract.getGuarantorId(),
          TermsResponse.from(contract.getTerms()),
          objections.stream().map(ObjectionResponse::from).toList(),
          contract.getSubmittedForReviewAt(),
          contract.getTenantJoinedAt(),
          contract.getTenantApprovedAt(),
          contract.getActivatedAt(),
          contract.getClosedAt(),
          contract.getClosureReason(),
          contract.getClosedByRole(),
          contract.getCreatedAt(),
          contract.getUpdatedAt());
    }
  }

  public record SubmitForReviewResponse(
      UUID contractId,
      ContractStatus status,
      int version,
      UUID invitationId,
      String invitationToken,
      Instant invitationExpiresAt) {

    public static SubmitForReviewResponse from(ReviewSubmission submission) {
      var contract = submission.contract();
      IssuedInvitation invitation = submission.invitation();
      return new SubmitForReviewResponse(
          contract.getId(),
          contract.getStatus(),
          contract.getVersion(),
          invitation != null ? invitation.invitationId() : null,
          invitation != null ? invitation.token() : null,
          invitation != null ? invitation.expiresAt() : null);
    }
  }
}
