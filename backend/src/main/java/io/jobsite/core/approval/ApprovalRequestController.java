package io.jobsite.core.approval;

import io.jobsite.core.security.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ApprovalRequestController {

  private final ApprovalRequestService requestService;

  public ApprovalRequestController(ApprovalRequestService requestService) {
    this.requestService = requestService;
  }

  @PostMapping("/api/approval-requests")
  @PreAuthorize("hasAnyRole('COMPANY_MEMBER', 'COMPANY_ADMIN', 'COMPANY_OWNER')")
  public ResponseEntity<RequestResponse> startRequest(
      @Valid @RequestBody StartRequestRequest request) {
    UUID companyId = RequestScopes.requireCompanyId();
    UUID memberId = RequestScopes.requireMemberId();
    var approvalRequest =
        requestService.startRequest(
            companyId,
            request.workflowId(),
            request.projectId(),
            request.entityType(),
            request.entityId(),
            memberId);
    return ResponseEntity.created(URI.create("/api/approval-requests/" + approvalRequest.getId()))
        .body(RequestResponse.from(approvalRequest));
  }

  @GetMapping("/api/approval-requests/{id}")
  @PreAuthorize("hasAnyRole('COMPANY_MEMBER', 'COMPANY_ADMIN', 'COMPANY_OWNER')")
  public ResponseEntity<RequestResponse> getRequest(@PathVariable UUID id) {
    UUID companyId = RequestScopes.requireCompanyId();
    return ResponseEntity.ok(RequestResponse.from(requestService.getRequest(id, companyId)));
  }

  /** Defaults to the caller when {@code memberId} is omitted. */
  @GetMapping("/api/approval-requests/{id}/can-approve")
  @PreAuthorize("hasAnyRole('COMPANY_MEMBER', 'COMPANY_ADMIN', 'COMPANY_OWNER')")
  public ResponseEntity<CanApproveResponse> canApprove(
      @PathVariable UUID id, @RequestParam(required = false) UUID memberId) {
    UUID companyId = RequestScopes.requireCompanyId();
    UUID subject = memberId != null ? memberId : RequestScopes.requireMemberId();
    return ResponseEntity.ok(
        new CanApproveResponse(id, subject, requestService.canApprove(id, companyId, subject)));
  }

  @PostMapping("/api/approval-requests/{id}/actions")
  @PreAuthorize("hasAnyRole('COMPANY_MEMBER', 'COMPANY_ADMIN', 'COMPANY_OWNER')")
  public ResponseEntity<AdvanceResult> advance(
      @PathVariable UUID id, @Valid @RequestBody AdvanceRequest request) {
    UUID companyId = RequestScopes.requireCompanyId();
    UUID memberId = RequestScopes.requireMemberId();
    return ResponseEntity.ok(
        requestService.advance(id, companyId, memberId, request.decision(), request.notes()));
  }

  @GetMapping("/api/approval-requests/{id}/actions")
  @PreAuthorize("hasAnyRole('COMPANY_MEMBER', 'COMPANY_ADMIN', 'COMPANY_OWNER')")
  public ResponseEntity<List<ActionResponse>> listActions(@PathVariable UUID id) {
    UUID companyId = RequestScopes.requireCompanyId();
    return ResponseEntity.ok(
        requestService.listActions(id, companyId).stream().map(ActionResponse::from).toList());
  }

  @PostMapping("/api/approval-requests/{id}/cancel")
  @PreAuthorize("hasAnyRole('COMPANY_MEMBER', 'COMPANY_ADMIN', 'COMPANY_OWNER')")
  public ResponseEntity<AdvanceResult> cancel(
      @PathVariable UUID id, @RequestBody(required = false) CancelRequest request) {
    UUID companyId = RequestScopes.requireCompanyId();
    UUID memberId = RequestScopes.requireMemberId();
    String reason = request != null ? request.reason() : null;
    return ResponseEntity.ok(requestService.cancel(id, companyId, memberId, reason));
  }

  // --- DTOs ---

  public record StartRequestRequest(
      @NotNull(message = "workflowId is required") UUID workflowId,
      @NotNull(message = "projectId is required") UUID projectId,
      @NotBlank(message = "entityType is required") @Size(max = 50) String entityType,
      @NotNull(message = "entityId is required") UUID entityId) {}

  public record AdvanceRequest(
      @NotNull(message = "decision is required") ApprovalDecision decision, String notes) {}

  public record CancelRequest(String reason) {}

  public record CanApproveResponse(UUID requestId, UUID memberId, boolean canApprove) {}

  public record RequestResponse(
      UUID id,
      UUID workflowId,
      UUID projectId,
      String entityType,
      UUID entityId,
      int currentStep,
      ApprovalStatus status,
      UUID initiatedBy,
      Instant initiatedAt,
      Instant completedAt) {

    public static RequestResponse from(ApprovalRequest request) {
      return new RequestResponse(
          request.getId(),
          request.getWorkflowId(),
          request.getProjectId(),
          request.getEntityType(),
          request.getEntityId(),
          request.getCurrentStep(),
          request.getStatus(),
          request.getInitiatedBy(),
          request.getInitiatedAt(),
          request.getCompletedAt());
    }
  }

  public record ActionResponse(
      UUID id,
      int stepOrder,
      ApprovalActionType action,
      UUID actorId,
      String notes,
      Instant createdAt) {

    public static ActionResponse from(ApprovalAction action) {
      return new ActionResponse(
          action.getId(),
          action.getStepOrder(),
          action.getAction(),
          action.getActorId(),
          action.getNotes(),
          action.getCreatedAt());
    }
  }
}
