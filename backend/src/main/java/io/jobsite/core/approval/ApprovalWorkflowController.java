package io.jobsite.core.approval;

import io.jobsite.core.security.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
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
public class ApprovalWorkflowController {

  private final ApprovalWorkflowService workflowService;
  private final ApproverResolver approverResolver;

  public ApprovalWorkflowController(
      ApprovalWorkflowService workflowService, ApproverResolver approverResolver) {
    this.workflowService = workflowService;
    this.approverResolver = approverResolver;
  }

  @PostMapping("/api/approval-workflows")
  @PreAuthorize("hasAnyRole('COMPANY_ADMIN', 'COMPANY_OWNER')")
  public ResponseEntity<WorkflowResponse> createWorkflow(
      @Valid @RequestBody CreateWorkflowRequest request) {
    UUID companyId = RequestScopes.requireCompanyId();
    UUID memberId = RequestScopes.requireMemberId();

    var steps = request.steps().stream().map(StepRequest::toDefinition).toList();
    var workflow =
        workflowService.createWorkflow(
            companyId,
            request.name(),
            request.description(),
            request.workflowType(),
            steps,
            memberId);

    return ResponseEntity.created(URI.create("/api/approval-workflows/" + workflow.getId()))
        .body(WorkflowResponse.from(workflow, workflowService.getSteps(workflow.getId())));
  }

  @GetMapping("/api/approval-workflows/{id}")
  @PreAuthorize("hasAnyRole('COMPANY_MEMBER', 'COMPANY_ADMIN', 'COMPANY_OWNER')")
  public ResponseEntity<WorkflowResponse> getWorkflow(@PathVariable UUID id) {
    UUID companyId = RequestScopes.requireCompanyId();
    var workflow = workflowService.getWorkflow(id, companyId);
    return ResponseEntity.ok(WorkflowResponse.from(workflow, workflowService.getSteps(id)));
  }

  @GetMapping("/api/approval-steps/{stepId}/approvers")
  @PreAuthorize("hasAnyRole('COMPANY_MEMBER', 'COMPANY_ADMIN', 'COMPANY_OWNER')")
  public ResponseEntity<ApproversResponse> resolveApprovers(
      @PathVariable UUID stepId, @RequestParam UUID projectId) {
    UUID companyId = RequestScopes.requireCompanyId();
    var approvers = approverResolver.resolveApprovers(stepId, projectId, companyId);
    return ResponseEntity.ok(new ApproversResponse(stepId, projectId, approvers));
  }

  // --- DTOs ---

  public record CreateWorkflowRequest(
      @NotBlank(message = "name is required") @Size(max = 200) String name,
      String description,
      @NotNull(message = "workflowType is required") WorkflowType workflowType,
      @NotEmpty(message = "at least one step is required") List<@Valid StepRequest> steps) {}

  public record StepRequest(
      @Positive int stepOrder,
      @NotBlank(message = "step name is required") @Size(max = 200) String name,
      @NotBlank(message = "approverType is required") String approverType,
      List<UUID> approverIds,
      String approverRole,
      UUID approverCustomRoleId) {

    StepDefinition toDefinition() {
      return new StepDefinition(
          stepOrder, name, approverType, approverIds, approverRole, approverCustomRoleId);
    }
  }

  public record StepResponse(
      UUID id,
      int stepOrder,
      String name,
      String approverType,
      List<UUID> approverIds,
      String approverRole,
      UUID approverCustomRoleId) {

    public static StepResponse from(ApprovalStep step) {
      return new StepResponse(
          step.getId(),
          step.getStepOrder(),
          step.getName(),
          step.getApproverType(),
          step.getApproverIds(),
          step.getApproverRole(),
          step.getApproverCustomRoleId());
    }
  }

  public record WorkflowResponse(
      UUID id,
      UUID companyId,
      String name,
      String description,
      WorkflowType workflowType,
      boolean active,
      List<StepResponse> steps,
      Instant createdAt) {

    public static WorkflowResponse from(ApprovalWorkflow workflow, List<ApprovalStep> steps) {
      return new WorkflowResponse(
          workflow.getId(),
          workflow.getCompanyId(),
          workflow.getName(),
          workflow.getDescription(),
          workflow.getWorkflowType(),
          workflow.isActive(),
          steps.stream().map(StepResponse::from).toList(),
          workflow.getCreatedAt());
    }
  }

  public record ApproversResponse(UUID stepId, UUID projectId, List<UUID> approverIds) {}
}
