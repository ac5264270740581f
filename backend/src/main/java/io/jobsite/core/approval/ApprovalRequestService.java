package io.jobsite.core.approval;

import io.jobsite.core.audit.AuditEventBuilder;
import io.jobsite.core.audit.AuditService;
import io.jobsite.core.exception.ForbiddenException;
import io.jobsite.core.exception.InvalidStateException;
import io.jobsite.core.exception.ResourceConflictException;
import io.jobsite.core.exception.ResourceNotFoundException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Moves approval requests through their workflow. Every state change appends an {@link
 * ApprovalAction} and updates the request in the same transaction; the request's version column
 * makes two concurrent advances of the same step fail for all but one caller.
 *
 * <p>Requests belong to the company that owns their workflow. A request or workflow of another
 * company is reported as not found.
 */
@Service
public class ApprovalRequestService {

  private static final Logger log = LoggerFactory.getLogger(ApprovalRequestService.class);

  private final ApprovalRequestRepository requestRepository;
  private final ApprovalActionRepository actionRepository;
  private final ApprovalWorkflowRepository workflowRepository;
  private final ApprovalStepRepository stepRepository;
  private final ApproverResolver approverResolver;
  private final AuditService auditService;

  public ApprovalRequestService(
      ApprovalRequestRepository requestRepository,
      ApprovalActionRepository actionRepository,
      ApprovalWorkflowRepository workflowRepository,
      ApprovalStepRepository stepRepository,
      ApproverResolver approverResolver,
      AuditService auditService) {
    this.requestRepository = requestRepository;
    this.actionRepository = actionRepository;
    this.workflowRepository = workflowRepository;
    this.stepRepository = stepRepository;
    this.approverResolver = approverResolver;
    this.auditService = auditService;
  }

  @Transactional
  public ApprovalRequest startRequest(
      UUID companyId,
      UUID workflowId,
      UUID projectId,
      String entityType,
      UUID entityId,
      UUID initiatedBy) {
    var workflow =
        workflowRepository
            .findById(workflowId)
            .filter(w -> w.getCompanyId().equals(companyId))
            .orElseThrow(() -> new ResourceNotFoundException("ApprovalWorkflow", workflowId));
    if (!workflow.isActive()) {
      throw new InvalidStateException(
          "Workflow inactive", "Approval workflow " + workflowId + " is not active");
    }
    if (stepRepository.countByWorkflowId(workflowId) == 0) {
      throw new InvalidStateException(
          "Workflow has no steps", "Approval workflow " + workflowId + " has no steps");
    }

    var request =
        requestRepository.save(
            new ApprovalRequest(workflowId, projectId, entityType, entityId, initiatedBy));
    log.info(
        "Started approval request {} on {} {} using workflow {}",
        request.getId(),
        entityType,
        entityId,
        workflowId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("approval_request.created")
            .entityType("approval_request")
            .entityId(request.getId())
            .actorId(initiatedBy)
            .details(
                Map.of(
                    "workflow_id", workflowId.toString(),
                    "project_id", projectId.toString(),
                    "entity_type", entityType,
                    "entity_id", entityId.toString()))
            .build());

    return request;
  }

  @Transactional(readOnly = true)
  public ApprovalRequest getRequest(UUID requestId, UUID companyId) {
    return findRequest(requestId, companyId);
  }

  @Transactional(readOnly = true)
  public boolean canApprove(UUID requestId, UUID companyId, UUID memberId) {
    return approverResolver.canApprove(findRequest(requestId, companyId), memberId);
  }

  /**
   * Applies {@code decision} at the request's current step.
   *
   * <ul>
   *   <li>COMMENT is accepted from anyone in any status and never changes state.
   *   <li>APPROVE on the last step completes the request; on any other step it moves to the next.
   *   <li>REJECT ends the request from any step.
   * </ul>
   *
   * @throws ResourceNotFoundException if the request or its current step does not exist, or the
   *     request belongs to another company
   * @throws ForbiddenException if the request is not pending or the actor is not an approver
   * @throws ResourceConflictException if another advance of the same request won the race
   */
  @Transactional
  public AdvanceResult advance(
      UUID requestId, UUID companyId, UUID actorId, ApprovalDecision decision, String notes) {
    var request = findRequest(requestId, companyId);

    if (!decision.changesState()) {
      actionRepository.save(
          new ApprovalAction(
              requestId, request.getCurrentStep(), ApprovalActionType.COMMENT, actorId, notes));
      log.debug("Comment added to approval request {} by {}", requestId, actorId);
      return AdvanceResult.of(request);
    }

    if (!request.isPending()) {
      throw new ForbiddenException(
          "Request not pending",
          "Approval request "
              + requestId
              + " is "
              + request.getStatus()
              + " and cannot be acted on");
    }

    int stepOrder = request.getCurrentStep();
    var step =
        stepRepository
            .findByWorkflowIdAndStepOrder(request.getWorkflowId(), stepOrder)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Approval step not found",
                        "Workflow "
                            + request.getWorkflowId()
                            + " has no step "
                            + stepOrder
                            + " for request "
                            + requestId));

    if (!approverResolver.isApprover(
        ApproverSpec.fromStep(step), request.getProjectId(), actorId)) {
      throw new ForbiddenException(
          "Not an approver",
          "Member " + actorId + " cannot act on step " + stepOrder + " of request " + requestId);
    }

    actionRepository.save(
        new ApprovalAction(requestId, stepOrder, decision.actionType(), actorId, notes));

    String eventType;
    if (decision == ApprovalDecision.REJECT) {
      request.reject();
      eventType = "approval_request.rejected";
    } else {
      boolean lastStep = stepRepository.countByWorkflowId(request.getWorkflowId()) <= stepOrder;
      request.approveCurrentStep(lastStep);
      eventType = lastStep ? "approval_request.approved" : "approval_request.step_advanced";
    }

    var saved = saveVersioned(request);
    log.info(
        "Approval request {} {} at step {} by {}: status={}, currentStep={}",
        requestId,
        decision,
        stepOrder,
        actorId,
        saved.getStatus(),
        saved.getCurrentStep());

    var details = new HashMap<String, Object>();
    details.put("step_order", stepOrder);
    details.put("status", saved.getStatus().name());
    details.put("current_step", saved.getCurrentStep());
    if (notes != null) {
      details.put("notes", notes);
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType("approval_request")
            .entityId(requestId)
            .actorId(actorId)
            .details(details)
            .build());

    return AdvanceResult.of(saved);
  }

  /** Withdraws a pending request. Only the member who started it may do so. */
  @Transactional
  public AdvanceResult cancel(UUID requestId, UUID companyId, UUID actorId, String reason) {
    var request = findRequest(requestId, companyId);
    if (!request.isPending()) {
      throw new ForbiddenException(
          "Request not pending",
          "Approval request "
              + requestId
              + " is "
              + request.getStatus()
              + " and cannot be cancelled");
    }
    if (!request.getInitiatedBy().equals(actorId)) {
      throw new ForbiddenException(
          "Cannot cancel request", "Only the initiator can cancel approval request " + requestId);
    }

    actionRepository.save(
        new ApprovalAction(
            requestId, request.getCurrentStep(), ApprovalActionType.CANCEL, actorId, reason));
    request.cancel();
    var saved = saveVersioned(request);
    log.info("Approval request {} cancelled by {}", requestId, actorId);

    var details = new HashMap<String, Object>();
    details.put("step_order", saved.getCurrentStep());
    if (reason != null) {
      details.put("reason", reason);
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("approval_request.cancelled")
            .entityType("approval_request")
            .entityId(requestId)
            .actorId(actorId)
            .details(details)
            .build());

    return AdvanceResult.of(saved);
  }

  @Transactional(readOnly = true)
  public List<ApprovalAction> listActions(UUID requestId, UUID companyId) {
    findRequest(requestId, companyId);
    return actionRepository.findByRequestIdOrderByCreatedAtAsc(requestId);
  }

  private ApprovalRequest findRequest(UUID requestId, UUID companyId) {
    return requestRepository
        .findById(requestId)
        .filter(r -> workflowRepository.existsByIdAndCompanyId(r.getWorkflowId(), companyId))
        .orElseThrow(() -> new ResourceNotFoundException("ApprovalRequest", requestId));
  }

  private ApprovalRequest saveVersioned(ApprovalRequest request) {
    try {
      return requestRepository.saveAndFlush(request);
    } catch (ObjectOptimisticLockingFailureException e) {
      log.warn("Concurrent update of approval request {}: {}", request.getId(), e.getMessage());
      throw new ResourceConflictException(
          "Concurrent approval",
          "Approval request " + request.getId() + " was modified concurrently. Please retry.");
    }
  }
}
