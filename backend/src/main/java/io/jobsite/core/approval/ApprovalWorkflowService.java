package io.jobsite.core.approval;

import io.jobsite.core.audit.AuditEventBuilder;
import io.jobsite.core.audit.AuditService;
import io.jobsite.core.exception.InvalidStateException;
import io.jobsite.core.exception.ResourceNotFoundException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ApprovalWorkflowService {

  private static final Logger log = LoggerFactory.getLogger(ApprovalWorkflowService.class);

  private final ApprovalWorkflowRepository workflowRepository;
  private final ApprovalStepRepository stepRepository;
  private final AuditService auditService;

  public ApprovalWorkflowService(
      ApprovalWorkflowRepository workflowRepository,
      ApprovalStepRepository stepRepository,
      AuditService auditService) {
    this.workflowRepository = workflowRepository;
    this.stepRepository = stepRepository;
    this.auditService = auditService;
  }

  /**
   * Creates an active workflow with its steps. Step orders must be exactly 1..n and every step
   * must carry a valid approver configuration.
   */
  @Transactional
  public ApprovalWorkflow createWorkflow(
      UUID companyId,
      String name,
      String description,
      WorkflowType workflowType,
      List<StepDefinition> steps,
      UUID createdBy) {
    if (steps == null || steps.isEmpty()) {
      throw new InvalidStateException(
          "Invalid workflow", "A workflow needs at least one approval step");
    }
    var ordered =
        steps.stream().sorted(Comparator.comparingInt(StepDefinition::stepOrder)).toList();
    for (int i = 0; i < ordered.size(); i++) {
      if (ordered.get(i).stepOrder() != i + 1) {
        throw new InvalidStateException(
            "Invalid workflow",
            "Step orders must run contiguously from 1 to " + ordered.size());
      }
    }
    var specs = ordered.stream().map(StepDefinition::toSpec).toList();

    var workflow =
        workflowRepository.save(
            new ApprovalWorkflow(companyId, name, description, workflowType, createdBy));
    for (int i = 0; i < ordered.size(); i++) {
      var definition = ordered.get(i);
      stepRepository.save(
          new ApprovalStep(
              workflow.getId(), definition.stepOrder(), definition.name(), specs.get(i)));
    }

    log.info(
        "Created approval workflow {} ({}) with {} steps for company {}",
        workflow.getId(),
        workflowType,
        ordered.size(),
        companyId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("approval_workflow.created")
            .entityType("approval_workflow")
            .entityId(workflow.getId())
            .details(
                Map.of(
                    "name", name,
                    "workflow_type", workflowType.name(),
                    "step_count", ordered.size()))
            .build());

    return workflow;
  }

  /** Workflows of other companies are reported as not found. */
  @Transactional(readOnly = true)
  public ApprovalWorkflow getWorkflow(UUID workflowId, UUID companyId) {
    return workflowRepository
        .findById(workflowId)
        .filter(w -> w.getCompanyId().equals(companyId))
        .orElseThrow(() -> new ResourceNotFoundException("ApprovalWorkflow", workflowId));
  }

  @Transactional(readOnly = true)
  public List<ApprovalStep> getSteps(UUID workflowId) {
    return stepRepository.findByWorkflowIdOrderByStepOrderAsc(workflowId);
  }
}
