package io.jobsite.core.approval;

import io.jobsite.core.exception.ResourceNotFoundException;
import io.jobsite.core.member.MembershipProvider;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns a step's approver configuration into concrete members. {@link #resolve} enumerates and
 * {@link #isApprover} tests a single member with the same four-way dispatch, so the two always
 * agree.
 */
@Service
public class ApproverResolver {

  private static final Logger log = LoggerFactory.getLogger(ApproverResolver.class);

  private final ApprovalStepRepository stepRepository;
  private final ApprovalWorkflowRepository workflowRepository;
  private final MembershipProvider membershipProvider;

  public ApproverResolver(
      ApprovalStepRepository stepRepository,
      ApprovalWorkflowRepository workflowRepository,
      MembershipProvider membershipProvider) {
    this.stepRepository = stepRepository;
    this.workflowRepository = workflowRepository;
    this.membershipProvider = membershipProvider;
  }

  /**
   * Sorted, de-duplicated member ids that may act on {@code stepId} within {@code projectId}.
   * Steps of another company's workflow are reported as not found.
   */
  @Transactional(readOnly = true)
  public List<UUID> resolveApprovers(UUID stepId, UUID projectId, UUID companyId) {
    var step =
        stepRepository
            .findById(stepId)
            .filter(s -> workflowRepository.existsByIdAndCompanyId(s.getWorkflowId(), companyId))
            .orElseThrow(() -> new ResourceNotFoundException("ApprovalStep", stepId));
    return resolve(ApproverSpec.fromStep(step), projectId);
  }

  /**
   * Whether {@code memberId} may approve or reject the request right now. False when the request
   * is no longer pending or its current step does not exist.
   */
  boolean canApprove(ApprovalRequest request, UUID memberId) {
    if (!request.isPending()) {
      return false;
    }
    var step =
        stepRepository.findByWorkflowIdAndStepOrder(
            request.getWorkflowId(), request.getCurrentStep());
    if (step.isEmpty()) {
      log.debug(
          "Request {} points at missing step {} of workflow {}",
          request.getId(),
          request.getCurrentStep(),
          request.getWorkflowId());
      return false;
    }
    return isApprover(ApproverSpec.fromStep(step.get()), request.getProjectId(), memberId);
  }

  List<UUID> resolve(ApproverSpec spec, UUID projectId) {
    Collection<UUID> ids;
    if (spec instanceof ApproverSpec.UserList users) {
      ids = membershipProvider.activeMembersAmong(users.memberIds());
    } else if (spec instanceof ApproverSpec.DefaultRole role) {
      ids = membershipProvider.projectMembersWithDefaultRole(projectId, role.roleCode());
    } else if (spec instanceof ApproverSpec.CustomRole customRole) {
      ids = membershipProvider.customRoleHolders(customRole.customRoleId(), projectId);
    } else {
      ids = membershipProvider.projectMembers(projectId);
    }
    return ids.stream().distinct().sorted().toList();
  }

  boolean isApprover(ApproverSpec spec, UUID projectId, UUID memberId) {
    if (memberId == null) {
      return false;
    }
    if (spec instanceof ApproverSpec.UserList users) {
      return users.memberIds().contains(memberId) && membershipProvider.isActiveMember(memberId);
    } else if (spec instanceof ApproverSpec.DefaultRole role) {
      return membershipProvider.isProjectMemberWithDefaultRole(
          memberId, projectId, role.roleCode());
    } else if (spec instanceof ApproverSpec.CustomRole customRole) {
      return membershipProvider.holdsCustomRole(memberId, customRole.customRoleId(), projectId);
    } else {
      return membershipProvider.isProjectMember(memberId, projectId);
    }
  }
}
