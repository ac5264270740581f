package io.jobsite.core.approval;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ApprovalStepRepository extends JpaRepository<ApprovalStep, UUID> {

  List<ApprovalStep> findByWorkflowIdOrderByStepOrderAsc(UUID workflowId);

  Optional<ApprovalStep> findByWorkflowIdAndStepOrder(UUID workflowId, int stepOrder);

  long countByWorkflowId(UUID workflowId);
}
