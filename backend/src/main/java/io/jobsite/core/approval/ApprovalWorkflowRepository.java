package io.jobsite.core.approval;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ApprovalWorkflowRepository extends JpaRepository<ApprovalWorkflow, UUID> {

  boolean existsByIdAndCompanyId(UUID id, UUID companyId);
}
