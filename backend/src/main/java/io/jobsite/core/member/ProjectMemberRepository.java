package io.jobsite.core.member;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectMemberRepository extends JpaRepository<ProjectMember, UUID> {

  List<ProjectMember> findByProjectId(UUID projectId);

  boolean existsByProjectIdAndMemberId(UUID projectId, UUID memberId);
}
