package io.jobsite.core.member;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MemberCustomRoleRepository extends JpaRepository<MemberCustomRole, UUID> {

  List<MemberCustomRole> findByMemberId(UUID memberId);
}
