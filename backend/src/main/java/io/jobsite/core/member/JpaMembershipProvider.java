package io.jobsite.core.member;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional(readOnly = true)
public class JpaMembershipProvider implements MembershipProvider {

  private final MemberRepository memberRepository;

  public JpaMembershipProvider(MemberRepository memberRepository) {
    this.memberRepository = memberRepository;
  }

  @Override
  public List<UUID> activeMembersAmong(Collection<UUID> memberIds) {
    if (memberIds.isEmpty()) {
      return List.of();
    }
    return memberRepository.findActiveIdsIn(memberIds);
  }

  @Override
  public boolean isActiveMember(UUID memberId) {
    return memberRepository.isActive(memberId);
  }

  @Override
  public List<UUID> projectMembersWithDefaultRole(UUID projectId, String role) {
    return memberRepository.findActiveProjectMemberIdsWithDefaultRole(projectId, role);
  }

  @Override
  public boolean isProjectMemberWithDefaultRole(UUID memberId, UUID projectId, String role) {
    return memberRepository.isActiveProjectMemberWithDefaultRole(memberId, projectId, role);
  }

  @Override
  public List<UUID> customRoleHolders(UUID customRoleId, UUID projectId) {
    return memberRepository.findActiveHoldersOfCustomRole(customRoleId, projectId);
  }

  @Override
  public boolean holdsCustomRole(UUID memberId, UUID customRoleId, UUID projectId) {
    return memberRepository.holdsCustomRole(memberId, customRoleId, projectId);
  }

  @Override
  public List<UUID> projectMembers(UUID projectId) {
    return memberRepository.findActiveProjectMemberIds(projectId);
  }

  @Override
  public boolean isProjectMember(UUID memberId, UUID projectId) {
    return memberRepository.isActiveProjectMember(memberId, projectId);
  }
}
