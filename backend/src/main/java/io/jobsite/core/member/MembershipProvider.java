package io.jobsite.core.member;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Read-only view of company membership used by approver resolution. Every method ignores
 * soft-deleted members. The enumeration and existence methods come in pairs and must agree: a
 * member is in an enumeration result exactly when the matching existence check returns true.
 */
public interface MembershipProvider {

  /** The subset of {@code memberIds} that are not soft-deleted. */
  List<UUID> activeMembersAmong(Collection<UUID> memberIds);

  boolean isActiveMember(UUID memberId);

  /** Active members of the project whose default role equals {@code role} exactly. */
  List<UUID> projectMembersWithDefaultRole(UUID projectId, String role);

  boolean isProjectMemberWithDefaultRole(UUID memberId, UUID projectId, String role);

  /** Active holders of the custom role, globally or scoped to {@code projectId}. */
  List<UUID> customRoleHolders(UUID customRoleId, UUID projectId);

  boolean holdsCustomRole(UUID memberId, UUID customRoleId, UUID projectId);

  List<UUID> projectMembers(UUID projectId);

  boolean isProjectMember(UUID memberId, UUID projectId);
}
