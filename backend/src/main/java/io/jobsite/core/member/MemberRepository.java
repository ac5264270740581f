package io.jobsite.core.member;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MemberRepository extends JpaRepository<Member, UUID> {

  @Query(
      """
      SELECT m.id FROM Member m
      WHERE m.id IN :ids AND m.deletedAt IS NULL
      """)
  List<UUID> findActiveIdsIn(@Param("ids") Collection<UUID> ids);

  @Query(
      """
      SELECT CASE WHEN COUNT(m) > 0 THEN true ELSE false END FROM Member m
      WHERE m.id = :memberId AND m.deletedAt IS NULL
      """)
  boolean isActive(@Param("memberId") UUID memberId);

  @Query(
      """
      SELECT DISTINCT m.id FROM Member m
      WHERE m.defaultRole = :role AND m.deletedAt IS NULL
        AND EXISTS (
          SELECT 1 FROM ProjectMember pm
          WHERE pm.memberId = m.id AND pm.projectId = :projectId)
      """)
  List<UUID> findActiveProjectMemberIdsWithDefaultRole(
      @Param("projectId") UUID projectId, @Param("role") String role);

  @Query(
      """
      SELECT CASE WHEN COUNT(m) > 0 THEN true ELSE false END FROM Member m
      WHERE m.id = :memberId AND m.defaultRole = :role AND m.deletedAt IS NULL
        AND EXISTS (
          SELECT 1 FROM ProjectMember pm
          WHERE pm.memberId = m.id AND pm.projectId = :projectId)
      """)
  boolean isActiveProjectMemberWithDefaultRole(
      @Param("memberId") UUID memberId,
      @Param("projectId") UUID projectId,
      @Param("role") String role);

  @Query(
      """
      SELECT DISTINCT m.id FROM Member m
      WHERE m.deletedAt IS NULL
        AND EXISTS (
          SELECT 1 FROM ProjectMember pm
          WHERE pm.memberId = m.id AND pm.projectId = :projectId)
      """)
  List<UUID> findActiveProjectMemberIds(@Param("projectId") UUID projectId);

  @Query(
      """
      SELECT CASE WHEN COUNT(m) > 0 THEN true ELSE false END FROM Member m
      WHERE m.id = :memberId AND m.deletedAt IS NULL
        AND EXISTS (
          SELECT 1 FROM ProjectMember pm
          WHERE pm.memberId = m.id AND pm.projectId = :projectId)
      """)
  boolean isActiveProjectMember(
      @Param("memberId") UUID memberId, @Param("projectId") UUID projectId);

  @Query(
      """
      SELECT DISTINCT m.id FROM Member m
      WHERE m.deletedAt IS NULL
        AND EXISTS (
          SELECT 1 FROM MemberCustomRole mcr
          WHERE mcr.memberId = m.id
            AND mcr.customRoleId = :customRoleId
            AND (mcr.projectId IS NULL OR mcr.projectId = :projectId))
      """)
  List<UUID> findActiveHoldersOfCustomRole(
      @Param("customRoleId") UUID customRoleId, @Param("projectId") UUID projectId);

  @Query(
      """
      SELECT CASE WHEN COUNT(m) > 0 THEN true ELSE false END FROM Member m
      WHERE m.id = :memberId AND m.deletedAt IS NULL
        AND EXISTS (
          SELECT 1 FROM MemberCustomRole mcr
          WHERE mcr.memberId = m.id
            AND mcr.customRoleId = :customRoleId
            AND (mcr.projectId IS NULL OR mcr.projectId = :projectId))
      """)
  boolean holdsCustomRole(
      @Param("memberId") UUID memberId,
      @Param("customRoleId") UUID customRoleId,
      @Param("projectId") UUID projectId);
}
