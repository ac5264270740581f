package io.jobsite.core.safety;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SafetyIncidentRepository extends JpaRepository<SafetyIncident, UUID> {

  /** Live incidents dated within [start, end]; a null project means the whole company. */
  @Query(
      """
      SELECT i FROM SafetyIncident i
      WHERE i.companyId = :companyId
        AND (:projectId IS NULL OR i.projectId = :projectId)
        AND i.incidentDate >= :start AND i.incidentDate <= :end
        AND i.deletedAt IS NULL
      ORDER BY i.incidentDate ASC
      """)
  List<SafetyIncident> findLiveInPeriod(
      @Param("companyId") UUID companyId,
      @Param("projectId") UUID projectId,
      @Param("start") LocalDate start,
      @Param("end") LocalDate end);

  @Query(
      """
      SELECT i FROM SafetyIncident i
      WHERE i.companyId = :companyId
        AND (:projectId IS NULL OR i.projectId = :projectId)
        AND i.severity = io.jobsite.core.safety.IncidentSeverity.NEAR_MISS
        AND i.incidentDate >= :start AND i.incidentDate <= :end
        AND i.deletedAt IS NULL
      ORDER BY i.incidentDate ASC
      """)
  List<SafetyIncident> findNearMissesInPeriod(
      @Param("companyId") UUID companyId,
      @Param("projectId") UUID projectId,
      @Param("start") LocalDate start,
      @Param("end") LocalDate end);
}
