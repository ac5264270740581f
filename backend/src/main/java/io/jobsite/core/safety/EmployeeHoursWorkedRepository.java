package io.jobsite.core.safety;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EmployeeHoursWorkedRepository extends JpaRepository<EmployeeHoursWorked, UUID> {

  /** Rows whose reporting period overlaps [start, end]. */
  @Query(
      """
      SELECT h FROM EmployeeHoursWorked h
      WHERE h.companyId = :companyId
        AND (:projectId IS NULL OR h.projectId = :projectId)
        AND h.periodStart <= :end AND h.periodEnd >= :start
      ORDER BY h.periodStart ASC
      """)
  List<EmployeeHoursWorked> findOverlapping(
      @Param("companyId") UUID companyId,
      @Param("projectId") UUID projectId,
      @Param("start") LocalDate start,
      @Param("end") LocalDate end);

  @Query(
      """
      SELECT DISTINCT new io.jobsite.core.safety.HoursScope(h.companyId, h.projectId)
      FROM EmployeeHoursWorked h
      WHERE h.periodStart <= :end AND h.periodEnd >= :start
      """)
  List<HoursScope> findScopesWithHoursBetween(
      @Param("start") LocalDate start, @Param("end") LocalDate end);
}
