package io.jobsite.core.safety;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SafetyMetricsSnapshotRepository
    extends JpaRepository<SafetyMetricsSnapshot, UUID> {

  /** Null {@code projectId}, {@code month} or {@code quarter} arguments match IS NULL. */
  Optional<SafetyMetricsSnapshot> findByCompanyIdAndProjectIdAndPeriodTypeAndYearAndMonthAndQuarter(
      UUID companyId,
      UUID projectId,
      PeriodType periodType,
      int year,
      Integer month,
      Integer quarter);

  @Query(
      """
      SELECT s FROM SafetyMetricsSnapshot s
      WHERE s.companyId = :companyId
        AND s.projectId IS NULL
        AND s.periodType = :periodType
      ORDER BY s.snapshotDate DESC
      """)
  List<SafetyMetricsSnapshot> findCompanyTrend(
      @Param("companyId") UUID companyId,
      @Param("periodType") PeriodType periodType,
      Pageable pageable);

  @Query(
      """
      SELECT s FROM SafetyMetricsSnapshot s
      WHERE s.companyId = :companyId
        AND s.projectId = :projectId
        AND s.periodType = :periodType
      ORDER BY s.snapshotDate DESC
      """)
  List<SafetyMetricsSnapshot> findProjectTrend(
      @Param("companyId") UUID companyId,
      @Param("projectId") UUID projectId,
      @Param("periodType") PeriodType periodType,
      Pageable pageable);
}
