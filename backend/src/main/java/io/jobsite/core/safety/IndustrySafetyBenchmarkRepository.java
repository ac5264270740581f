package io.jobsite.core.safety;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface IndustrySafetyBenchmarkRepository
    extends JpaRepository<IndustrySafetyBenchmark, UUID> {

  /** The benchmark for {@code year}, or the latest published before it. */
  Optional<IndustrySafetyBenchmark> findFirstByNaicsCodeAndYearLessThanEqualOrderByYearDesc(
      String naicsCode, int year);
}
