package io.jobsite.core.safety;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Looks up industry averages. Benchmarks change once a year, so lookups are cached. */
@Service
public class IndustryBenchmarkService {

  private static final Logger log = LoggerFactory.getLogger(IndustryBenchmarkService.class);

  private final IndustrySafetyBenchmarkRepository benchmarkRepository;
  private final Cache<String, Optional<BenchmarkRates>> benchmarkCache =
      Caffeine.newBuilder().maximumSize(1_000).expireAfterWrite(Duration.ofHours(12)).build();

  public IndustryBenchmarkService(IndustrySafetyBenchmarkRepository benchmarkRepository) {
    this.benchmarkRepository = benchmarkRepository;
  }

  /** Benchmark for the NAICS code in {@code year}, falling back to the latest earlier year. */
  public Optional<BenchmarkRates> find(String naicsCode, int year) {
    if (naicsCode == null || naicsCode.isBlank()) {
      return Optional.empty();
    }
    return benchmarkCache.get(naicsCode + ":" + year, key -> load(naicsCode, year));
  }

  private Optional<BenchmarkRates> load(String naicsCode, int year) {
    var rates =
        benchmarkRepository
            .findFirstByNaicsCodeAndYearLessThanEqualOrderByYearDesc(naicsCode, year)
            .map(BenchmarkRates::from);
    if (rates.isEmpty()) {
      log.debug("No industry benchmark for NAICS {} up to {}", naicsCode, year);
    }
    return rates;
  }
}
