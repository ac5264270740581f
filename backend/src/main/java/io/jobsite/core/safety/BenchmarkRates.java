package io.jobsite.core.safety;

import java.math.BigDecimal;

public record BenchmarkRates(
    String naicsCode, int year, BigDecimal avgTrir, BigDecimal avgDart, BigDecimal avgLtir) {

  static BenchmarkRates from(IndustrySafetyBenchmark benchmark) {
    return new BenchmarkRates(
        benchmark.getNaicsCode(),
        benchmark.getYear(),
        benchmark.getAvgTrir(),
        benchmark.getAvgDart(),
        benchmark.getAvgLtir());
  }
}
