package io.jobsite.core.safety;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.util.UUID;

/** Published industry average rates per NAICS code and year. Seeded by migration. */
@Entity
@Table(name = "industry_safety_benchmarks")
public class IndustrySafetyBenchmark {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "naics_code", nullable = false, length = 10)
  private String naicsCode;

  @Column(name = "industry_name", nullable = false)
  private String industryName;

  @Column(name = "year", nullable = false)
  private int year;

  @Column(name = "avg_trir", precision = 8, scale = 2)
  private BigDecimal avgTrir;

  @Column(name = "avg_dart", precision = 8, scale = 2)
  private BigDecimal avgDart;

  @Column(name = "avg_ltir", precision = 8, scale = 2)
  private BigDecimal avgLtir;

  @Column(name = "source", length = 100)
  private String source;

  protected IndustrySafetyBenchmark() {}

  public IndustrySafetyBenchmark(
      String naicsCode,
      String industryName,
      int year,
      BigDecimal avgTrir,
      BigDecimal avgDart,
      BigDecimal avgLtir) {
    this.naicsCode = naicsCode;
    this.industryName = industryName;
    this.year = year;
    this.avgTrir = avgTrir;
    this.avgDart = avgDart;
    this.avgLtir = avgLtir;
    this.source = "BLS";
  }

  public UUID getId() {
    return id;
  }

  public String getNaicsCode() {
    return naicsCode;
  }

  public String getIndustryName() {
    return industryName;
  }

  public int getYear() {
    return year;
  }

  public BigDecimal getAvgTrir() {
    return avgTrir;
  }

  public BigDecimal getAvgDart() {
    return avgDart;
  }

  public BigDecimal getAvgLtir() {
    return avgLtir;
  }

  public String getSource() {
    return source;
  }
}
