package io.jobsite.core.safety;

/** OSHA incidence rates, each normalised to 200,000 hours worked. */
public enum RateKind {
  /** Total recordable incident rate. */
  TRIR,
  /** Days away, restricted or transferred. */
  DART,
  /** Lost-time injury rate. */
  LTIR,
  /** Days away plus restricted days. */
  SEVERITY
}
