package io.jobsite.core.safety;

/** Incident outcome, ordered from least to most severe. */
public enum IncidentSeverity {
  NEAR_MISS,
  FIRST_AID,
  MEDICAL_TREATMENT,
  LOST_TIME,
  FATALITY;

  /** Medical treatment or worse. */
  public boolean isSerious() {
    return compareTo(MEDICAL_TREATMENT) >= 0;
  }
}
