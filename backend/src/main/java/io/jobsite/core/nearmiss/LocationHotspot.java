package io.jobsite.core.nearmiss;

import java.math.BigDecimal;
import java.util.List;

/**
 * @param highSeverityCount near misses whose potential outcome was lost time or a fatality
 * @param rootCauses distinct recorded root-cause categories, sorted
 */
public record LocationHotspot(
    String location,
    int incidentCount,
    int highSeverityCount,
    BigDecimal riskScore,
    List<String> rootCauses) {}
