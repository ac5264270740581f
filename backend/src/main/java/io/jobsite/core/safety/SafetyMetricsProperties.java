package io.jobsite.core.safety;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Safety analytics settings.
 *
 * @param recalculationEnabled whether the scheduled snapshot refresh runs
 * @param recalculationCron cron expression for the scheduled refresh
 * @param defaultNaicsCode NAICS code used for industry averages when a snapshot names none
 * @param spikeLookbackDays default window for near-miss spike detection
 * @param spikeThreshold default number of standard deviations above the mean that flags a spike
 * @param hotspotMinIncidents default minimum near misses for a location to count as a hotspot
 * @param hotspotDays default window for hotspot detection
 * @param trendPeriodDays default period length for the near-miss trend
 */
@ConfigurationProperties(prefix = "safety.metrics")
public record SafetyMetricsProperties(
    boolean recalculationEnabled,
    String recalculationCron,
    String defaultNaicsCode,
    int spikeLookbackDays,
    double spikeThreshold,
    int hotspotMinIncidents,
    int hotspotDays,
    int trendPeriodDays) {}
