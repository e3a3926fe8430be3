package org.caureq.nodetelemetry.repo;

/** Averages are null when no row matched. */
public interface StorageAverage {
    Double getUsageGb();
    Double getUsagePercent();
    Long getSamples();
}
