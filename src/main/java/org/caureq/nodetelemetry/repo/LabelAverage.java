package org.caureq.nodetelemetry.repo;

/** Projection for grouped averages: one row per resource label. */
public interface LabelAverage {
    String getLabel();
    Double getAverage();
}
