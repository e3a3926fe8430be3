package org.caureq.nodetelemetry.domain;

import java.util.Locale;

/** Cadence chain: each level is rolled up from the one before it. */
public enum AggregatePeriod {
    DAY, WEEK, MONTH;

    public static AggregatePeriod parse(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("period is required");
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown period: " + s + " (expected day, week or month)");
        }
    }
}
