package org.caureq.nodetelemetry.service.tools;

/**
 * Whether this node can be sampled for GPU utilization. Decided once at startup and never
 * re-evaluated: a node without the query tool keeps its GPU task unscheduled until restart.
 */
public record GpuCapability(boolean available, int devices, String detail) {

    public static GpuCapability available(int devices) {
        return new GpuCapability(true, devices, devices + " device(s)");
    }

    public static GpuCapability unavailable(String reason) {
        return new GpuCapability(false, 0, reason);
    }
}
