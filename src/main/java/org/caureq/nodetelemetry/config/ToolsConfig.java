package org.caureq.nodetelemetry.config;

import lombok.extern.slf4j.Slf4j;
import org.caureq.nodetelemetry.service.tools.GpuCapability;
import org.caureq.nodetelemetry.service.tools.ProcessToolInvoker;
import org.caureq.nodetelemetry.service.tools.ToolInvocationException;
import org.caureq.nodetelemetry.service.tools.ToolInvoker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Slf4j
@Configuration
public class ToolsConfig {

    @Bean
    public ToolInvoker toolInvoker(TelemetryProps props) {
        return new ProcessToolInvoker(props.tools().timeout());
    }

    @Bean
    public Clock clock(TelemetryProps props) {
        return Clock.system(props.zoneId());
    }

    /** Probed once; the GPU collector gets this value, never a mutable flag. */
    @Bean
    public GpuCapability gpuCapability(TelemetryProps props, ToolInvoker tools) {
        return probeGpu(props.gpu(), tools);
    }

    /** Lists devices with {@code <tool> -L}; any failure means unavailable. */
    static GpuCapability probeGpu(TelemetryProps.GpuProps gpu, ToolInvoker tools) {
        if (gpu == null || !gpu.enabled()) {
            log.info("[GPU] collection disabled by configuration");
            return GpuCapability.unavailable("disabled by configuration");
        }
        try {
            List<String> lines = tools.invoke(gpu.tool(), List.of("-L"));
            int n = (int) lines.stream().filter(l -> !l.isBlank()).count();
            log.info("[GPU] {} available, {} device(s)", gpu.tool(), n);
            return GpuCapability.available(n);
        } catch (ToolInvocationException e) {
            log.warn("[GPU] {} not available on this node, GPU collection disabled: {}", gpu.tool(), e.getMessage());
            return GpuCapability.unavailable(e.getMessage());
        }
    }
}
