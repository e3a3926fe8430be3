package org.caureq.nodetelemetry.service.tools;

import java.util.List;

/**
 * Narrow seam over external command-line tools (nvidia-smi, sreport, df).
 * Returns stdout split into lines; parsing stays with the caller.
 */
@FunctionalInterface
public interface ToolInvoker {
    List<String> invoke(String tool, List<String> args);
}
