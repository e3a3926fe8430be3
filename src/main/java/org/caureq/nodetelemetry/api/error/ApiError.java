package org.caureq.nodetelemetry.api.error;

import java.time.Instant;
import java.util.Map;

/** JSON error body shared by the exception handler and the admin filter. */
public record ApiError(
        Instant timestamp,
        ErrorCode code,
        String message,
        String correlationId,
        Map<String,Object> details
) {
    public static ApiError of(ErrorCode code, String message, String correlationId) {
        return new ApiError(Instant.now(), code, message, correlationId, Map.of());
    }
}
