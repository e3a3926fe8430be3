package org.caureq.nodetelemetry.service.tools;

/** Tool ran fine but its output did not have the expected shape. */
public class ToolOutputParseException extends RuntimeException {
    public ToolOutputParseException(String message) {
        super(message);
    }

    public ToolOutputParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
