package org.caureq.nodetelemetry.service.tools;

/** External tool could not be run, timed out or exited nonzero. */
public class ToolInvocationException extends RuntimeException {
    public static final int NOT_STARTED = -1;
    public static final int TIMED_OUT = 124;

    private final String tool;
    private final int exitCode;

    public ToolInvocationException(String tool, int exitCode, String message) {
        super(message);
        this.tool = tool;
        this.exitCode = exitCode;
    }

    public ToolInvocationException(String tool, int exitCode, String message, Throwable cause) {
        super(message, cause);
        this.tool = tool;
        this.exitCode = exitCode;
    }

    public String tool() { return tool; }
    public int exitCode() { return exitCode; }
}
