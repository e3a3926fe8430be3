package org.caureq.nodetelemetry.service.tools;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs tools as child processes. Both streams are drained in the background so a chatty
 * tool cannot block on a full pipe, and the whole call is bounded by the configured timeout.
 *
 * <p>The drains run on this invoker's own daemon threads ({@code tool-io-*}): a grandchild that
 * keeps the pipe open after the tool is killed pins one of those, never a shared pool thread.
 */
@Slf4j
public class ProcessToolInvoker implements ToolInvoker, AutoCloseable {
    private static final int STDERR_EXCERPT = 200;

    private final Duration timeout;
    private final ExecutorService streams;

    public ProcessToolInvoker(Duration timeout) {
        this.timeout = (timeout == null || timeout.isZero() || timeout.isNegative())
                ? Duration.ofSeconds(30) : timeout;
        var threads = new CustomizableThreadFactory("tool-io-");
        threads.setDaemon(true);
        this.streams = Executors.newCachedThreadPool(threads);
    }

    @Override
    public List<String> invoke(String tool, List<String> args) {
        List<String> cmd = new ArrayList<>();
        cmd.add(tool);
        if (args != null) cmd.addAll(args);

        Process p;
        try {
            p = new ProcessBuilder(cmd).start();
        } catch (IOException e) {
            throw new ToolInvocationException(tool, ToolInvocationException.NOT_STARTED,
                    "cannot start " + tool + ": " + e.getMessage(), e);
        }
        closeStdin(p);

        Future<String> out = streams.submit(() -> drain(p.getInputStream()));
        Future<String> err = streams.submit(() -> drain(p.getErrorStream()));
        try {
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                throw new ToolInvocationException(tool, ToolInvocationException.TIMED_OUT,
                        "%s timed out after %ss".formatted(tool, timeout.toSeconds()));
            }
            String stdout = out.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            int code = p.exitValue();
            if (code != 0) {
                String stderr = err.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                throw new ToolInvocationException(tool, code,
                        "%s exited with %d%s".formatted(tool, code, excerpt(stderr)));
            }
            log.debug("[Tools] {} {} -> {} bytes", tool, args, stdout.length());
            return stdout.isBlank() ? List.of() : List.of(stdout.strip().split("\\R"));
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ToolInvocationException(tool, ToolInvocationException.NOT_STARTED,
                    tool + " interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            p.destroyForcibly();
            out.cancel(true);
            err.cancel(true);
            throw new ToolInvocationException(tool, ToolInvocationException.NOT_STARTED,
                    "cannot read output of " + tool + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        streams.shutdownNow();
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("[Tools] stream read failed: {}", e.getMessage());
            return "";
        }
    }

    private static void closeStdin(Process p) {
        try {
            p.getOutputStream().close();
        } catch (IOException e) {
            log.trace("[Tools] stdin close failed: {}", e.getMessage());
        }
    }

    private static String excerpt(String stderr) {
        if (stderr == null || stderr.isBlank()) return "";
        String s = stderr.strip();
        if (s.length() > STDERR_EXCERPT) s = s.substring(0, STDERR_EXCERPT);
        return ": " + s;
    }
}
