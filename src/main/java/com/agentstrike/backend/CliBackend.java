package com.agentstrike.backend;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Executes prompts through a local AI command-line tool.
 * Each call spawns a fresh process, so calls share no state.
 *
 * SECURITY: the prompt is always piped via stdin, never passed as a command-line
 * argument. Prompts embed captured HTTP traffic, which may contain shell
 * metacharacters that cmd.exe /c would interpret.
 */
public class CliBackend implements AiBackend {

    private static final Pattern ANSI_STRIP = Pattern.compile("\u001B\\[[;\\d]*[A-Za-z]");
    private static final boolean IS_WINDOWS = System.getProperty("os.name", "").toLowerCase().contains("win");

    private final BackendConfig config;
    private volatile Consumer<String> errorLogger;

    public CliBackend(BackendConfig config) {
        if (config.kind() != BackendKind.CLI) {
            throw new IllegalArgumentException("Not a CLI backend config: " + config);
        }
        this.config = config;
    }

    public void setErrorLogger(Consumer<String> errorLogger) { this.errorLogger = errorLogger; }

    @Override
    public String id() { return config.id(); }

    @Override
    public BackendKind kind() { return BackendKind.CLI; }

    @Override
    public String describe() {
        return "CLI backend '" + config.id() + "': " + String.join(" ", config.command())
                + " (prompt via stdin)";
    }

    @Override
    public boolean isAvailable() {
        if (config.command().isEmpty()) return false;
        String binary = config.command().get(0);
        if (binary.contains("/") || binary.contains("\\")) {
            return Files.isExecutable(Path.of(binary));
        }
        String path = System.getenv("PATH");
        if (path == null) return false;
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isEmpty()) continue;
            Path candidate = Path.of(dir, binary);
            if (Files.isExecutable(candidate)) return true;
            if (IS_WINDOWS) {
                for (String ext : new String[]{".exe", ".cmd", ".bat"}) {
                    if (Files.isExecutable(Path.of(dir, binary + ext))) return true;
                }
            }
        }
        return false;
    }

    @Override
    public DispatchResult invoke(DispatchRequest request) {
        return Invocations.timed(request, () -> call(request.prompt(), request.timeout().toMillis()));
    }

    /**
     * Runs the configured command with the prompt on stdin.
     * On timeout the process is killed and whatever it printed so far is carried
     * on the thrown exception.
     */
    String call(String prompt, long timeoutMillis) throws BackendException {
        if (config.command().isEmpty()) {
            throw new BackendException(BackendException.ErrorType.UNAVAILABLE,
                    "No command configured for " + config.id());
        }
        List<String> command = new ArrayList<>(config.command());
        String binary = command.get(0);

        // npm globals on Windows are .cmd wrappers that only cmd.exe resolves.
        // Arguments never hold traffic data, the prompt goes through stdin.
        if (IS_WINDOWS && !binary.contains("\\") && !binary.contains("/") && !binary.endsWith(".exe")) {
            command.add(0, "cmd.exe");
            command.add(1, "/c");
        }

        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            pb.environment().put("NO_COLOR", "1");
            pb.environment().put("TERM", "dumb");
            process = pb.start();
        } catch (IOException e) {
            throw new BackendException(BackendException.ErrorType.UNAVAILABLE,
                    "Failed to start " + binary + ": " + e.getMessage()
                            + " (is it installed and on your PATH?)", e);
        }

        ByteArrayOutputStream output = new ByteArrayOutputStream();
        AtomicReference<IOException> writeFailure = new AtomicReference<>();

        // Stdin is written on its own thread so a tool that never reads it cannot block the timeout.
        Thread writer = new Thread(() -> {
            try (OutputStream os = process.getOutputStream()) {
                os.write(prompt.getBytes(StandardCharsets.UTF_8));
                os.flush();
            } catch (IOException e) {
                writeFailure.set(e);
            }
        }, "AgentStrike-CLI-Writer");
        writer.setDaemon(true);
        writer.start();

        Thread reader = new Thread(() -> {
            byte[] buf = new byte[4096];
            try (InputStream is = process.getInputStream()) {
                int n;
                while ((n = is.read(buf)) != -1) {
                    synchronized (output) {
                        output.write(buf, 0, n);
                    }
                }
            } catch (IOException e) {
                // Stream closes abruptly when the process is killed on timeout
                logError("[CliBackend] " + config.id() + " output stream closed: " + e.getMessage());
            }
        }, "AgentStrike-CLI-Reader");
        reader.setDaemon(true);
        reader.start();

        try {
            boolean finished = process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                reader.join(500);
                throw new BackendException(BackendException.ErrorType.TIMEOUT,
                        config.id() + " timed out after " + timeoutMillis + "ms",
                        clean(snapshot(output)));
            }

            reader.join(5000);
            int exitCode = process.exitValue();
            String result = clean(snapshot(output));

            if (exitCode != 0) {
                String message = config.id() + " exited with code " + exitCode + ": "
                        + Invocations.truncate(result, 300);
                if (writeFailure.get() != null) {
                    message += " (stdin: " + writeFailure.get().getMessage() + ")";
                }
                throw new BackendException(BackendException.ErrorType.PROTOCOL_ERROR, message, result);
            }
            if (result.isEmpty()) {
                throw new BackendException(BackendException.ErrorType.PROTOCOL_ERROR,
                        config.id() + " returned empty output");
            }
            return result;

        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new BackendException(BackendException.ErrorType.TIMEOUT,
                    config.id() + " was interrupted", clean(snapshot(output)), e);
        }
    }

    private static String snapshot(ByteArrayOutputStream output) {
        synchronized (output) {
            return output.toString(StandardCharsets.UTF_8);
        }
    }

    static String clean(String text) {
        if (text == null) return "";
        return ANSI_STRIP.matcher(text).replaceAll("").trim();
    }

    private void logError(String msg) {
        Consumer<String> l = errorLogger;
        if (l != null) l.accept(msg);
    }
}
