package com.agentstrike.backend;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliBackendTest {

    private static CliBackend shell(String script) {
        return new CliBackend(BackendConfig.cli("sh-test", List.of("sh", "-c", script)));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void prompt_goes_through_stdin_and_output_comes_back() {
        CliBackend backend = new CliBackend(BackendConfig.cli("cat", List.of("cat")));
        DispatchResult result = backend.invoke(DispatchRequest.of("cat", "hello from stdin", Duration.ofSeconds(10)));

        assertTrue(result.isSuccess(), result.getErrorMessage());
        assertEquals("hello from stdin", result.getRawText());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void timeout_kills_the_process_and_keeps_partial_output() {
        CliBackend backend = shell("echo partial-output; exec sleep 30");
        long start = System.nanoTime();
        DispatchResult result = backend.invoke(DispatchRequest.of("sh-test", "ignored", Duration.ofSeconds(1)));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertFalse(result.isSuccess());
        assertEquals(BackendException.ErrorType.TIMEOUT, result.getErrorKind());
        assertEquals("partial-output", result.getRawText());
        assertTrue(elapsedMs < 10_000, "took " + elapsedMs + "ms");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void non_zero_exit_is_a_protocol_error() {
        DispatchResult result = shell("echo boom; exit 3")
                .invoke(DispatchRequest.of("sh-test", "x", Duration.ofSeconds(10)));

        assertEquals(BackendException.ErrorType.PROTOCOL_ERROR, result.getErrorKind());
        assertTrue(result.getErrorMessage().contains("exited with code 3"), result.getErrorMessage());
        assertEquals("boom", result.getRawText());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void empty_output_is_a_protocol_error() {
        DispatchResult result = shell("exit 0").invoke(DispatchRequest.of("sh-test", "x", Duration.ofSeconds(10)));
        assertEquals(BackendException.ErrorType.PROTOCOL_ERROR, result.getErrorKind());
    }

    @Test
    void missing_binary_is_unavailable() {
        CliBackend backend = new CliBackend(BackendConfig.cli("ghost", List.of("/nonexistent/agentstrike-ghost-cli")));
        assertFalse(backend.isAvailable());

        DispatchResult result = backend.invoke(DispatchRequest.of("ghost", "x", Duration.ofSeconds(5)));
        assertEquals(BackendException.ErrorType.UNAVAILABLE, result.getErrorKind());
    }

    @Test
    void rejects_non_cli_config() {
        assertThrows(IllegalArgumentException.class,
                () -> new CliBackend(BackendConfig.localHttp("ollama", "http://127.0.0.1:11434", "m")));
    }

    @Test
    void clean_strips_ansi_and_whitespace() {
        assertEquals("red text", CliBackend.clean("\u001B[31mred\u001B[0m text\n\n"));
        assertEquals("", CliBackend.clean(null));
    }

    @Test
    void providers_read_prompt_from_stdin() {
        for (CliProvider provider : CliProvider.values()) {
            List<String> cmd = provider.buildCommand(null);
            assertEquals(provider.getDefaultBinary(), cmd.get(0));
        }
        assertEquals(List.of("/opt/claude", "-p"), CliProvider.CLAUDE.buildCommand("/opt/claude"));
    }
}
