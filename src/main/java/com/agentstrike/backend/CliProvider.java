package com.agentstrike.backend;

import java.util.ArrayList;
import java.util.List;

/**
 * Known AI command-line tools and the arguments that make each one read
 * its prompt from stdin. The prompt is never passed as an argument.
 */
public enum CliProvider {

    CLAUDE("Claude CLI", "claude", "claude-cli"),
    GEMINI("Gemini CLI", "gemini", "gemini-cli"),
    CODEX("Codex CLI", "codex", "codex-cli"),
    OPENCODE("OpenCode CLI", "opencode", "opencode-cli");

    private final String displayName;
    private final String defaultBinary;
    private final String backendId;

    CliProvider(String displayName, String defaultBinary, String backendId) {
        this.displayName = displayName;
        this.defaultBinary = defaultBinary;
        this.backendId = backendId;
    }

    public String getDisplayName() { return displayName; }
    public String getDefaultBinary() { return defaultBinary; }

    /** Default registry id for this tool, e.g. "claude-cli". */
    public String getBackendId() { return backendId; }

    /**
     * Full argv for the tool, binary first.
     *
     * @param binaryPath override for the binary (null or blank = default name on PATH)
     */
    public List<String> buildCommand(String binaryPath) {
        String binary = (binaryPath != null && !binaryPath.isBlank()) ? binaryPath : defaultBinary;
        List<String> cmd = new ArrayList<>();
        cmd.add(binary);
        switch (this) {
            case CLAUDE -> cmd.add("-p");
            case GEMINI -> {
                // -p . means "read the prompt from stdin"
                cmd.add("--output-format");
                cmd.add("text");
                cmd.add("-p");
                cmd.add(".");
            }
            case CODEX -> {
                cmd.add("exec");
                cmd.add("--color");
                cmd.add("never");
                cmd.add("--skip-git-repo-check");
                cmd.add("-");
            }
            case OPENCODE -> {
                cmd.add("run");
                cmd.add("-");
            }
        }
        return cmd;
    }

    public static CliProvider fromBackendId(String id) {
        for (CliProvider p : values()) {
            if (p.backendId.equalsIgnoreCase(id) || p.defaultBinary.equalsIgnoreCase(id)) return p;
        }
        return null;
    }

    @Override
    public String toString() { return displayName; }
}
