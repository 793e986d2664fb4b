package com.agentstrike.audit;

import com.agentstrike.backend.DispatchResult;
import com.agentstrike.model.Finding;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Append-only, hash-chained audit log. One JSON object per line:
 * <pre>{"index":n,"prevHash":"…","hash":"…","entry":{…}}</pre>
 * where {@code hash = sha256(json(entry) + prevHash)}.
 *
 * <p>All appends go through a single synchronized method, so the chain stays
 * linear under concurrent dispatches. An existing log is replayed on
 * construction and the chain continues from its last record.</p>
 */
public class AuditLogger {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final Path path;
    private final Clock clock;
    private volatile boolean enabled = true;
    private volatile Consumer<String> logger;
    private volatile Consumer<String> errorLogger;

    // Guarded by this
    private long nextIndex;
    private String lastHash = Hashing.GENESIS;

    public AuditLogger(Path path) {
        this(path, Clock.systemUTC(), null);
    }

    public AuditLogger(Path path, Clock clock, Consumer<String> errorLogger) {
        this.path = path;
        this.clock = clock;
        this.errorLogger = errorLogger;
        resume();
    }

    public void setLogger(Consumer<String> logger) { this.logger = logger; }
    public void setErrorLogger(Consumer<String> errorLogger) { this.errorLogger = errorLogger; }

    public Path getPath() { return path; }
    public boolean isEnabled() { return enabled; }

    /** When disabled, every log call is accepted and ignored. */
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public synchronized long getNextIndex() { return nextIndex; }
    public synchronized String getLastHash() { return lastHash; }

    // ==================== Event helpers ====================

    public void dispatchStart(String requestId, String backendId, String prompt, Map<String, String> details) {
        log(AuditEventType.DISPATCH_START, requestId, backendId, Hashing.sha256Hex(prompt), "", "STARTED", details);
    }

    public void dispatchEnd(DispatchResult result, String prompt, Map<String, String> details) {
        Map<String, String> d = new LinkedHashMap<>();
        if (details != null) d.putAll(details);
        d.put("latencyMs", String.valueOf(result.getLatency().toMillis()));
        if (!result.isSuccess()) d.put("error", result.getErrorMessage());
        log(AuditEventType.DISPATCH_END, result.getRequestId(), result.getBackendId(),
                Hashing.sha256Hex(prompt), Hashing.sha256Hex(result.getRawText()), result.outcome(), d);
    }

    public void findingCreated(Finding finding) {
        Map<String, String> d = new LinkedHashMap<>();
        d.put("name", finding.getName());
        d.put("class", finding.getVulnClass().tag());
        d.put("baseUrl", finding.getBaseUrl());
        d.put("severity", finding.getSeverity().name());
        d.put("confidence", finding.getConfidence().name());
        log(AuditEventType.FINDING_CREATED, finding.getSourceRequestId(), "", "", "", "CREATED", d);
    }

    public void scannerState(String scanner, String state) {
        log(AuditEventType.SCANNER_STATE, "", "", "", "", state, Map.of("scanner", scanner));
    }

    public void policySkip(String requestId, String reason, Map<String, String> details) {
        log(AuditEventType.POLICY_SKIP, requestId, "", "", "", reason, details);
    }

    // ==================== Core ====================

    /**
     * Appends one record. Returns the written record, or null when disabled or the write failed.
     * I/O failures are reported to the error logger and leave the chain unchanged.
     */
    public AuditRecord log(AuditEventType type, String requestId, String backend, String promptHash,
                           String responseHash, String outcome, Map<String, String> details) {
        if (!enabled) return null;
        AuditRecord record = new AuditRecord(Instant.now(clock).toString(), type, requestId, backend,
                promptHash, responseHash, outcome, details);
        return append(record) ? record : null;
    }

    private synchronized boolean append(AuditRecord record) {
        String entryJson = GSON.toJson(toJson(record));
        String hash = Hashing.sha256Hex(entryJson + lastHash);

        JsonObject line = new JsonObject();
        line.addProperty("index", nextIndex);
        line.addProperty("prevHash", lastHash);
        line.addProperty("hash", hash);
        line.add("entry", toJson(record));

        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(path, GSON.toJson(line) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            logError("[Audit] Failed to append " + record.getType() + " to " + path + ": " + e.getMessage());
            return false;
        }
        nextIndex++;
        lastHash = hash;
        return true;
    }

    private static JsonObject toJson(AuditRecord r) {
        JsonObject o = new JsonObject();
        o.addProperty("timestamp", r.getTimestamp());
        o.addProperty("type", r.getType().name());
        o.addProperty("requestId", r.getRequestId());
        o.addProperty("backend", r.getBackend());
        o.addProperty("promptHash", r.getPromptHash());
        o.addProperty("responseHash", r.getResponseHash());
        o.addProperty("outcome", r.getOutcome());
        JsonObject details = new JsonObject();
        for (Map.Entry<String, String> e : r.getDetails().entrySet()) {
            details.addProperty(e.getKey(), e.getValue());
        }
        o.add("details", details);
        return o;
    }

    private synchronized void resume() {
        if (!Files.exists(path)) return;
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logError("[Audit] Could not read existing log " + path + ": " + e.getMessage());
            return;
        }
        for (int i = lines.size() - 1; i >= 0; i--) {
            String raw = lines.get(i);
            if (raw.isBlank()) continue;
            try {
                JsonObject line = JsonParser.parseString(raw).getAsJsonObject();
                nextIndex = line.get("index").getAsLong() + 1;
                lastHash = line.get("hash").getAsString();
                log("[Audit] Resuming chain at index " + nextIndex + " in " + path);
                return;
            } catch (RuntimeException e) {
                logError("[Audit] Skipping unreadable line " + i + " while resuming " + path);
            }
        }
    }

    // ==================== Verification ====================

    public ChainVerification verify() {
        synchronized (this) {
            return verify(path);
        }
    }

    /**
     * Replays a log and recomputes every digest. Reports the zero-based position of
     * the first record whose index, back-link or own hash does not check out.
     */
    public static ChainVerification verify(Path path) {
        List<String> lines;
        try {
            lines = Files.exists(path) ? Files.readAllLines(path, StandardCharsets.UTF_8) : List.of();
        } catch (IOException e) {
            return ChainVerification.broken(0, 0, "Unreadable log: " + e.getMessage());
        }

        String expectedPrev = Hashing.GENESIS;
        int position = 0;
        for (String raw : lines) {
            if (raw.isBlank()) continue;
            JsonObject line;
            try {
                line = JsonParser.parseString(raw).getAsJsonObject();
            } catch (JsonParseException | IllegalStateException e) {
                return ChainVerification.broken(position, position, "Malformed JSON");
            }
            JsonElement index = line.get("index");
            JsonElement prev = line.get("prevHash");
            JsonElement hash = line.get("hash");
            JsonElement entry = line.get("entry");
            if (index == null || prev == null || hash == null || entry == null || !entry.isJsonObject()) {
                return ChainVerification.broken(position, position, "Missing field");
            }
            if (index.getAsLong() != position) {
                return ChainVerification.broken(position, position,
                        "Expected index " + position + " but found " + index.getAsLong());
            }
            if (!expectedPrev.equals(prev.getAsString())) {
                return ChainVerification.broken(position, position, "prevHash does not link to previous record");
            }
            String recomputed = Hashing.sha256Hex(GSON.toJson(entry) + expectedPrev);
            if (!recomputed.equals(hash.getAsString())) {
                return ChainVerification.broken(position, position, "Entry hash mismatch");
            }
            expectedPrev = recomputed;
            position++;
        }
        return ChainVerification.ok(position);
    }

    private void log(String msg) {
        Consumer<String> l = logger;
        if (l != null) l.accept(msg);
    }

    private void logError(String msg) {
        Consumer<String> l = errorLogger;
        if (l != null) l.accept(msg);
    }
}
