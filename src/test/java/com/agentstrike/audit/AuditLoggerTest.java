package com.agentstrike.audit;

import com.agentstrike.backend.BackendException;
import com.agentstrike.backend.DispatchRequest;
import com.agentstrike.backend.DispatchResult;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditLoggerTest {

    @TempDir
    Path dir;

    private AuditLogger newLogger(Path file) {
        return new AuditLogger(file, Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC), null);
    }

    private static void writeRecords(AuditLogger audit, int count) {
        for (int i = 0; i < count; i++) {
            audit.log(AuditEventType.SCANNER_STATE, "req-" + i, "", "", "", "OK", Map.of("n", String.valueOf(i)));
        }
    }

    @Test
    void chain_of_records_verifies() {
        Path file = dir.resolve("audit.jsonl");
        AuditLogger audit = newLogger(file);
        writeRecords(audit, 5);

        ChainVerification v = audit.verify();
        assertTrue(v.valid(), v.reason());
        assertEquals(5, v.recordCount());
        assertEquals(-1, v.firstBadIndex());
        assertEquals(5, audit.getNextIndex());
    }

    @Test
    void line_format_links_each_record_to_the_previous_hash() throws IOException {
        Path file = dir.resolve("audit.jsonl");
        AuditLogger audit = newLogger(file);
        writeRecords(audit, 2);

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        JsonObject first = JsonParser.parseString(lines.get(0)).getAsJsonObject();
        JsonObject second = JsonParser.parseString(lines.get(1)).getAsJsonObject();

        assertEquals(0, first.get("index").getAsLong());
        assertEquals(Hashing.GENESIS, first.get("prevHash").getAsString());
        assertEquals(first.get("hash").getAsString(), second.get("prevHash").getAsString());
        assertEquals("2024-01-01T00:00:00Z", first.getAsJsonObject("entry").get("timestamp").getAsString());
        assertEquals(second.get("hash").getAsString(), audit.getLastHash());
    }

    @Test
    void tampered_entry_is_reported_at_its_position() throws IOException {
        Path file = dir.resolve("audit.jsonl");
        writeRecords(newLogger(file), 5);

        List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
        lines.set(2, lines.get(2).replace("\"outcome\":\"OK\"", "\"outcome\":\"FORGED\""));
        Files.write(file, lines, StandardCharsets.UTF_8);

        ChainVerification v = AuditLogger.verify(file);
        assertFalse(v.valid());
        assertEquals(2, v.firstBadIndex());
    }

    @Test
    void removed_record_breaks_the_chain_where_it_was() throws IOException {
        Path file = dir.resolve("audit.jsonl");
        writeRecords(newLogger(file), 5);

        List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
        lines.remove(3);
        Files.write(file, lines, StandardCharsets.UTF_8);

        ChainVerification v = AuditLogger.verify(file);
        assertFalse(v.valid());
        assertEquals(3, v.firstBadIndex());
    }

    @Test
    void recomputed_hash_without_relinking_is_caught_by_the_next_record() throws IOException {
        Path file = dir.resolve("audit.jsonl");
        writeRecords(newLogger(file), 4);

        List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
        JsonObject line = JsonParser.parseString(lines.get(1)).getAsJsonObject();
        JsonObject entry = line.getAsJsonObject("entry");
        entry.addProperty("outcome", "FORGED");
        String prev = line.get("prevHash").getAsString();
        line.addProperty("hash", Hashing.sha256Hex(entry.toString() + prev));
        lines.set(1, line.toString());
        Files.write(file, lines, StandardCharsets.UTF_8);

        ChainVerification v = AuditLogger.verify(file);
        assertFalse(v.valid());
        assertEquals(2, v.firstBadIndex());
    }

    @Test
    void reopening_resumes_the_chain() {
        Path file = dir.resolve("audit.jsonl");
        AuditLogger first = newLogger(file);
        writeRecords(first, 3);
        String lastHash = first.getLastHash();

        AuditLogger second = newLogger(file);
        assertEquals(3, second.getNextIndex());
        assertEquals(lastHash, second.getLastHash());
        writeRecords(second, 2);

        ChainVerification v = second.verify();
        assertTrue(v.valid(), v.reason());
        assertEquals(5, v.recordCount());
    }

    @Test
    void disabled_logger_writes_nothing() {
        Path file = dir.resolve("audit.jsonl");
        AuditLogger audit = newLogger(file);
        audit.setEnabled(false);

        assertNull(audit.log(AuditEventType.SCANNER_STATE, "", "", "", "", "OK", Map.of()));
        audit.scannerState("passive", "ENABLED");
        assertFalse(Files.exists(file));
        assertEquals(0, audit.getNextIndex());
    }

    @Test
    void dispatch_events_hash_prompt_and_response() throws IOException {
        Path file = dir.resolve("audit.jsonl");
        AuditLogger audit = newLogger(file);
        DispatchRequest request = DispatchRequest.of("fake", "the prompt", Duration.ofSeconds(5));

        audit.dispatchStart(request.requestId(), "fake", request.prompt(), Map.of("action", "passive"));
        audit.dispatchEnd(DispatchResult.failure(request,
                new BackendException(BackendException.ErrorType.TIMEOUT, "slow", "partial"), Duration.ofMillis(7)),
                request.prompt(), Map.of("action", "passive"));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        JsonObject end = JsonParser.parseString(lines.get(1)).getAsJsonObject().getAsJsonObject("entry");
        assertEquals("DISPATCH_END", end.get("type").getAsString());
        assertEquals("TIMEOUT", end.get("outcome").getAsString());
        assertEquals(Hashing.sha256Hex("the prompt"), end.get("promptHash").getAsString());
        assertEquals(Hashing.sha256Hex("partial"), end.get("responseHash").getAsString());
        assertEquals("slow", end.getAsJsonObject("details").get("error").getAsString());
        assertFalse(lines.get(0).contains("the prompt"));
    }

    @Test
    void missing_file_verifies_as_empty_chain() {
        ChainVerification v = AuditLogger.verify(dir.resolve("none.jsonl"));
        assertTrue(v.valid());
        assertEquals(0, v.recordCount());
    }
}
