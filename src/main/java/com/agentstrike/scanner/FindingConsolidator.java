package com.agentstrike.scanner;

import com.agentstrike.model.Confidence;
import com.agentstrike.model.Finding;
import com.agentstrike.model.FindingSource;
import com.agentstrike.model.Severity;
import com.agentstrike.model.TrafficContext;
import com.agentstrike.model.VulnClass;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Turns raw AI text into findings. Models wrap JSON in prose and code fences,
 * invent class names and mix numeric and word confidences, so parsing is lenient:
 * anything that cannot be read is dropped with a log line, never thrown.
 */
public class FindingConsolidator {

    /** Parsed active-probe answer. */
    public record Verdict(boolean vulnerable, int confidence, String evidence, Severity severity) {
        public Verdict {
            evidence = evidence != null ? evidence : "";
        }
    }

    private volatile Consumer<String> errorLogger;

    public void setErrorLogger(Consumer<String> errorLogger) {
        this.errorLogger = errorLogger;
    }

    // ==================== Passive triage ====================

    /**
     * Parses {@code {"findings":[...]}} into passive findings for the given traffic.
     * Entries below {@code minConfidence} (0-100) are dropped.
     */
    public List<Finding> parsePassive(String rawText, TrafficContext context, int minConfidence) {
        List<Finding> findings = new ArrayList<>();
        String json = extractJson(rawText);
        if (json == null) return findings;

        try {
            JsonElement parsed = JsonParser.parseString(json);
            if (!parsed.isJsonObject()) return findings;
            JsonElement list = parsed.getAsJsonObject().get("findings");
            if (list == null || !list.isJsonArray()) return findings;
            JsonArray arr = list.getAsJsonArray();

            for (JsonElement el : arr) {
                if (!el.isJsonObject()) continue;
                JsonObject obj = el.getAsJsonObject();
                String label = getStr(obj, "class");
                if (label.isEmpty()) label = getStr(obj, "title");
                VulnClass vulnClass = VulnClass.fromLabel(label);
                int score = confidenceScore(obj.get("confidence"));
                if (score < minConfidence) continue;

                String detail = getStr(obj, "description");
                if (vulnClass == VulnClass.OTHER && !label.isEmpty()) {
                    detail = "Reported as: " + label + (detail.isEmpty() ? "" : "\n" + detail);
                }
                findings.add(Finding.builder(vulnClass, FindingSource.PASSIVE, context.getUrl())
                        .severity(Severity.fromString(getStr(obj, "severity"), vulnClass.getDefaultSeverity()))
                        .confidence(Confidence.fromScore(score))
                        .evidence(getStr(obj, "evidence"))
                        .detail(detail)
                        .remediation(getStr(obj, "remediation"))
                        .sourceRequestId(context.getRequestId())
                        .requestResponse(context.getSource())
                        .build());
            }
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            logError("[Consolidator] Failed to parse AI findings JSON: " + e.getMessage()
                    + " | json snippet: " + json.substring(0, Math.min(json.length(), 300)));
        }
        return findings;
    }

    // ==================== Active verdicts ====================

    /** Reads {@code {"vulnerable", "confidence", "evidence", "severity"}}; empty when unreadable. */
    public Optional<Verdict> parseVerdict(String rawText) {
        String json = extractJson(rawText);
        if (json == null) return Optional.empty();
        try {
            JsonElement parsed = JsonParser.parseString(json);
            if (!parsed.isJsonObject()) return Optional.empty();
            JsonObject obj = parsed.getAsJsonObject();
            JsonElement vuln = obj.get("vulnerable");
            if (vuln == null || vuln.isJsonNull()) return Optional.empty();
            boolean vulnerable = vuln.isJsonPrimitive() && vuln.getAsJsonPrimitive().isBoolean()
                    ? vuln.getAsBoolean()
                    : "true".equalsIgnoreCase(vuln.getAsString().trim()) || "yes".equalsIgnoreCase(vuln.getAsString().trim());
            return Optional.of(new Verdict(vulnerable, confidenceScore(obj.get("confidence")),
                    getStr(obj, "evidence"), Severity.fromString(getStr(obj, "severity"), null)));
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            logError("[Consolidator] Failed to parse AI verdict JSON: " + e.getMessage());
            return Optional.empty();
        }
    }

    /** Builds the active finding for a positive verdict on one probe. */
    public Finding activeFinding(Verdict verdict, PlannedProbe probe, TrafficContext probeTraffic, String sentPayload) {
        VulnClass vulnClass = probe.vulnClass();
        return Finding.builder(vulnClass, FindingSource.ACTIVE, probeTraffic.getUrl())
                .severity(verdict.severity() != null ? verdict.severity() : vulnClass.getDefaultSeverity())
                .confidence(Confidence.fromScore(verdict.confidence()))
                .evidence(verdict.evidence())
                .detail("Payload injected into " + probe.point().type() + " '" + probe.point().name()
                        + "' and judged vulnerable (confidence " + verdict.confidence() + ").")
                .payload(sentPayload)
                .parameter(probe.point().name())
                .sourceRequestId(probeTraffic.getRequestId())
                .requestResponse(probeTraffic.getSource())
                .build();
    }

    // ==================== Deduplication ====================

    /**
     * Collapses findings sharing a dedup key. The surviving finding is the first
     * one seen, merged with every later duplicate.
     */
    public static List<Finding> consolidate(Collection<Finding> findings) {
        Map<String, Finding> byKey = new LinkedHashMap<>();
        for (Finding f : findings) {
            byKey.merge(f.dedupKey(), f, Finding::mergedWith);
        }
        return new ArrayList<>(byKey.values());
    }

    // ==================== JSON helpers ====================

    /**
     * Finds the JSON object in a model reply: a ```json fence, then a generic
     * fence holding an object, then the first balanced brace block.
     */
    static String extractJson(String text) {
        if (text == null) return null;
        // Closing fence is matched as "\n```" so backticks inside JSON strings don't end the block.
        int start = text.indexOf("```json");
        if (start >= 0) {
            start = text.indexOf('\n', start) + 1;
            int end = text.indexOf("\n```", start);
            if (start > 0 && end > start) return text.substring(start, end).trim();
        }
        start = text.indexOf("```");
        if (start >= 0) {
            start = text.indexOf('\n', start) + 1;
            int end = text.indexOf("\n```", start);
            if (start > 0 && end > start) {
                String block = text.substring(start, end).trim();
                if (block.startsWith("{")) return block;
            }
        }
        start = text.indexOf('{');
        if (start >= 0) {
            int depth = 0;
            boolean inString = false;
            boolean escaped = false;
            for (int i = start; i < text.length(); i++) {
                char c = text.charAt(i);
                if (escaped) { escaped = false; continue; }
                if (c == '\\' && inString) { escaped = true; continue; }
                if (c == '"') { inString = !inString; continue; }
                if (inString) continue;
                if (c == '{') depth++;
                else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return text.substring(start, i + 1);
                    }
                }
            }
        }
        return null;
    }

    /**
     * 0-100 score from a number, a numeric string, a 0-1 fraction or a word
     * (certain/high/firm/medium/low/tentative). Missing means 0.
     */
    static int confidenceScore(JsonElement el) {
        if (el == null || el.isJsonNull() || !el.isJsonPrimitive()) return 0;
        JsonPrimitive p = el.getAsJsonPrimitive();
        if (p.isNumber()) return clampScore(p.getAsDouble());
        String s = p.getAsString().trim().toLowerCase(Locale.ROOT).replace("%", "");
        try {
            return clampScore(Double.parseDouble(s));
        } catch (NumberFormatException e) {
            return switch (s) {
                case "certain", "confirmed" -> 95;
                case "high", "firm" -> 75;
                case "medium", "moderate" -> 60;
                case "low", "tentative" -> 30;
                default -> 0;
            };
        }
    }

    private static int clampScore(double value) {
        if (value > 0 && value < 1.0) value = value * 100;
        return (int) Math.max(0, Math.min(100, Math.round(value)));
    }

    private static String getStr(JsonObject obj, String key) {
        JsonElement el = obj.get(key);
        if (el == null || el.isJsonNull()) return "";
        return el.isJsonPrimitive() ? el.getAsString() : el.toString();
    }

    private void logError(String msg) {
        Consumer<String> l = errorLogger;
        if (l != null) l.accept(msg);
    }
}
