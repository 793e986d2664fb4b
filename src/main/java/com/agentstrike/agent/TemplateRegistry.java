package com.agentstrike.agent;

import com.agentstrike.config.ConfigException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt templates by id. Ships with the bundled templates; callers may
 * register replacements (a higher version for the same id wins).
 */
public class TemplateRegistry {

    public static final String PASSIVE_TRIAGE = "passive-triage";
    public static final String ACTIVE_VERIFY = "active-verify";
    public static final String ANALYZE_REQUEST = "analyze-request";
    public static final String EXPLAIN_FINDING = "explain-finding";
    public static final String CHAT = "chat";

    // ==================== Bundled prompts ====================

    private static final String PASSIVE_TRIAGE_TEXT = """
            ${role}

            Triage the following HTTP exchange for security vulnerabilities.
            Consider only these vulnerability classes: ${classes}

            Only report issues you can support with concrete evidence from the traffic below:
            the exact header, parameter value or response text that shows the problem.
            Do not report speculative or theoretical issues.
            If there is nothing worth reporting, return {"findings": []}.

            Respond ONLY with valid JSON in this exact format:
            {"findings": [{"class": "one of the classes above", "severity": "CRITICAL|HIGH|MEDIUM|LOW|INFO", "confidence": 0-100, "evidence": "Exact text from the exchange", "description": "What the issue is", "remediation": "How to fix"}]}

            Generated: ${timestamp}
            ${metadata}
            HTTP Exchange:
            ${context}
            """;

    private static final String ACTIVE_VERIFY_TEXT = """
            ${role}

            An authorized active test sent a ${vulnClass} payload and captured the exchange below.
            Injection point: ${injectionPoint} (${injectionType}), original value: ${originalValue}
            Payload: ${payload}
            ${oobNote}

            Decide whether the response proves the target is vulnerable to ${vulnClass}.
            Evidence must be concrete: an error message, reflected payload, computed expression,
            leaked file content, or a behavioural difference from the original response.
            Original response status: ${baselineStatus}

            Respond ONLY with valid JSON:
            {"vulnerable": true|false, "confidence": 0-100, "evidence": "What in the response proves it", "severity": "CRITICAL|HIGH|MEDIUM|LOW|INFO"}

            Generated: ${timestamp}
            Probe exchange:
            ${context}
            """;

    private static final String ANALYZE_REQUEST_TEXT = """
            ${role}

            Analyze this HTTP exchange in depth. Describe the attack surface (parameters,
            authentication, state, technologies) and list the most promising tests for
            these classes: ${classes}

            For each confirmed issue also emit a JSON block:
            {"findings": [{"class": "...", "severity": "CRITICAL|HIGH|MEDIUM|LOW|INFO", "confidence": 0-100, "evidence": "...", "description": "...", "remediation": "..."}]}

            Generated: ${timestamp}
            ${metadata}
            HTTP Exchange:
            ${context}
            """;

    private static final String EXPLAIN_FINDING_TEXT = """
            ${role}

            Explain the following finding to a developer: what it is, how it can be exploited,
            how to reproduce it safely, and how to fix it.

            Finding: ${finding}
            Evidence: ${evidence}

            Generated: ${timestamp}
            Related exchange:
            ${context}
            """;

    private static final String CHAT_TEXT = """
            ${role}

            Continue the conversation below about the target application.

            Conversation so far:
            ${history}

            Current exchange:
            ${context}

            User: ${message}
            """;

    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();

    public TemplateRegistry() {
        register(new PromptTemplate(PASSIVE_TRIAGE, 1, PASSIVE_TRIAGE_TEXT));
        register(new PromptTemplate(ACTIVE_VERIFY, 1, ACTIVE_VERIFY_TEXT));
        register(new PromptTemplate(ANALYZE_REQUEST, 1, ANALYZE_REQUEST_TEXT));
        register(new PromptTemplate(EXPLAIN_FINDING, 1, EXPLAIN_FINDING_TEXT));
        register(new PromptTemplate(CHAT, 1, CHAT_TEXT));
    }

    /** Registers a template unless one with the same id and a higher version is present. */
    public void register(PromptTemplate template) {
        templates.merge(template.id(), template,
                (existing, incoming) -> incoming.version() >= existing.version() ? incoming : existing);
    }

    /**
     * @throws ConfigException MISSING_TEMPLATE
     */
    public PromptTemplate require(String id) {
        PromptTemplate t = id == null ? null : templates.get(id);
        if (t == null) {
            throw new ConfigException(ConfigException.Kind.MISSING_TEMPLATE,
                    "No prompt template '" + id + "'");
        }
        return t;
    }

    public List<String> ids() {
        List<String> ids = new ArrayList<>(templates.keySet());
        ids.sort(null);
        return ids;
    }
}
