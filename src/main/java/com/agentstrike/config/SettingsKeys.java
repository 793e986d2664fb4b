package com.agentstrike.config;

import com.agentstrike.model.PayloadRisk;
import com.agentstrike.model.ScanMode;
import com.agentstrike.privacy.PrivacyMode;

import java.nio.file.Path;
import java.util.Set;
import java.util.function.Function;

/**
 * Persisted setting keys and the mapping from string values onto a snapshot.
 * Unset or unparsable values keep the base snapshot's value.
 */
public final class SettingsKeys {

    public static final String PREFIX = "agentstrike.";

    public static final String PRIVACY_MODE = PREFIX + "privacyMode";
    public static final String DETERMINISM = PREFIX + "determinism";
    public static final String AUDIT_ENABLED = PREFIX + "audit.enabled";
    public static final String AUDIT_PATH = PREFIX + "audit.path";
    public static final String HOST_SALT = PREFIX + "hostSalt";
    public static final String BACKEND = PREFIX + "backend";
    public static final String PROFILE = PREFIX + "profile";
    public static final String POOL_SIZE = PREFIX + "supervisor.poolSize";
    public static final String DISPATCH_TIMEOUT = PREFIX + "dispatch.timeoutSeconds";
    public static final String MAX_RETRIES = PREFIX + "dispatch.maxRetries";
    public static final String MAX_SESSION_TURNS = PREFIX + "session.maxTurns";
    public static final String REDACTION_HOSTS = PREFIX + "redactionHosts";
    public static final String SCOPE_DOMAINS = PREFIX + "scopeDomains";

    public static final String PASSIVE_ENABLED = PREFIX + "passive.enabled";
    public static final String PASSIVE_RATE_LIMIT = PREFIX + "passive.rateLimitSeconds";
    public static final String PASSIVE_SCOPE_ONLY = PREFIX + "passive.scopeOnly";
    public static final String PASSIVE_MAX_SIZE_KB = PREFIX + "passive.maxSizeKb";
    public static final String PASSIVE_ESCALATE = PREFIX + "passive.escalateToActive";
    public static final String PASSIVE_MIN_CONFIDENCE = PREFIX + "passive.minConfidence";

    public static final String ACTIVE_ENABLED = PREFIX + "active.enabled";
    public static final String ACTIVE_MAX_CONCURRENT = PREFIX + "active.maxConcurrent";
    public static final String ACTIVE_MAX_PAYLOADS = PREFIX + "active.maxPayloadsPerPoint";
    public static final String ACTIVE_TIMEOUT = PREFIX + "active.timeoutSeconds";
    public static final String ACTIVE_DELAY_MS = PREFIX + "active.requestDelayMs";
    public static final String ACTIVE_MAX_RISK = PREFIX + "active.maxRiskLevel";
    public static final String ACTIVE_SCOPE_ONLY = PREFIX + "active.scopeOnly";
    public static final String ACTIVE_SCAN_MODE = PREFIX + "active.scanMode";
    public static final String ACTIVE_USE_OOB = PREFIX + "active.useOob";
    public static final String ACTIVE_OOB_WAIT = PREFIX + "active.oobWaitSeconds";

    private SettingsKeys() {}

    /**
     * Overlays looked-up values onto {@code base}.
     *
     * @param lookup returns the stored string for a key, or null when unset
     */
    public static AgentSettings overlay(AgentSettings base, Function<String, String> lookup) {
        AgentSettings.Builder b = base.toBuilder()
                .privacyMode(PrivacyMode.fromString(lookup.apply(PRIVACY_MODE), base.getPrivacyMode()))
                .determinismMode(bool(lookup, DETERMINISM, base.isDeterminismMode()))
                .auditEnabled(bool(lookup, AUDIT_ENABLED, base.isAuditEnabled()))
                .hostSalt(str(lookup, HOST_SALT, base.getHostSalt()))
                .backendId(str(lookup, BACKEND, base.getBackendId()))
                .profileId(str(lookup, PROFILE, base.getProfileId()))
                .supervisorPoolSize(integer(lookup, POOL_SIZE, base.getSupervisorPoolSize()))
                .dispatchTimeoutSeconds(integer(lookup, DISPATCH_TIMEOUT, base.getDispatchTimeoutSeconds()))
                .maxRetries(integer(lookup, MAX_RETRIES, base.getMaxRetries()))
                .maxSessionTurns(integer(lookup, MAX_SESSION_TURNS, base.getMaxSessionTurns()))
                .scopeDomains(str(lookup, SCOPE_DOMAINS, base.getScopeDomains()));

        String auditPath = lookup.apply(AUDIT_PATH);
        if (auditPath != null && !auditPath.isBlank()) b.auditLogPath(Path.of(auditPath.trim()));

        String hosts = lookup.apply(REDACTION_HOSTS);
        if (hosts != null) {
            b.redactionHosts(Set.of());
            for (String h : hosts.split(",")) b.addRedactionHost(h);
        }

        PassiveSettings p = base.getPassive();
        b.passive(new PassiveSettings(
                bool(lookup, PASSIVE_ENABLED, p.enabled()),
                integer(lookup, PASSIVE_RATE_LIMIT, p.rateLimitSeconds()),
                bool(lookup, PASSIVE_SCOPE_ONLY, p.scopeOnly()),
                integer(lookup, PASSIVE_MAX_SIZE_KB, p.maxSizeKb()),
                bool(lookup, PASSIVE_ESCALATE, p.escalateToActive()),
                integer(lookup, PASSIVE_MIN_CONFIDENCE, p.minConfidence())));

        ActiveSettings a = base.getActive();
        b.active(new ActiveSettings(
                bool(lookup, ACTIVE_ENABLED, a.enabled()),
                integer(lookup, ACTIVE_MAX_CONCURRENT, a.maxConcurrent()),
                integer(lookup, ACTIVE_MAX_PAYLOADS, a.maxPayloadsPerPoint()),
                integer(lookup, ACTIVE_TIMEOUT, a.timeoutSeconds()),
                integer(lookup, ACTIVE_DELAY_MS, (int) Math.min(Integer.MAX_VALUE, a.requestDelayMs())),
                PayloadRisk.fromString(lookup.apply(ACTIVE_MAX_RISK), a.maxRiskLevel()),
                bool(lookup, ACTIVE_SCOPE_ONLY, a.scopeOnly()),
                ScanMode.fromString(lookup.apply(ACTIVE_SCAN_MODE), a.scanMode()),
                bool(lookup, ACTIVE_USE_OOB, a.useOob()),
                integer(lookup, ACTIVE_OOB_WAIT, a.oobWaitSeconds())));

        return b.build();
    }

    private static String str(Function<String, String> lookup, String key, String fallback) {
        String v = lookup.apply(key);
        return v != null && !v.isBlank() ? v.trim() : fallback;
    }

    private static boolean bool(Function<String, String> lookup, String key, boolean fallback) {
        String v = lookup.apply(key);
        if (v == null || v.isBlank()) return fallback;
        return switch (v.trim().toLowerCase()) {
            case "true", "yes", "on", "1" -> true;
            case "false", "no", "off", "0" -> false;
            default -> fallback;
        };
    }

    private static int integer(Function<String, String> lookup, String key, int fallback) {
        String v = lookup.apply(key);
        if (v == null || v.isBlank()) return fallback;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
