package com.agentstrike.config;

import com.agentstrike.model.PayloadRisk;
import com.agentstrike.model.ScanMode;

import java.util.Objects;

/**
 * Active scanner knobs. The effective risk ceiling of a job is the lower of
 * {@link #maxRiskLevel()} and the scan mode's own ceiling.
 */
public record ActiveSettings(boolean enabled,
                             int maxConcurrent,
                             int maxPayloadsPerPoint,
                             int timeoutSeconds,
                             long requestDelayMs,
                             PayloadRisk maxRiskLevel,
                             boolean scopeOnly,
                             ScanMode scanMode,
                             boolean useOob,
                             int oobWaitSeconds) {

    public ActiveSettings {
        maxConcurrent = Math.max(1, Math.min(50, maxConcurrent));
        maxPayloadsPerPoint = Math.max(1, maxPayloadsPerPoint);
        timeoutSeconds = Math.max(1, timeoutSeconds);
        requestDelayMs = Math.max(0, requestDelayMs);
        maxRiskLevel = Objects.requireNonNullElse(maxRiskLevel, PayloadRisk.MODERATE);
        scanMode = Objects.requireNonNullElse(scanMode, ScanMode.PENTEST);
        oobWaitSeconds = Math.max(0, oobWaitSeconds);
    }

    public static ActiveSettings defaults() {
        return new ActiveSettings(false, 3, 10, 60, 200, PayloadRisk.MODERATE, true, ScanMode.PENTEST, false, 15);
    }

    public PayloadRisk effectiveCeiling() {
        return PayloadRisk.lowerOf(maxRiskLevel, scanMode.getDefaultCeiling());
    }

    public ActiveSettings withEnabled(boolean v) {
        return new ActiveSettings(v, maxConcurrent, maxPayloadsPerPoint, timeoutSeconds, requestDelayMs,
                maxRiskLevel, scopeOnly, scanMode, useOob, oobWaitSeconds);
    }

    public ActiveSettings withMaxConcurrent(int v) {
        return new ActiveSettings(enabled, v, maxPayloadsPerPoint, timeoutSeconds, requestDelayMs,
                maxRiskLevel, scopeOnly, scanMode, useOob, oobWaitSeconds);
    }

    public ActiveSettings withMaxPayloadsPerPoint(int v) {
        return new ActiveSettings(enabled, maxConcurrent, v, timeoutSeconds, requestDelayMs,
                maxRiskLevel, scopeOnly, scanMode, useOob, oobWaitSeconds);
    }

    public ActiveSettings withTimeoutSeconds(int v) {
        return new ActiveSettings(enabled, maxConcurrent, maxPayloadsPerPoint, v, requestDelayMs,
                maxRiskLevel, scopeOnly, scanMode, useOob, oobWaitSeconds);
    }

    public ActiveSettings withRequestDelayMs(long v) {
        return new ActiveSettings(enabled, maxConcurrent, maxPayloadsPerPoint, timeoutSeconds, v,
                maxRiskLevel, scopeOnly, scanMode, useOob, oobWaitSeconds);
    }

    public ActiveSettings withMaxRiskLevel(PayloadRisk v) {
        return new ActiveSettings(enabled, maxConcurrent, maxPayloadsPerPoint, timeoutSeconds, requestDelayMs,
                v, scopeOnly, scanMode, useOob, oobWaitSeconds);
    }

    public ActiveSettings withScopeOnly(boolean v) {
        return new ActiveSettings(enabled, maxConcurrent, maxPayloadsPerPoint, timeoutSeconds, requestDelayMs,
                maxRiskLevel, v, scanMode, useOob, oobWaitSeconds);
    }

    public ActiveSettings withScanMode(ScanMode v) {
        return new ActiveSettings(enabled, maxConcurrent, maxPayloadsPerPoint, timeoutSeconds, requestDelayMs,
                maxRiskLevel, scopeOnly, v, useOob, oobWaitSeconds);
    }

    public ActiveSettings withUseOob(boolean v) {
        return new ActiveSettings(enabled, maxConcurrent, maxPayloadsPerPoint, timeoutSeconds, requestDelayMs,
                maxRiskLevel, scopeOnly, scanMode, v, oobWaitSeconds);
    }

    public ActiveSettings withOobWaitSeconds(int v) {
        return new ActiveSettings(enabled, maxConcurrent, maxPayloadsPerPoint, timeoutSeconds, requestDelayMs,
                maxRiskLevel, scopeOnly, scanMode, useOob, v);
    }
}
