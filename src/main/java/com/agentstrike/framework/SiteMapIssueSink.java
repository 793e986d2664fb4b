package com.agentstrike.framework;

import burp.api.montoya.MontoyaApi;
import burp.api.montoya.http.message.HttpRequestResponse;
import burp.api.montoya.scanner.audit.issues.AuditIssue;
import burp.api.montoya.scanner.audit.issues.AuditIssueConfidence;
import burp.api.montoya.scanner.audit.issues.AuditIssueSeverity;
import com.agentstrike.model.Confidence;
import com.agentstrike.model.Finding;
import com.agentstrike.model.Severity;

/**
 * Reports findings as native Burp issues in the Site Map and Dashboard,
 * named "[AI Passive] CLASS" / "[AI Active] CLASS".
 */
public class SiteMapIssueSink implements IssueSink {

    private final MontoyaApi api;

    public SiteMapIssueSink(MontoyaApi api) {
        this.api = api;
    }

    @Override
    public void reportIssue(Finding finding) {
        try {
            HttpRequestResponse reqResp = finding.getRequestResponse();
            // Burp needs a request to anchor the issue
            if (reqResp == null || reqResp.request() == null) {
                api.logging().logToOutput("[SiteMap] Skipping (no request data): " + finding.getName());
                return;
            }

            AuditIssueSeverity severity = mapSeverity(finding.getSeverity());
            AuditIssueConfidence confidence = mapConfidence(finding.getConfidence());

            AuditIssue issue = AuditIssue.auditIssue(
                    finding.getName(),
                    buildDetailHtml(finding),
                    finding.getRemediation(),
                    finding.getBaseUrl(),
                    severity,
                    confidence,
                    finding.getVulnClass().getDisplayName(),
                    null,
                    severity,
                    reqResp
            );
            api.siteMap().add(issue);
            api.logging().logToOutput("[SiteMap] " + finding.getName()
                    + " [" + severity + "/" + confidence + "] @ " + finding.getBaseUrl());
        } catch (RuntimeException e) {
            api.logging().logToError("[SiteMap] FAILED: " + finding.getName()
                    + " | " + e.getClass().getName() + ": " + e.getMessage());
        }
    }

    private static AuditIssueSeverity mapSeverity(Severity sev) {
        return switch (sev) {
            case CRITICAL, HIGH -> AuditIssueSeverity.HIGH;
            case MEDIUM -> AuditIssueSeverity.MEDIUM;
            case LOW -> AuditIssueSeverity.LOW;
            case INFO -> AuditIssueSeverity.INFORMATION;
        };
    }

    private static AuditIssueConfidence mapConfidence(Confidence conf) {
        return switch (conf) {
            case CERTAIN -> AuditIssueConfidence.CERTAIN;
            case FIRM -> AuditIssueConfidence.FIRM;
            case TENTATIVE -> AuditIssueConfidence.TENTATIVE;
        };
    }

    private static String buildDetailHtml(Finding f) {
        StringBuilder sb = new StringBuilder();
        sb.append("<p><b>Class:</b> ").append(esc(f.getVulnClass().getDisplayName()))
                .append(" (").append(f.getVulnClass().tag()).append(")</p>");
        sb.append("<p><b>Severity:</b> ").append(f.getSeverity())
                .append(" | <b>Confidence:</b> ").append(f.getConfidence()).append("</p>");
        sb.append("<p><b>URL:</b> ").append(esc(f.getUrl())).append("</p>");
        if (!f.getParameter().isEmpty()) {
            sb.append("<p><b>Parameter:</b> ").append(esc(f.getParameter())).append("</p>");
        }
        if (!f.getPayload().isEmpty()) {
            sb.append("<p><b>Payload:</b></p><pre>").append(esc(f.getPayload())).append("</pre>");
        }
        if (!f.getDetail().isEmpty()) {
            sb.append("<p><b>Description:</b><br>").append(esc(f.getDetail())).append("</p>");
        }
        if (!f.getEvidence().isEmpty()) {
            sb.append("<p><b>Evidence:</b></p><pre>").append(esc(f.getEvidence())).append("</pre>");
        }
        sb.append("<p><i>AI-generated result. Verify manually before reporting.</i></p>");
        return sb.toString();
    }

    private static String esc(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
