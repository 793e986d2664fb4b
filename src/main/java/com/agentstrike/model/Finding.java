package com.agentstrike.model;

import burp.api.montoya.http.message.HttpRequestResponse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A classified security observation derived from AI output.
 * Identity is (issue name, canonical base URL); see {@link BaseUrls}. The issue name
 * carries the source, so passive, active and agent findings are kept apart.
 */
public class Finding {

    /** Upper bound for evidence accumulated by merging duplicates. */
    public static final int MAX_EVIDENCE_CHARS = 8192;

    private final VulnClass vulnClass;
    private final FindingSource source;
    private final Severity severity;
    private final Confidence confidence;
    private final String url;
    private final String baseUrl;
    private final String evidence;
    private final String detail;
    private final String remediation;
    private final String payload;
    private final String parameter;
    private final List<String> sourceRequestIds;
    private final HttpRequestResponse requestResponse;
    private final long timestamp;

    private Finding(Builder builder) {
        this.vulnClass = Objects.requireNonNull(builder.vulnClass, "vulnClass is required");
        this.source = Objects.requireNonNull(builder.source, "source is required");
        this.severity = builder.severity != null ? builder.severity : vulnClass.getDefaultSeverity();
        this.confidence = builder.confidence != null ? builder.confidence : Confidence.TENTATIVE;
        this.url = Objects.requireNonNull(builder.url, "url is required");
        this.baseUrl = BaseUrls.canonical(builder.url);
        this.evidence = builder.evidence;
        this.detail = builder.detail;
        this.remediation = builder.remediation;
        this.payload = builder.payload;
        this.parameter = builder.parameter;
        this.sourceRequestIds = Collections.unmodifiableList(new ArrayList<>(builder.sourceRequestIds));
        this.requestResponse = builder.requestResponse;
        this.timestamp = builder.timestamp;
    }

    public VulnClass getVulnClass() { return vulnClass; }
    public FindingSource getSource() { return source; }
    public Severity getSeverity() { return severity; }
    public Confidence getConfidence() { return confidence; }
    public String getUrl() { return url; }
    public String getBaseUrl() { return baseUrl; }
    public String getEvidence() { return evidence; }
    public String getDetail() { return detail; }
    public String getRemediation() { return remediation; }
    public String getPayload() { return payload; }
    public String getParameter() { return parameter; }
    public HttpRequestResponse getRequestResponse() { return requestResponse; }
    public long getTimestamp() { return timestamp; }

    /** First request that produced this finding. */
    public String getSourceRequestId() {
        return sourceRequestIds.isEmpty() ? "" : sourceRequestIds.get(0);
    }

    /** Every request that reported this finding, oldest first. */
    public List<String> getSourceRequestIds() { return sourceRequestIds; }

    /** Issue name as shown in Burp, e.g. "[AI Active] SQLI". */
    public String getName() {
        return source.issueName(vulnClass);
    }

    public String dedupKey() {
        return getName() + "|" + baseUrl;
    }

    /**
     * Merges a duplicate into this finding. The stronger severity and confidence win,
     * evidence is appended when new (up to {@link #MAX_EVIDENCE_CHARS}), and the
     * duplicate's request ids are recorded.
     */
    public Finding mergedWith(Finding duplicate) {
        Builder b = toBuilder();
        if (duplicate.severity.isHigherThan(severity)) b.severity(duplicate.severity);
        if (duplicate.confidence.ordinal() > confidence.ordinal()) b.confidence(duplicate.confidence);
        if (!duplicate.evidence.isEmpty() && !evidence.contains(duplicate.evidence)) {
            String combined = evidence.isEmpty() ? duplicate.evidence : evidence + "\n---\n" + duplicate.evidence;
            if (combined.length() > MAX_EVIDENCE_CHARS) {
                combined = combined.substring(0, MAX_EVIDENCE_CHARS);
            }
            b.evidence(combined);
        }
        Set<String> ids = new LinkedHashSet<>(sourceRequestIds);
        ids.addAll(duplicate.sourceRequestIds);
        b.sourceRequestIds.clear();
        b.sourceRequestIds.addAll(ids);
        return b.build();
    }

    public static Builder builder(VulnClass vulnClass, FindingSource source, String url) {
        return new Builder(vulnClass, source, url);
    }

    public Builder toBuilder() {
        Builder b = new Builder(vulnClass, source, url)
                .severity(severity)
                .confidence(confidence)
                .evidence(evidence)
                .detail(detail)
                .remediation(remediation)
                .payload(payload)
                .parameter(parameter)
                .requestResponse(requestResponse)
                .timestamp(timestamp);
        b.sourceRequestIds.addAll(sourceRequestIds);
        return b;
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + getName() + " @ " + baseUrl
                + (parameter.isEmpty() ? "" : " param=" + parameter);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Finding finding = (Finding) o;
        return vulnClass == finding.vulnClass && source == finding.source && baseUrl.equals(finding.baseUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vulnClass, source, baseUrl);
    }

    public static class Builder {
        private final VulnClass vulnClass;
        private final FindingSource source;
        private final String url;
        private Severity severity;
        private Confidence confidence;
        private String evidence = "";
        private String detail = "";
        private String remediation = "";
        private String payload = "";
        private String parameter = "";
        private final List<String> sourceRequestIds = new ArrayList<>();
        private HttpRequestResponse requestResponse;
        private long timestamp = System.currentTimeMillis();

        private Builder(VulnClass vulnClass, FindingSource source, String url) {
            this.vulnClass = vulnClass;
            this.source = source;
            this.url = url;
        }

        public Builder severity(Severity s) { this.severity = s; return this; }
        public Builder confidence(Confidence c) { this.confidence = c; return this; }
        public Builder evidence(String e) { this.evidence = e != null ? e : ""; return this; }
        public Builder detail(String d) { this.detail = d != null ? d : ""; return this; }
        public Builder remediation(String r) { this.remediation = r != null ? r : ""; return this; }
        public Builder payload(String p) { this.payload = p != null ? p : ""; return this; }
        public Builder parameter(String p) { this.parameter = p != null ? p : ""; return this; }
        public Builder sourceRequestId(String id) {
            if (id != null && !id.isEmpty()) sourceRequestIds.add(id);
            return this;
        }
        public Builder requestResponse(HttpRequestResponse rr) { this.requestResponse = rr; return this; }
        public Builder timestamp(long t) { this.timestamp = t; return this; }

        public Finding build() {
            return new Finding(this);
        }
    }
}
