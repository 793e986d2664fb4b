package com.agentstrike.scanner;

import com.agentstrike.model.Confidence;
import com.agentstrike.model.Finding;
import com.agentstrike.model.FindingSource;
import com.agentstrike.model.PayloadRisk;
import com.agentstrike.model.Severity;
import com.agentstrike.model.TrafficContext;
import com.agentstrike.model.VulnClass;
import com.google.gson.JsonPrimitive;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FindingConsolidatorTest {

    private final FindingConsolidator consolidator = new FindingConsolidator();

    private static TrafficContext traffic() {
        return TrafficContext.builder("https://app.example.com/search?q=shoes")
                .requestId("req-42")
                .statusCode(200)
                .responseBody("<html>results</html>")
                .build();
    }

    // ==================== extractJson ====================

    @Test
    void extracts_json_fence_before_anything_else() {
        String text = "Here you go:\n```json\n{\"findings\": []}\n```\nand {\"other\": 1}";
        assertEquals("{\"findings\": []}", FindingConsolidator.extractJson(text));
    }

    @Test
    void extracts_generic_fence_only_when_it_holds_an_object() {
        assertEquals("{\"a\": 1}", FindingConsolidator.extractJson("```\n{\"a\": 1}\n```"));
        assertEquals("{\"b\": 2}", FindingConsolidator.extractJson("```\nnot json\n```\nthen {\"b\": 2}"));
    }

    @Test
    void brace_matching_ignores_braces_inside_strings() {
        String text = "Sure! {\"vulnerable\": false, \"evidence\": \"saw } and \\\" in body\"} done";
        assertEquals("{\"vulnerable\": false, \"evidence\": \"saw } and \\\" in body\"}",
                FindingConsolidator.extractJson(text));
    }

    @Test
    void no_json_gives_null() {
        assertNull(FindingConsolidator.extractJson("I could not find anything."));
        assertNull(FindingConsolidator.extractJson(null));
        assertNull(FindingConsolidator.extractJson("{ unbalanced"));
    }

    // ==================== confidenceScore ====================

    @Test
    void confidence_accepts_numbers_fractions_percentages_and_words() {
        assertEquals(85, FindingConsolidator.confidenceScore(new JsonPrimitive(0.85)));
        assertEquals(90, FindingConsolidator.confidenceScore(new JsonPrimitive("90%")));
        assertEquals(70, FindingConsolidator.confidenceScore(new JsonPrimitive("70")));
        assertEquals(75, FindingConsolidator.confidenceScore(new JsonPrimitive("High")));
        assertEquals(95, FindingConsolidator.confidenceScore(new JsonPrimitive("certain")));
        assertEquals(30, FindingConsolidator.confidenceScore(new JsonPrimitive("tentative")));
        assertEquals(1, FindingConsolidator.confidenceScore(new JsonPrimitive(1)));
    }

    @Test
    void confidence_is_clamped_and_missing_is_zero() {
        assertEquals(100, FindingConsolidator.confidenceScore(new JsonPrimitive(150)));
        assertEquals(0, FindingConsolidator.confidenceScore(new JsonPrimitive(-5)));
        assertEquals(0, FindingConsolidator.confidenceScore(null));
        assertEquals(0, FindingConsolidator.confidenceScore(new JsonPrimitive("somewhat")));
    }

    // ==================== parsePassive ====================

    @Test
    void parses_passive_findings_and_drops_low_confidence() {
        String raw = "```json\n{\"findings\": ["
                + "{\"class\": \"SQL Injection\", \"severity\": \"HIGH\", \"confidence\": 92,"
                + " \"evidence\": \"You have an error in your SQL syntax\", \"description\": \"DB error\","
                + " \"remediation\": \"Use prepared statements\"},"
                + "{\"class\": \"Clickjacking\", \"confidence\": 20}"
                + "]}\n```";

        List<Finding> findings = consolidator.parsePassive(raw, traffic(), 50);

        assertEquals(1, findings.size());
        Finding f = findings.get(0);
        assertEquals(VulnClass.SQLI, f.getVulnClass());
        assertEquals(FindingSource.PASSIVE, f.getSource());
        assertEquals("[AI Passive] SQLI", f.getName());
        assertEquals(Severity.HIGH, f.getSeverity());
        assertEquals(Confidence.CERTAIN, f.getConfidence());
        assertEquals("Use prepared statements", f.getRemediation());
        assertEquals("req-42", f.getSourceRequestId());
        assertEquals("https://app.example.com/search", f.getBaseUrl());
    }

    @Test
    void unknown_labels_become_other_and_keep_the_reported_name() {
        String raw = "{\"findings\": [{\"class\": \"Quantum Flux Leak\", \"confidence\": \"high\","
                + " \"description\": \"Odd header\"}]}";

        List<Finding> findings = consolidator.parsePassive(raw, traffic(), 50);

        assertEquals(1, findings.size());
        assertEquals(VulnClass.OTHER, findings.get(0).getVulnClass());
        assertEquals("Reported as: Quantum Flux Leak\nOdd header", findings.get(0).getDetail());
        assertEquals(Severity.INFO, findings.get(0).getSeverity());
        assertEquals(Confidence.FIRM, findings.get(0).getConfidence());
    }

    @Test
    void title_is_used_when_class_is_missing() {
        String raw = "{\"findings\": [{\"title\": \"Reflected XSS in q\", \"confidence\": 80}]}";
        List<Finding> findings = consolidator.parsePassive(raw, traffic(), 0);
        assertEquals(VulnClass.XSS_REFLECTED, findings.get(0).getVulnClass());
    }

    @Test
    void malformed_passive_output_is_dropped_and_logged() {
        List<String> errors = new ArrayList<>();
        consolidator.setErrorLogger(errors::add);

        assertTrue(consolidator.parsePassive("no findings here", traffic(), 0).isEmpty());
        assertTrue(consolidator.parsePassive("{\"findings\": \"none\"}", traffic(), 0).isEmpty());
        assertTrue(consolidator.parsePassive("{\"findings\": [1, 2]}", traffic(), 0).isEmpty());
        assertTrue(consolidator.parsePassive("{\"findings\": [{\"class\": }]}", traffic(), 0).isEmpty());

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("[Consolidator]"), errors.get(0));
    }

    // ==================== parseVerdict ====================

    @Test
    void verdict_accepts_boolean_and_yes_strings() {
        Optional<FindingConsolidator.Verdict> yes = consolidator.parseVerdict(
                "Analysis done. {\"vulnerable\": \"yes\", \"confidence\": \"high\", \"evidence\": \"49 rendered\"}");
        assertTrue(yes.isPresent());
        assertTrue(yes.get().vulnerable());
        assertEquals(75, yes.get().confidence());
        assertEquals("49 rendered", yes.get().evidence());
        assertNull(yes.get().severity());

        Optional<FindingConsolidator.Verdict> no = consolidator.parseVerdict(
                "{\"vulnerable\": false, \"confidence\": 10, \"severity\": \"LOW\"}");
        assertFalse(no.get().vulnerable());
        assertEquals(Severity.LOW, no.get().severity());
    }

    @Test
    void verdict_without_vulnerable_field_or_json_is_empty() {
        assertTrue(consolidator.parseVerdict("{\"confidence\": 90}").isEmpty());
        assertTrue(consolidator.parseVerdict("garbage").isEmpty());
        assertTrue(consolidator.parseVerdict(null).isEmpty());
    }

    @Test
    void active_finding_records_payload_and_parameter() {
        PlannedProbe probe = new PlannedProbe(new InjectionPoint("q", InjectionType.URL_PARAM, "shoes"),
                Payload.of(VulnClass.SSTI, "{{7*7}}", PayloadRisk.SAFE));
        FindingConsolidator.Verdict verdict = new FindingConsolidator.Verdict(true, 93, "49 in body", null);

        Finding f = consolidator.activeFinding(verdict, probe, traffic(), "{{7*7}}");

        assertEquals("[AI Active] SSTI", f.getName());
        assertEquals(Severity.HIGH, f.getSeverity());
        assertEquals(Confidence.CERTAIN, f.getConfidence());
        assertEquals("q", f.getParameter());
        assertEquals("{{7*7}}", f.getPayload());
        assertTrue(f.getDetail().contains("URL_PARAM 'q'"), f.getDetail());
    }

    // ==================== consolidate ====================

    @Test
    void consolidate_merges_same_issue_and_base_url() {
        Finding first = Finding.builder(VulnClass.SQLI, FindingSource.PASSIVE, "https://app.example.com/a?id=1")
                .severity(Severity.MEDIUM).confidence(Confidence.TENTATIVE).evidence("error 1")
                .sourceRequestId("r1").build();
        Finding second = Finding.builder(VulnClass.SQLI, FindingSource.PASSIVE, "https://APP.example.com:443/a?id=2")
                .severity(Severity.HIGH).confidence(Confidence.FIRM).evidence("error 2")
                .sourceRequestId("r2").build();
        Finding other = Finding.builder(VulnClass.XSS_REFLECTED, FindingSource.PASSIVE, "https://app.example.com/a")
                .build();
        Finding confirmed = Finding.builder(VulnClass.SQLI, FindingSource.ACTIVE, "https://app.example.com/a?id=3")
                .confidence(Confidence.CERTAIN).build();

        List<Finding> merged = FindingConsolidator.consolidate(List.of(first, second, other, confirmed));

        assertEquals(3, merged.size());
        assertEquals(Confidence.CERTAIN, merged.get(2).getConfidence());
        Finding sqli = merged.get(0);
        assertEquals(FindingSource.PASSIVE, sqli.getSource());
        assertEquals(Severity.HIGH, sqli.getSeverity());
        assertEquals(Confidence.FIRM, sqli.getConfidence());
        assertEquals("error 1\n---\nerror 2", sqli.getEvidence());
        assertEquals(List.of("r1", "r2"), sqli.getSourceRequestIds());
    }
}
