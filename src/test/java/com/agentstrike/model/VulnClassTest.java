package com.agentstrike.model;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VulnClassTest {

    @Test
    void sixty_two_classes_plus_other() {
        assertEquals(63, VulnClass.values().length);
        assertEquals(62, VulnClass.scannable().size());
        assertFalse(VulnClass.scannable().contains(VulnClass.OTHER));
    }

    @Test
    void labels_normalize_by_tag_display_name_and_alias() {
        assertEquals(VulnClass.SQLI, VulnClass.fromLabel("SQLI"));
        assertEquals(VulnClass.SQLI, VulnClass.fromLabel("sql injection"));
        assertEquals(VulnClass.XSS_REFLECTED, VulnClass.fromLabel("Reflected Cross-Site Scripting"));
        assertEquals(VulnClass.XSS_STORED, VulnClass.fromLabel("xss stored"));
        assertEquals(VulnClass.CMDI, VulnClass.fromLabel("Remote Code Execution"));
        assertEquals(VulnClass.SSRF, VulnClass.fromLabel("Possible SSRF via url parameter"));
        assertEquals(VulnClass.XSS_STORED, VulnClass.fromLabel("likely stored xss in comments"));
    }

    @Test
    void unknown_labels_map_to_other() {
        assertEquals(VulnClass.OTHER, VulnClass.fromLabel("quantum flux leak"));
        assertEquals(VulnClass.OTHER, VulnClass.fromLabel(""));
        assertEquals(VulnClass.OTHER, VulnClass.fromLabel(null));
        // alias must match on word boundaries
        assertEquals(VulnClass.OTHER, VulnClass.fromLabel("mysqlish behaviour"));
    }

    @Test
    void parse_list_ignores_unknown_entries() {
        assertEquals(Set.of(VulnClass.SQLI, VulnClass.SSTI, VulnClass.XXE),
                VulnClass.parseList("sqli, ssti ,, nonsense, xxe"));
        assertTrue(VulnClass.parseList(null).isEmpty());
    }

    @Test
    void scan_modes_nest_by_risk_ceiling() {
        assertEquals(PayloadRisk.SAFE, ScanMode.BUG_BOUNTY.getDefaultCeiling());
        assertEquals(PayloadRisk.MODERATE, ScanMode.PENTEST.getDefaultCeiling());
        assertEquals(PayloadRisk.DANGEROUS, ScanMode.FULL.getDefaultCeiling());
        assertEquals(VulnClass.scannable(), ScanMode.FULL.getDefaultClasses());
        assertEquals(ScanMode.BUG_BOUNTY, ScanMode.fromString("bug-bounty", ScanMode.FULL));
        assertEquals(ScanMode.PENTEST, ScanMode.fromString("???", ScanMode.PENTEST));
    }

    @Test
    void severity_and_confidence_parsing() {
        assertEquals(Severity.MEDIUM, Severity.fromString("moderate", Severity.INFO));
        assertEquals(Severity.LOW, Severity.fromString("bogus", Severity.LOW));
        assertTrue(Severity.CRITICAL.isHigherThan(Severity.HIGH));
        assertEquals("HIGH", Severity.CRITICAL.toBurpSeverity());
        assertEquals(Confidence.CERTAIN, Confidence.fromScore(90));
        assertEquals(Confidence.FIRM, Confidence.fromScore(60));
        assertEquals(Confidence.TENTATIVE, Confidence.fromScore(59));
    }
}
