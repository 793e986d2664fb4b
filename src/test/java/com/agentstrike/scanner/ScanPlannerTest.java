package com.agentstrike.scanner;

import com.agentstrike.model.PayloadRisk;
import com.agentstrike.model.VulnClass;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScanPlannerTest {

    private final PayloadLibrary library = new PayloadLibrary();
    private final ScanPlanner planner = new ScanPlanner(library);

    private static final InjectionPoint ID = new InjectionPoint("id", InjectionType.URL_PARAM, "1");
    private static final InjectionPoint NAME = new InjectionPoint("name", InjectionType.BODY_PARAM, "bob");

    @Test
    void safe_ceiling_keeps_only_safe_payloads_and_counts_the_rest() {
        ScanPlanner.Plan plan = planner.plan(List.of(ID), List.of(VulnClass.SQLI), PayloadRisk.SAFE, 10, false);

        assertEquals(5, plan.probes().size());
        assertEquals(8, plan.skippedByRisk());
        assertEquals(0, plan.skippedNoOob());
        assertTrue(plan.probes().stream().allMatch(p -> p.payload().risk() == PayloadRisk.SAFE));
    }

    @Test
    void moderate_ceiling_admits_moderate_payloads() {
        ScanPlanner.Plan plan = planner.plan(List.of(ID), List.of(VulnClass.SQLI), PayloadRisk.MODERATE, 10, false);

        assertEquals(9, plan.probes().size());
        assertEquals(4, plan.skippedByRisk());
    }

    @Test
    void oob_payloads_are_counted_separately_when_oob_is_unavailable() {
        ScanPlanner.Plan without = planner.plan(List.of(ID), List.of(VulnClass.SQLI), PayloadRisk.DANGEROUS, 20, false);
        assertEquals(0, without.skippedByRisk());
        assertEquals(1, without.skippedNoOob());
        assertEquals(12, without.probes().size());
        assertTrue(without.probes().stream().noneMatch(p -> p.payload().oob()));

        ScanPlanner.Plan with = planner.plan(List.of(ID), List.of(VulnClass.SQLI), PayloadRisk.DANGEROUS, 20, true);
        assertEquals(0, with.skippedNoOob());
        assertEquals(13, with.probes().size());
    }

    @Test
    void risk_is_checked_before_oob() {
        // The only SQLI OOB payload is DANGEROUS, so a SAFE plan reports it as a risk skip
        ScanPlanner.Plan plan = planner.plan(List.of(ID), List.of(VulnClass.SQLI), PayloadRisk.SAFE, 10, false);
        assertEquals(0, plan.skippedNoOob());
    }

    @Test
    void max_payloads_applies_per_point_and_class() {
        ScanPlanner.Plan plan = planner.plan(List.of(ID, NAME), List.of(VulnClass.SQLI, VulnClass.SSTI),
                PayloadRisk.SAFE, 2, false);

        assertEquals(8, plan.probes().size());
        // Capped payloads are neither risk nor OOB skips
        assertEquals(2 * (8 + 5), plan.skippedByRisk());
    }

    @Test
    void probes_are_ordered_point_then_class_then_payload() {
        ScanPlanner.Plan plan = planner.plan(List.of(ID, NAME), List.of(VulnClass.SQLI, VulnClass.SSTI),
                PayloadRisk.SAFE, 2, false);

        List<PlannedProbe> p = plan.probes();
        assertEquals(ID, p.get(0).point());
        assertEquals(VulnClass.SQLI, p.get(0).vulnClass());
        assertEquals("'", p.get(0).payload().value());
        assertEquals("\"", p.get(1).payload().value());
        assertEquals(VulnClass.SSTI, p.get(2).vulnClass());
        assertEquals("{{7*7}}", p.get(2).payload().value());
        assertEquals(ID, p.get(3).point());
        assertEquals(NAME, p.get(4).point());
        assertEquals(VulnClass.SQLI, p.get(4).vulnClass());
    }

    @Test
    void planning_is_deterministic() {
        ScanPlanner.Plan a = planner.plan(List.of(ID, NAME), List.of(VulnClass.CMDI, VulnClass.SSRF),
                PayloadRisk.MODERATE, 3, false);
        ScanPlanner.Plan b = planner.plan(List.of(ID, NAME), List.of(VulnClass.CMDI, VulnClass.SSRF),
                PayloadRisk.MODERATE, 3, false);
        assertEquals(a, b);
    }

    @Test
    void class_without_payloads_plans_nothing() {
        ScanPlanner.Plan plan = planner.plan(List.of(ID), Set.of(VulnClass.CLICKJACKING), PayloadRisk.DANGEROUS, 10, true);
        assertTrue(plan.probes().isEmpty());
        assertEquals(0, plan.skippedByRisk());
        assertFalse(library.hasPayloads(VulnClass.CLICKJACKING));
    }

    @Test
    void risk_gate_refuses_payloads_over_the_ceiling() {
        Payload dangerous = Payload.of(VulnClass.CMDI, ";id", PayloadRisk.DANGEROUS);
        Payload safe = Payload.of(VulnClass.CMDI, "$(echo agstr)", PayloadRisk.SAFE);

        assertTrue(RiskGate.permits(safe, PayloadRisk.SAFE));
        assertTrue(RiskGate.permits(dangerous, PayloadRisk.DANGEROUS));
        assertFalse(RiskGate.permits(dangerous, PayloadRisk.MODERATE));

        PolicyViolationException e = assertThrows(PolicyViolationException.class,
                () -> RiskGate.check(dangerous, PayloadRisk.MODERATE));
        assertEquals(PolicyViolationException.Kind.RISK_EXCEEDED, e.getKind());
        assertTrue(e.getMessage().contains("CMDI"), e.getMessage());
    }

    @Test
    void oob_placeholder_is_detected_and_substituted() {
        Payload p = Payload.of(VulnClass.SSRF, "http://{OOB}/", PayloadRisk.MODERATE);
        assertTrue(p.oob());
        assertEquals("http://abc.collab.test/", p.withOobHost("abc.collab.test"));
        assertFalse(Payload.of(VulnClass.SSRF, "http://127.0.0.1/", PayloadRisk.MODERATE).oob());
    }
}
