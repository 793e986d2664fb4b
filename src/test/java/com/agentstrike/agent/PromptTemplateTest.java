package com.agentstrike.agent;

import com.agentstrike.config.ConfigException;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PromptTemplateTest {

    @Test
    void render_substitutes_known_and_blanks_unknown() {
        PromptTemplate t = new PromptTemplate("t", 1, "Hi ${name}, see ${missing}. Cost: $5 ${name}");
        assertEquals("Hi Ann, see . Cost: $5 Ann", t.render(Map.of("name", "Ann")));
        assertEquals(Set.of("name", "missing"), t.placeholders());
    }

    @Test
    void replacement_text_is_literal() {
        PromptTemplate t = new PromptTemplate("t", 1, "v=${v}");
        assertEquals("v=$1 \\n ${x}", t.render(Map.of("v", "$1 \\n ${x}")));
    }

    @Test
    void bundled_profiles_bind_every_standard_action() {
        ProfileRegistry profiles = new ProfileRegistry();
        TemplateRegistry templates = new TemplateRegistry();
        for (String id : profiles.ids()) {
            AgentProfile p = profiles.require(id);
            for (String action : new String[]{AgentProfile.ACTION_PASSIVE, AgentProfile.ACTION_ACTIVE,
                    AgentProfile.ACTION_ANALYZE, AgentProfile.ACTION_EXPLAIN, AgentProfile.ACTION_CHAT}) {
                String templateId = p.templateFor(action).orElseThrow();
                assertNotNull(templates.require(templateId));
            }
        }
        assertTrue(templates.require(TemplateRegistry.ACTIVE_VERIFY).placeholders()
                .containsAll(Set.of("vulnClass", "payload", "injectionPoint")));
    }

    @Test
    void unknown_active_profile_keeps_the_previous_one() {
        ProfileRegistry profiles = new ProfileRegistry();
        profiles.setActiveProfile(ProfileRegistry.AUDITOR);
        assertThrows(ConfigException.class, () -> profiles.setActiveProfile("ghost"));
        assertEquals(ProfileRegistry.AUDITOR, profiles.getActiveProfile().id());
    }

    @Test
    void unknown_template_is_a_config_error() {
        ConfigException e = assertThrows(ConfigException.class, () -> new TemplateRegistry().require("nope"));
        assertEquals(ConfigException.Kind.MISSING_TEMPLATE, e.getKind());
    }
}
