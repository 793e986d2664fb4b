package com.agentstrike.config;

import com.agentstrike.backend.BackendConfig;
import com.agentstrike.backend.BackendFactory;
import com.agentstrike.backend.BackendKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Derives backend configs from environment variables on top of the bundled defaults.
 *
 * <ul>
 *   <li>{@code AGENTSTRIKE_OLLAMA_URL} overrides the local Ollama base URL</li>
 *   <li>{@code AGENTSTRIKE_OPENAI_URL} / {@code AGENTSTRIKE_OPENAI_KEY} override the OpenAI backend</li>
 *   <li>{@code AGENTSTRIKE_TOOL_SERVER_URL} adds an OpenAI-compatible backend with id
 *       {@code AGENTSTRIKE_TOOL_SERVER_ID} (default "tool-server") and bearer
 *       {@code AGENTSTRIKE_TOOL_TOKEN}</li>
 * </ul>
 */
public final class EnvironmentDiscovery {

    public static final String OLLAMA_URL = "AGENTSTRIKE_OLLAMA_URL";
    public static final String OPENAI_URL = "AGENTSTRIKE_OPENAI_URL";
    public static final String OPENAI_KEY = "AGENTSTRIKE_OPENAI_KEY";
    public static final String TOOL_SERVER_URL = "AGENTSTRIKE_TOOL_SERVER_URL";
    public static final String TOOL_SERVER_ID = "AGENTSTRIKE_TOOL_SERVER_ID";
    public static final String TOOL_TOKEN = "AGENTSTRIKE_TOOL_TOKEN";

    public static final String DEFAULT_TOOL_SERVER_ID = "tool-server";

    private EnvironmentDiscovery() {}

    public static List<BackendConfig> discoverBackends() {
        return discoverBackends(System.getenv());
    }

    public static List<BackendConfig> discoverBackends(Map<String, String> env) {
        List<BackendConfig> configs = new ArrayList<>();
        String ollamaUrl = value(env, OLLAMA_URL);
        String openAiUrl = value(env, OPENAI_URL);
        String openAiKey = value(env, OPENAI_KEY);

        for (BackendConfig config : BackendFactory.defaultConfigs()) {
            BackendConfig c = config;
            if ("ollama".equals(c.id()) && ollamaUrl != null) {
                c = c.withBaseUrl(ollamaUrl);
            } else if ("openai".equals(c.id())) {
                if (openAiUrl != null) c = c.withBaseUrl(openAiUrl);
                if (openAiKey != null) c = c.withApiKey(openAiKey);
            }
            configs.add(c);
        }

        String toolUrl = value(env, TOOL_SERVER_URL);
        if (toolUrl != null) {
            String id = value(env, TOOL_SERVER_ID);
            BackendConfig tool = new BackendConfig(id != null ? id : DEFAULT_TOOL_SERVER_ID,
                    BackendKind.GENERIC_HTTP, null, toolUrl, null, value(env, TOOL_TOKEN), null, null);
            configs.add(tool);
        }
        return configs;
    }

    private static String value(Map<String, String> env, String key) {
        String v = env.get(key);
        return v != null && !v.isBlank() ? v.trim() : null;
    }
}
