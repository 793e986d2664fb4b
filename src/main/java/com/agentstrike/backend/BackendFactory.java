package com.agentstrike.backend;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds backends from their configuration. The variant is chosen by
 * {@link BackendConfig#kind()} only.
 */
public final class BackendFactory {

    public static final String DEFAULT_OLLAMA_URL = "http://127.0.0.1:11434";
    public static final String DEFAULT_OLLAMA_MODEL = "llama3.1";
    public static final String DEFAULT_LMSTUDIO_URL = "http://127.0.0.1:1234/v1";
    public static final String DEFAULT_OPENAI_URL = "https://api.openai.com/v1";
    public static final String DEFAULT_OPENAI_MODEL = "gpt-4o-mini";

    private BackendFactory() {}

    public static AiBackend create(BackendConfig config) {
        return switch (config.kind()) {
            case CLI -> new CliBackend(config);
            case LOCAL_HTTP -> new LocalHttpBackend(config);
            case GENERIC_HTTP -> new OpenAiCompatibleBackend(config);
        };
    }

    /** Registers one backend per config, later configs replacing earlier ones with the same id. */
    public static BackendRegistry createRegistry(List<BackendConfig> configs) {
        BackendRegistry registry = new BackendRegistry();
        for (BackendConfig config : configs) {
            registry.register(create(config));
        }
        return registry;
    }

    /** Bundled backends: the four CLI presets, a local Ollama, LM Studio and OpenAI. */
    public static List<BackendConfig> defaultConfigs() {
        List<BackendConfig> configs = new ArrayList<>();
        for (CliProvider provider : CliProvider.values()) {
            configs.add(BackendConfig.cli(provider, null));
        }
        configs.add(BackendConfig.localHttp("ollama", DEFAULT_OLLAMA_URL, DEFAULT_OLLAMA_MODEL));
        configs.add(BackendConfig.genericHttp("lmstudio", DEFAULT_LMSTUDIO_URL, ""));
        configs.add(BackendConfig.genericHttp("openai", DEFAULT_OPENAI_URL, DEFAULT_OPENAI_MODEL));
        return configs;
    }
}
