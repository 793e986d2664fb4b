package com.agentstrike.backend;

import com.agentstrike.config.ConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registered backends by id. Populated at startup and read concurrently
 * by dispatch threads afterwards.
 */
public class BackendRegistry {

    // synchronizedMap over LinkedHashMap keeps registration order for diagnostics
    private final Map<String, AiBackend> backends = Collections.synchronizedMap(new LinkedHashMap<>());

    /** Registers a backend, replacing any backend with the same id. */
    public void register(AiBackend backend) {
        backends.put(backend.id(), backend);
    }

    public void unregister(String id) {
        backends.remove(id);
    }

    public Optional<AiBackend> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(backends.get(id));
    }

    /**
     * @throws ConfigException UNKNOWN_BACKEND when no backend has this id
     */
    public AiBackend require(String id) {
        AiBackend backend = id == null ? null : backends.get(id);
        if (backend == null) {
            throw new ConfigException(ConfigException.Kind.UNKNOWN_BACKEND,
                    "Unknown backend '" + id + "'. Registered: " + listBackendIds());
        }
        return backend;
    }

    public List<String> listBackendIds() {
        synchronized (backends) {
            return new ArrayList<>(backends.keySet());
        }
    }

    public List<AiBackend> all() {
        synchronized (backends) {
            return new ArrayList<>(backends.values());
        }
    }

    /** One line per backend: description plus a live availability probe. */
    public List<String> diagnostics() {
        List<String> lines = new ArrayList<>();
        for (AiBackend backend : all()) {
            lines.add(backend.describe() + " [" + (backend.isAvailable() ? "available" : "unavailable") + "]");
        }
        return lines;
    }

    public int size() {
        return backends.size();
    }
}
