package com.agentstrike.framework;

import burp.api.montoya.MontoyaApi;
import burp.api.montoya.collaborator.CollaboratorClient;
import burp.api.montoya.collaborator.CollaboratorPayload;
import burp.api.montoya.collaborator.Interaction;
import burp.api.montoya.collaborator.SecretKey;
import com.agentstrike.scanner.OobService;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Burp Collaborator behind {@link OobService}. Tokens are Collaborator payloads;
 * a background poller marks tokens whose interactions have arrived.
 * Requires Burp Suite Professional.
 */
public class CollaboratorOobService implements OobService {

    private static final String SECRET_KEY = "agentstrike_collab_key";

    private final MontoyaApi api;
    private volatile CollaboratorClient client;
    private ScheduledExecutorService poller;
    private volatile boolean available = false;
    private volatile int tokenTtlMinutes = 10;
    private volatile Consumer<String> logger;
    private volatile Consumer<String> errorLogger;

    // token id -> registration time; removed on release or expiry
    private final ConcurrentHashMap<String, Long> pending = new ConcurrentHashMap<>();
    private final Map<String, Boolean> interacted = new ConcurrentHashMap<>();

    public CollaboratorOobService(MontoyaApi api) {
        this.api = api;
    }

    public void setLogger(Consumer<String> logger) { this.logger = logger; }
    public void setErrorLogger(Consumer<String> errorLogger) { this.errorLogger = errorLogger; }

    /**
     * Creates or restores the Collaborator client and starts polling.
     * Returns false when Collaborator is not available (Community edition).
     */
    public boolean initialize() {
        try {
            String savedKey = api.persistence().extensionData().getString(SECRET_KEY);
            if (savedKey != null) {
                client = api.collaborator().restoreClient(SecretKey.secretKey(savedKey));
                log("[Collaborator] Restored client from saved key");
            } else {
                client = api.collaborator().createClient();
                api.persistence().extensionData().setString(SECRET_KEY, client.getSecretKey().toString());
                log("[Collaborator] Created new client");
            }
            available = true;
            startPolling(5);
            return true;
        } catch (RuntimeException e) {
            logError("[Collaborator] Not available (Community edition?): " + e.getMessage());
            available = false;
            return false;
        }
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public Token register(String description) {
        CollaboratorClient c = client;
        if (!available || c == null) return null;
        try {
            CollaboratorPayload payload = c.generatePayload();
            String id = payload.id().toString();
            pending.put(id, System.currentTimeMillis());
            return new Token(id, payload.toString());
        } catch (RuntimeException e) {
            logError("[Collaborator] Failed to generate payload for " + description + ": " + e.getMessage());
            return null;
        }
    }

    @Override
    public boolean hasInteraction(String tokenId) {
        return interacted.containsKey(tokenId);
    }

    @Override
    public void release(String tokenId) {
        pending.remove(tokenId);
        interacted.remove(tokenId);
    }

    public int getPendingCount() {
        return pending.size();
    }

    public void setTokenTtlMinutes(int minutes) {
        this.tokenTtlMinutes = Math.max(1, minutes);
    }

    private void startPolling(int intervalSeconds) {
        poller = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "AgentStrike-CollabPoller");
            t.setDaemon(true);
            return t;
        });

        poller.scheduleAtFixedRate(this::poll, 0, intervalSeconds, TimeUnit.SECONDS);

        poller.scheduleAtFixedRate(() -> {
            try {
                long cutoff = System.currentTimeMillis() - tokenTtlMinutes * 60_000L;
                pending.entrySet().removeIf(e -> e.getValue() < cutoff);
                interacted.keySet().removeIf(id -> !pending.containsKey(id));
            } catch (RuntimeException e) {
                logError("[Collaborator] Cleanup error: " + e.getMessage());
            }
        }, 60, 60, TimeUnit.SECONDS);
    }

    private void poll() {
        try {
            CollaboratorClient c = client;
            if (c == null || pending.isEmpty()) return;
            List<Interaction> interactions = c.getAllInteractions();
            for (Interaction interaction : interactions) {
                String interactionId = interaction.id().toString();
                String matched = pending.containsKey(interactionId) ? interactionId : null;
                if (matched == null) {
                    // Burp may report the id with subdomain data attached
                    for (String key : pending.keySet()) {
                        if (interactionId.contains(key) || key.contains(interactionId)) {
                            matched = key;
                            break;
                        }
                    }
                }
                if (matched != null) {
                    interacted.put(matched, Boolean.TRUE);
                    log("[Collaborator] " + interaction.type() + " interaction from " + interaction.clientIp());
                }
            }
        } catch (RuntimeException e) {
            logError("[Collaborator] Polling error: " + e.getMessage());
        }
    }

    public void shutdown() {
        ScheduledExecutorService p = poller;
        if (p != null) {
            p.shutdown();
            try {
                p.awaitTermination(3, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                p.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        available = false;
        pending.clear();
        interacted.clear();
    }

    private void log(String msg) {
        Consumer<String> l = logger;
        if (l != null) l.accept(msg);
    }

    private void logError(String msg) {
        Consumer<String> l = errorLogger;
        if (l != null) l.accept(msg);
    }
}
