package com.agentstrike.agent;

import com.agentstrike.audit.AuditLogger;
import com.agentstrike.backend.AiBackend;
import com.agentstrike.backend.BackendException;
import com.agentstrike.backend.BackendRegistry;
import com.agentstrike.backend.DispatchRequest;
import com.agentstrike.backend.DispatchResult;
import com.agentstrike.config.AgentSettings;
import com.agentstrike.config.ConfigException;
import com.agentstrike.config.SettingsSource;
import com.agentstrike.framework.DispatchExecutor;
import com.agentstrike.model.TrafficContext;
import com.agentstrike.model.VulnClass;
import com.agentstrike.privacy.PrivacyFilter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Turns (profile, action, context) into a backend call: resolves the template,
 * privacy-filters the context, renders, selects the backend from the current
 * settings snapshot, audits, and dispatches on a bounded pool with timeout and retry.
 *
 * <p>Configuration errors ({@link ConfigException}) propagate to the caller.
 * Backend problems never do: they come back as a failed {@link DispatchResult}.</p>
 */
public class AgentSupervisor {

    public static final String FIXED_TIMESTAMP = "1970-01-01T00:00:00Z";
    public static final Duration GRACE = Duration.ofSeconds(2);

    private static final Set<String> BUILTIN_VARIABLES = Set.of(
            "role", "profile", "classes", "context", "url", "method", "metadata", "timestamp", "history");

    private final SettingsSource settings;
    private final BackendRegistry backends;
    private final ProfileRegistry profiles;
    private final TemplateRegistry templates;
    private final AuditLogger audit;
    private final DispatchExecutor pool;
    private final DispatchExecutor asyncCallers;
    private final SessionStore sessions = new SessionStore();

    private volatile Clock clock = Clock.systemUTC();
    private volatile Duration retryBackoff = Duration.ofMillis(500);
    private volatile Duration shutdownGrace = Duration.ofSeconds(5);
    private volatile Consumer<String> logger;
    private volatile Consumer<String> errorLogger;

    public AgentSupervisor(SettingsSource settings, BackendRegistry backends, ProfileRegistry profiles,
                           TemplateRegistry templates, AuditLogger audit) {
        this.settings = settings;
        this.backends = backends;
        this.profiles = profiles;
        this.templates = templates;
        this.audit = audit;
        int poolSize = settings.current().getSupervisorPoolSize();
        this.pool = new DispatchExecutor("Supervisor", poolSize, 500);
        this.asyncCallers = new DispatchExecutor("Supervisor-Async", poolSize, 1000);
    }

    public void setLogger(Consumer<String> logger) {
        this.logger = logger;
        pool.setLogger(logger);
        asyncCallers.setLogger(logger);
    }

    public void setErrorLogger(Consumer<String> errorLogger) { this.errorLogger = errorLogger; }
    public void setClock(Clock clock) { this.clock = clock; }

    /** Base delay between retries; attempt n waits n times this. */
    public void setRetryBackoff(Duration backoff) { this.retryBackoff = backoff; }

    public SessionStore sessions() { return sessions; }
    public ProfileRegistry profiles() { return profiles; }
    public BackendRegistry backends() { return backends; }

    /** Applies a changed pool size from the current snapshot. */
    public void applySettings() {
        int size = settings.current().getSupervisorPoolSize();
        pool.resize(size);
        asyncCallers.resize(size);
    }

    // ==================== Entry points ====================

    public DispatchResult run(String profileId, String actionId, TrafficContext context) {
        return run(profileId, actionId, context, DispatchOptions.DEFAULT);
    }

    public DispatchResult run(String profileId, String actionId, TrafficContext context, DispatchOptions options) {
        AgentSettings snapshot = settings.current();
        AgentProfile profile = profiles.require(profileId);
        return execute(snapshot, profile, actionId, context, null, options);
    }

    /**
     * Runs one chat turn. The session's history is rendered into the prompt and the
     * turn is appended once the backend answers successfully.
     *
     * @throws IllegalArgumentException when the session was not opened by this supervisor or is closed
     */
    public DispatchResult run(ChatSession session, String actionId, TrafficContext context) {
        if (!sessions.owns(session)) {
            throw new IllegalArgumentException("Session is not open in this supervisor");
        }
        AgentSettings snapshot = settings.current();
        AgentProfile profile = profiles.require(session.getProfileId());
        DispatchResult result = execute(snapshot, profile, actionId, context, session, DispatchOptions.DEFAULT);
        if (result.isSuccess()) {
            session.append(new ChatSession.Turn(userText(context, snapshot), result.getRawText()));
        }
        return result;
    }

    /**
     * Asynchronous variant. Configuration errors complete the future exceptionally;
     * a saturated pool completes it with a failed result.
     */
    public CompletableFuture<DispatchResult> runAsync(String profileId, String actionId, TrafficContext context) {
        CompletableFuture<DispatchResult> future = new CompletableFuture<>();
        Future<?> submitted = asyncCallers.submit(() -> {
            try {
                future.complete(run(profileId, actionId, context));
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        });
        if (submitted == null) {
            future.complete(DispatchResult.failure("", "", BackendException.ErrorType.UNAVAILABLE,
                    "Supervisor queue is full"));
        }
        return future;
    }

    /**
     * Renders the exact prompt that {@link #run} would send, after both privacy passes.
     */
    public String renderPrompt(String profileId, String actionId, TrafficContext context) {
        AgentSettings snapshot = settings.current();
        return render(snapshot, profiles.require(profileId), actionId, context, null);
    }

    // ==================== Pipeline ====================

    private DispatchResult execute(AgentSettings snapshot, AgentProfile profile, String actionId,
                                   TrafficContext context, ChatSession session, DispatchOptions options) {
        String prompt = render(snapshot, profile, actionId, context, session);

        String backendId = options.backendId() != null ? options.backendId() : snapshot.getBackendId();
        AiBackend backend = backends.require(backendId);
        Duration timeout = options.timeout() != null ? options.timeout() : snapshot.getDispatchTimeout();

        Map<String, String> details = new LinkedHashMap<>();
        details.put("profile", profile.id());
        details.put("action", actionId);
        if (context != null) details.put("sourceRequestId", context.getRequestId());

        DispatchRequest request = DispatchRequest.of(backend.id(), prompt, timeout);
        int maxRetries = snapshot.getMaxRetries();
        DispatchResult result = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                if (!sleepBackoff(attempt)) break;
                log("[Supervisor] Retrying " + request.requestId() + " on " + backend.id()
                        + " (attempt " + (attempt + 1) + ", previous: " + result.outcome() + ")");
            }
            Map<String, String> attemptDetails = new LinkedHashMap<>(details);
            attemptDetails.put("attempt", String.valueOf(attempt + 1));
            result = dispatchOnce(backend, request, attemptDetails);
            if (result.isSuccess() || !isRetryable(result)) break;
        }
        if (!result.isSuccess()) {
            logError("[Supervisor] " + actionId + " via " + backend.id() + " failed: "
                    + result.getErrorKind() + " " + result.getErrorMessage());
        }
        return result;
    }

    private DispatchResult dispatchOnce(AiBackend backend, DispatchRequest request, Map<String, String> details) {
        audit.dispatchStart(request.requestId(), backend.id(), request.prompt(), details);
        long start = System.nanoTime();
        DispatchResult result;

        Future<DispatchResult> future = pool.submit(() -> backend.invoke(request));
        if (future == null) {
            result = DispatchResult.failure(request.requestId(), backend.id(),
                    BackendException.ErrorType.UNAVAILABLE, "Supervisor pool saturated");
        } else {
            try {
                result = future.get(request.timeout().plus(GRACE).toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                result = DispatchResult.failure(request, new BackendException(BackendException.ErrorType.TIMEOUT,
                        backend.id() + " did not answer within " + request.timeout().toSeconds() + "s"),
                        Duration.ofNanos(System.nanoTime() - start));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                result = DispatchResult.failure(request, new BackendException(BackendException.ErrorType.PROTOCOL_ERROR,
                        backend.id() + " failed: " + cause, cause), Duration.ofNanos(System.nanoTime() - start));
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                result = DispatchResult.failure(request, new BackendException(BackendException.ErrorType.TIMEOUT,
                        "Dispatch interrupted"), Duration.ofNanos(System.nanoTime() - start));
            }
        }
        audit.dispatchEnd(result, request.prompt(), details);
        return result;
    }

    /** UNAVAILABLE, or TIMEOUT that produced nothing; auth and protocol errors are final. */
    static boolean isRetryable(DispatchResult result) {
        BackendException.ErrorType kind = result.getErrorKind();
        if (kind == BackendException.ErrorType.UNAVAILABLE) return true;
        return kind == BackendException.ErrorType.TIMEOUT && result.getRawText().isBlank();
    }

    private boolean sleepBackoff(int attempt) {
        long millis = retryBackoff.toMillis() * attempt;
        if (millis <= 0) return true;
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ==================== Rendering ====================

    private String render(AgentSettings snapshot, AgentProfile profile, String actionId,
                          TrafficContext context, ChatSession session) {
        String templateId = profile.templateFor(actionId).orElseThrow(() ->
                new ConfigException(ConfigException.Kind.MISSING_TEMPLATE,
                        "Profile '" + profile.id() + "' has no template for action '" + actionId + "'"));
        PromptTemplate template = templates.require(templateId);

        PrivacyFilter filter = PrivacyFilter.from(snapshot);
        TrafficContext filtered = filter.apply(context);
        boolean deterministic = snapshot.isDeterminismMode();

        Map<String, String> vars = new HashMap<>();
        if (filtered != null) {
            for (Map.Entry<String, String> e : filtered.getMetadata().entrySet()) {
                if (!BUILTIN_VARIABLES.contains(e.getKey())) vars.put(e.getKey(), e.getValue());
            }
        }
        vars.put("role", profile.role().getPersona());
        vars.put("profile", profile.id());
        vars.put("classes", profile.enabledClasses().stream().map(VulnClass::tag).collect(Collectors.joining(", ")));
        vars.put("context", filtered != null ? filtered.toPromptText() : "(no traffic context)");
        vars.put("url", filtered != null ? filtered.getUrl() : "");
        vars.put("method", filtered != null ? filtered.getMethod() : "");
        vars.put("metadata", filtered != null ? renderMetadata(filtered.getMetadata(), deterministic) : "");
        vars.put("timestamp", deterministic ? FIXED_TIMESTAMP : Instant.now(clock).toString());
        vars.put("history", session != null ? session.renderHistory(snapshot.getMaxSessionTurns()) : "");

        String rendered = template.render(vars);
        List<String> extraHosts = new ArrayList<>();
        if (context != null && !context.host().isEmpty()) extraHosts.add(context.host());
        return filter.redactText(rendered, extraHosts);
    }

    static String renderMetadata(Map<String, String> metadata, boolean sorted) {
        if (metadata.isEmpty()) return "";
        List<String> keys = new ArrayList<>(metadata.keySet());
        if (sorted) keys.sort(null);
        StringBuilder sb = new StringBuilder("Context notes:\n");
        for (String k : keys) {
            sb.append("- ").append(k).append(": ").append(metadata.get(k)).append("\n");
        }
        return sb.toString();
    }

    private static String userText(TrafficContext context, AgentSettings snapshot) {
        if (context == null) return "";
        String message = context.getMetadata().get("message");
        if (message != null && !message.isBlank()) {
            return PrivacyFilter.from(snapshot).redactText(message, List.of(context.host()));
        }
        return context.getMethod() + " " + PrivacyFilter.from(snapshot).apply(context).getUrl();
    }

    // ==================== Lifecycle ====================

    /** How long each pool may drain on shutdown before running tasks are interrupted. */
    public void setShutdownGrace(Duration grace) { this.shutdownGrace = grace; }

    /** Timed drain, then forced interrupt. Never throws. */
    public void shutdown() {
        try {
            asyncCallers.shutdown(shutdownGrace);
            pool.shutdown(shutdownGrace);
            sessions.clear();
        } catch (RuntimeException e) {
            logError("[Supervisor] Error during shutdown: " + e.getMessage());
        }
    }

    public DispatchExecutor getPool() { return pool; }

    private void log(String msg) {
        Consumer<String> l = logger;
        if (l != null) l.accept(msg);
    }

    private void logError(String msg) {
        Consumer<String> l = errorLogger;
        if (l != null) l.accept(msg);
    }
}
