package com.agentstrike.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open chat sessions keyed by id.
 */
public class SessionStore {

    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();

    public ChatSession open(String profileId) {
        ChatSession s = new ChatSession(UUID.randomUUID().toString(), profileId, System.currentTimeMillis());
        sessions.put(s.getId(), s);
        return s;
    }

    public Optional<ChatSession> get(String id) {
        return Optional.ofNullable(id == null ? null : sessions.get(id));
    }

    /** True when this exact handle was opened here and is still open. */
    public boolean owns(ChatSession session) {
        return session != null && !session.isClosed() && sessions.get(session.getId()) == session;
    }

    public void close(String id) {
        ChatSession s = sessions.remove(id);
        if (s != null) s.close();
    }

    public List<ChatSession> list() {
        return new ArrayList<>(sessions.values());
    }

    public void clear() {
        for (ChatSession s : sessions.values()) s.close();
        sessions.clear();
    }
}
