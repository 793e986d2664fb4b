package com.agentstrike.agent;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only conversation history for one chat session.
 * Only the supervisor appends, and only for the session handle it was given.
 */
public final class ChatSession {

    /** One completed exchange: what the user sent and what the agent answered. */
    public record Turn(String user, String agent) {}

    private final String id;
    private final String profileId;
    private final long createdAt;
    private final List<Turn> turns = new ArrayList<>();
    private volatile boolean closed;

    ChatSession(String id, String profileId, long createdAt) {
        this.id = id;
        this.profileId = profileId;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }
    public String getProfileId() { return profileId; }
    public long getCreatedAt() { return createdAt; }
    public boolean isClosed() { return closed; }

    void close() { this.closed = true; }

    synchronized void append(Turn turn) {
        if (closed) throw new IllegalStateException("Session " + id + " is closed");
        turns.add(turn);
    }

    public synchronized int size() {
        return turns.size();
    }

    /** The last {@code maxTurns} turns, oldest first. */
    public synchronized List<Turn> recentTurns(int maxTurns) {
        int from = Math.max(0, turns.size() - Math.max(0, maxTurns));
        return List.copyOf(new ArrayList<>(turns.subList(from, turns.size())));
    }

    /** History as prompt text, capped to the last {@code maxTurns} turns. */
    public String renderHistory(int maxTurns) {
        List<Turn> recent = recentTurns(maxTurns);
        if (recent.isEmpty()) return "(no previous messages)";
        StringBuilder sb = new StringBuilder();
        for (Turn t : recent) {
            sb.append("User: ").append(t.user()).append("\n");
            sb.append("Agent: ").append(t.agent()).append("\n\n");
        }
        return sb.toString().trim();
    }
}
