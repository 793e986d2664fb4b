package com.agentstrike.support;

import com.agentstrike.model.TrafficContext;
import com.agentstrike.scanner.ProbeSender;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Echoes each probe back with a 200 response; records what was sent. */
public final class ScriptedProbeSender implements ProbeSender {

    private final List<TrafficContext> sent = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public ScriptedProbeSender failing(boolean failing) {
        this.failing = failing;
        return this;
    }

    @Override
    public TrafficContext send(TrafficContext probe) throws IOException {
        if (failing) throw new IOException("connection refused");
        sent.add(probe);
        return probe.toBuilder()
                .statusCode(200)
                .responseHeader("Content-Type", "text/html")
                .responseBody("<html>ok</html>")
                .build();
    }

    public List<TrafficContext> sent() { return List.copyOf(sent); }
}
