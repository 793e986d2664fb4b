package com.agentstrike.support;

import com.agentstrike.framework.IssueSink;
import com.agentstrike.model.Finding;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class RecordingIssueSink implements IssueSink {

    private final List<Finding> reported = new CopyOnWriteArrayList<>();

    @Override
    public void reportIssue(Finding finding) {
        reported.add(finding);
    }

    public List<Finding> reported() { return List.copyOf(reported); }
}
