package com.atrium.authorization.testing;

import com.atrium.authorization.audit.AuditSink;
import com.atrium.authorization.audit.AuthorizationAuditEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link AuditSink} keeping every event in memory. Optionally fails on each call, to check that
 * audit failures never affect decisions.
 */
public final class RecordingAuditSink implements AuditSink {

    private final List<AuthorizationAuditEvent> events = new CopyOnWriteArrayList<>();
    private final boolean failing;

    public RecordingAuditSink() {
        this(false);
    }

    private RecordingAuditSink(boolean failing) {
        this.failing = failing;
    }

    /** A sink that records each event and then throws. */
    public static RecordingAuditSink failing() {
        return new RecordingAuditSink(true);
    }

    @Override
    public void emit(AuthorizationAuditEvent event) {
        events.add(event);
        if (failing) {
            throw new IllegalStateException("audit sink unavailable");
        }
    }

    public List<AuthorizationAuditEvent> events() {
        return List.copyOf(events);
    }

    public AuthorizationAuditEvent last() {
        if (events.isEmpty()) {
            throw new IllegalStateException("no audit events recorded");
        }
        return events.get(events.size() - 1);
    }

    public void clear() {
        events.clear();
    }
}
