package com.atrium.authorization.audit;

import com.atrium.authorization.AuthorizationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Fire-and-forget {@link AuditSink} that hands events to a delegate on a background thread.
 * <p>
 * {@link #emit} never blocks: events go into a bounded queue and are dropped (and counted on
 * {@link AuthorizationMetrics#AUDIT_DROPPED}) when the queue is full or the publisher is closed.
 * A failing delegate loses only the event it failed on. Delivery is at-most-once.
 */
public final class AsyncAuditPublisher implements AuditSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsyncAuditPublisher.class);

    /** Default queue capacity. */
    public static final int DEFAULT_CAPACITY = 1024;

    private static final long POLL_INTERVAL_MS = 100;
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final AuditSink delegate;
    private final BlockingQueue<AuthorizationAuditEvent> queue;
    private final AuthorizationMetrics metrics;
    private final Thread worker;
    private volatile boolean running = true;

    private AsyncAuditPublisher(AuditSink delegate, int capacity, AuthorizationMetrics metrics) {
        this.delegate = delegate;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.metrics = metrics;
        this.worker = new Thread(this::drain, "atrium-audit-publisher");
        this.worker.setDaemon(true);
    }

    /**
     * Creates a publisher and starts its delivery thread.
     *
     * @param delegate sink receiving events on the background thread
     * @param capacity maximum number of undelivered events held
     * @param metrics  where dropped events are counted
     */
    public static AsyncAuditPublisher start(AuditSink delegate, int capacity, AuthorizationMetrics metrics) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        AsyncAuditPublisher publisher = new AsyncAuditPublisher(delegate, capacity, metrics);
        publisher.worker.start();
        return publisher;
    }

    @Override
    public void emit(AuthorizationAuditEvent event) {
        if (!running || !queue.offer(event)) {
            metrics.recordAuditDropped();
            log.debug("Dropped audit event {} (running={}, queued={})", event.eventId(), running, queue.size());
        }
    }

    /** Events accepted but not yet handed to the delegate. */
    public int pending() {
        return queue.size();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stops accepting events and waits up to five seconds for queued events to be delivered.
     */
    @Override
    public void close() {
        running = false;
        try {
            worker.join(CLOSE_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!queue.isEmpty()) {
            log.warn("Audit publisher closed with {} undelivered events", queue.size());
        }
    }

    private void drain() {
        while (running || !queue.isEmpty()) {
            AuthorizationAuditEvent event;
            try {
                event = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event != null) {
                deliver(event);
            }
        }
    }

    private void deliver(AuthorizationAuditEvent event) {
        try {
            delegate.emit(event);
        } catch (RuntimeException e) {
            metrics.recordAuditDropped();
            log.warn("Audit sink failed for event {}", event.eventId(), e);
        }
    }
}
