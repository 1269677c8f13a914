package com.credo.cache.adapters.out.redis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import com.credo.cache.domain.retry.ReconnectAttempt;

import io.lettuce.core.event.Event;
import io.lettuce.core.event.connection.ConnectionActivatedEvent;
import io.lettuce.core.event.connection.DisconnectedEvent;
import io.lettuce.core.event.connection.ReconnectFailedEvent;

/**
 * Follows connection events so a reconnect policy can be evaluated against
 * the whole retry cycle, not just the attempt number Lettuce passes in.
 */
class ReconnectTracker {

    private final Clock clock;
    private final AtomicInteger timesConnected = new AtomicInteger();

    private volatile Throwable lastError;
    private volatile Instant retryStartedAt;
    private volatile Consumer<Exception> giveUpHandler = error -> {
    };

    ReconnectTracker(Clock clock) {
        this.clock = clock;
    }

    void observe(Event event) {
        if (event instanceof ConnectionActivatedEvent) {
            connected();
        } else if (event instanceof DisconnectedEvent) {
            disconnected();
        } else if (event instanceof ReconnectFailedEvent) {
            reconnectFailed(((ReconnectFailedEvent) event).getCause());
        }
    }

    void connected() {
        timesConnected.incrementAndGet();
        retryStartedAt = null;
        lastError = null;
    }

    void disconnected() {
        if (retryStartedAt == null) {
            retryStartedAt = clock.instant();
        }
    }

    void reconnectFailed(Throwable cause) {
        lastError = cause;
        disconnected();
    }

    ReconnectAttempt snapshot(int attempt) {
        Instant started = retryStartedAt;
        long totalRetryTimeMs = started == null
                ? 0
                : Math.max(0, Duration.between(started, clock.instant()).toMillis());
        return new ReconnectAttempt(lastError, attempt, totalRetryTimeMs, timesConnected.get());
    }

    void onGiveUp(Consumer<Exception> handler) {
        this.giveUpHandler = handler;
    }

    void giveUp(Exception terminalError) {
        giveUpHandler.accept(terminalError);
    }

    int getTimesConnected() {
        return timesConnected.get();
    }
}
