package com.credo.cache.domain.retry;

import java.time.Duration;

/**
 * Outcome of a {@link ReconnectPolicy}: either wait and retry, or give up.
 */
public final class ReconnectDecision {

    private final Duration delay;
    private final Exception terminalError;

    private ReconnectDecision(Duration delay, Exception terminalError) {
        this.delay = delay;
        this.terminalError = terminalError;
    }

    public static ReconnectDecision retryAfter(long delayMs) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative");
        }
        return new ReconnectDecision(Duration.ofMillis(delayMs), null);
    }

    public static ReconnectDecision giveUp(Exception terminalError) {
        if (terminalError == null) {
            throw new IllegalArgumentException("terminalError cannot be null");
        }
        return new ReconnectDecision(null, terminalError);
    }

    public static ReconnectDecision giveUp(String reason) {
        return giveUp(new IllegalStateException(reason));
    }

    public boolean isTerminal() {
        return terminalError != null;
    }

    /**
     * @return delay before the next attempt
     * @throws IllegalStateException if this decision is terminal
     */
    public Duration getDelay() {
        if (isTerminal()) {
            throw new IllegalStateException("Terminal decision has no delay");
        }
        return delay;
    }

    /**
     * @return the error that ends the reconnect cycle, or null when retrying
     */
    public Exception getTerminalError() {
        return terminalError;
    }

    @Override
    public String toString() {
        return isTerminal()
                ? "ReconnectDecision{giveUp=" + terminalError.getMessage() + "}"
                : "ReconnectDecision{delayMs=" + delay.toMillis() + "}";
    }
}
