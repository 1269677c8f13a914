package com.credo.cache.domain.retry;

import java.net.ConnectException;

/**
 * Snapshot of a reconnect cycle handed to a {@link ReconnectPolicy}.
 *
 * @param lastError        failure of the previous attempt, null when unknown
 * @param attempt          1-based attempt number within the current cycle
 * @param totalRetryTimeMs time spent retrying since the connection was lost
 * @param timesConnected   successful connections made so far by this client
 */
public record ReconnectAttempt(Throwable lastError, int attempt, long totalRetryTimeMs, int timesConnected) {

    public ReconnectAttempt {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1 but was " + attempt);
        }
        if (totalRetryTimeMs < 0) {
            throw new IllegalArgumentException("totalRetryTimeMs cannot be negative");
        }
    }

    /**
     * Checks whether the last failure was the server actively refusing the
     * connection, as opposed to a timeout or a dropped socket.
     *
     * @return true if a {@link ConnectException} is anywhere in the cause chain
     */
    public boolean isConnectionRefused() {
        Throwable current = lastError;
        while (current != null) {
            if (current instanceof ConnectException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
