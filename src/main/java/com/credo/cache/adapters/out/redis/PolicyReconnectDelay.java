package com.credo.cache.adapters.out.redis;

import java.time.Duration;

import com.credo.cache.domain.retry.ReconnectAttempt;
import com.credo.cache.domain.retry.ReconnectContext;
import com.credo.cache.domain.retry.ReconnectDecision;
import com.credo.cache.domain.retry.ReconnectPolicy;

import io.lettuce.core.resource.Delay;

/**
 * Lettuce reconnect {@link Delay} driven by a {@link ReconnectPolicy}.
 * <p>
 * Lettuce always schedules another attempt, so a terminal decision is handed
 * to the tracker's give-up handler, which resets the connection, and a parked
 * delay is returned in the meantime.
 * </p>
 */
class PolicyReconnectDelay extends Delay {

    static final Duration PARKED_DELAY = Duration.ofMinutes(1);

    private final ReconnectPolicy policy;
    private final ReconnectTracker tracker;
    private final ReconnectContext context;

    PolicyReconnectDelay(ReconnectPolicy policy, ReconnectTracker tracker, ReconnectContext context) {
        this.policy = policy;
        this.tracker = tracker;
        this.context = context;
    }

    @Override
    public Duration createDelay(long attempt) {
        ReconnectDecision decision = decide(attempt);
        if (decision.isTerminal()) {
            tracker.giveUp(decision.getTerminalError());
            return PARKED_DELAY;
        }
        return decision.getDelay();
    }

    /**
     * Evaluates the policy for {@code attempt}; a policy that throws gives up
     * with its exception.
     */
    ReconnectDecision decide(long attempt) {
        ReconnectAttempt snapshot = tracker.snapshot((int) Math.max(1, Math.min(attempt, Integer.MAX_VALUE)));

        ReconnectDecision decision;
        try {
            decision = policy.evaluate(snapshot, context);
        } catch (RuntimeException e) {
            context.logger().error("action=reconnect_policy_failed cache={} attempt={} error={}",
                    context.cacheName(), snapshot.attempt(), e.getMessage(), e);
            decision = ReconnectDecision.giveUp(e);
        }
        return decision;
    }
}
