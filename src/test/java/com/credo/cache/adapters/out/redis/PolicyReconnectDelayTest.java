package com.credo.cache.adapters.out.redis;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.credo.cache.domain.retry.DefaultReconnectPolicy;
import com.credo.cache.domain.retry.ReconnectContext;
import com.credo.cache.domain.retry.ReconnectDecision;

@DisplayName("PolicyReconnectDelay Tests")
class PolicyReconnectDelayTest {

    private ReconnectTracker tracker;
    private ReconnectContext context;
    private AtomicReference<Exception> abandoned;

    @BeforeEach
    void setUp() {
        tracker = new ReconnectTracker(Clock.systemUTC());
        context = new ReconnectContext("testcache", LoggerFactory.getLogger(PolicyReconnectDelayTest.class));
        abandoned = new AtomicReference<>();
        tracker.onGiveUp(abandoned::set);
    }

    @Test
    @DisplayName("a retry decision becomes the Lettuce delay")
    void testRetryDelay() {
        PolicyReconnectDelay delay = new PolicyReconnectDelay(new DefaultReconnectPolicy(), tracker, context);

        assertEquals(Duration.ofMillis(600), delay.createDelay(3));
        assertNull(abandoned.get());
    }

    @Test
    @DisplayName("the policy sees the attempt number Lettuce passes in")
    void testAttemptPassedThrough() {
        AtomicReference<Integer> seen = new AtomicReference<>();
        PolicyReconnectDelay delay = new PolicyReconnectDelay((attempt, ctx) -> {
            seen.set(attempt.attempt());
            return ReconnectDecision.retryAfter(10);
        }, tracker, context);

        delay.createDelay(7);

        assertEquals(7, seen.get());
    }

    @Test
    @DisplayName("a terminal decision gives up and parks the watchdog")
    void testTerminal() {
        IllegalStateException terminal = new IllegalStateException("stop");
        PolicyReconnectDelay delay = new PolicyReconnectDelay(
                (attempt, ctx) -> ReconnectDecision.giveUp(terminal), tracker, context);

        assertEquals(PolicyReconnectDelay.PARKED_DELAY, delay.createDelay(1));
        assertSame(terminal, abandoned.get());
    }

    @Test
    @DisplayName("a failing policy gives up with its exception")
    void testPolicyThrows() {
        IllegalStateException bug = new IllegalStateException("policy bug");
        PolicyReconnectDelay delay = new PolicyReconnectDelay((attempt, ctx) -> {
            throw bug;
        }, tracker, context);

        assertEquals(PolicyReconnectDelay.PARKED_DELAY, delay.createDelay(1));
        assertSame(bug, abandoned.get());
    }

    @Test
    @DisplayName("decide() reports a terminal decision without giving up itself")
    void testDecide_Terminal() {
        IllegalStateException terminal = new IllegalStateException("stop");
        PolicyReconnectDelay delay = new PolicyReconnectDelay(
                (attempt, ctx) -> ReconnectDecision.giveUp(terminal), tracker, context);

        ReconnectDecision decision = delay.decide(1);

        assertTrue(decision.isTerminal());
        assertSame(terminal, decision.getTerminalError());
        assertNull(abandoned.get());
    }
}
