package com.credo.cache.adapters.out.redis;

import io.lettuce.core.event.Event;
import io.lettuce.core.event.EventBus;
import reactor.core.publisher.Flux;

/**
 * Lettuce event bus that updates the {@link ReconnectTracker} on the
 * publishing thread before subscribers see the event.
 * <p>
 * The connection watchdog publishes a failed reconnect and then asks the
 * reconnect delay for the next wait on the same thread, so the policy always
 * sees the cause of the attempt that just failed.
 * </p>
 */
class TrackingEventBus implements EventBus {

    private final EventBus delegate;
    private final ReconnectTracker tracker;

    TrackingEventBus(EventBus delegate, ReconnectTracker tracker) {
        this.delegate = delegate;
        this.tracker = tracker;
    }

    @Override
    public Flux<Event> get() {
        return delegate.get();
    }

    @Override
    public void publish(Event event) {
        tracker.observe(event);
        delegate.publish(event);
    }
}
