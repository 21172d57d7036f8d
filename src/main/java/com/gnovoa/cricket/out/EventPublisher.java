package com.gnovoa.cricket.out;

import com.gnovoa.cricket.events.MatchEvent;

/** Outbound sink for match events. Implementations must not throw back into the simulation. */
@FunctionalInterface
public interface EventPublisher {
    void publish(MatchEvent event);
}
