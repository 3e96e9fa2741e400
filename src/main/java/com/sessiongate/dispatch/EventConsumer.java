package com.sessiongate.dispatch;

import com.sessiongate.shared.model.ProtocolEvent;

import java.util.function.Consumer;

/**
 * A fan-out target. Each consumer sees the events of one session one at a time, in
 * sequence order; exceptions are logged by the dispatcher and do not stop the lane.
 */
public interface EventConsumer {
    String name();
    void accept(ProtocolEvent event);

    static EventConsumer of(String name, Consumer<ProtocolEvent> action) {
        return new EventConsumer() {
            @Override public String name() { return name; }
            @Override public void accept(ProtocolEvent event) { action.accept(event); }
        };
    }
}
