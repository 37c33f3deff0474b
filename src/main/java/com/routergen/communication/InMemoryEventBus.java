package com.routergen.communication;

import com.routergen.core.event.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous bus: listeners run on the publishing worker thread. A failing
 * listener is logged and skipped so it cannot fail a generation attempt.
 */
@Component
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final List<PipelineEventListener> listeners =
            new CopyOnWriteArrayList<>();

    @Override
    public void publish(Event event) {
        for (PipelineEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("[EventBus] Listener {} failed on {}: {}",
                        listener.getClass().getSimpleName(), event.getType(), e.getMessage());
            }
        }
    }

    @Override
    public void subscribe(PipelineEventListener listener) {
        if (!listeners.contains(listener)) {
            listeners.add(listener);
        }
    }
}
