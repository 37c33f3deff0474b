package com.routergen.communication;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Subscribes every {@link PipelineEventListener} bean to the bus once the
 * application is ready.
 */
@Component
public class EventListenerRegistrar {

    private static final Logger log = LoggerFactory.getLogger(EventListenerRegistrar.class);

    private final EventBus eventBus;
    private final List<PipelineEventListener> pipelineListeners;

    public EventListenerRegistrar(EventBus eventBus, List<PipelineEventListener> pipelineListeners) {
        this.eventBus = eventBus;
        this.pipelineListeners = pipelineListeners;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void subscribeAll() {
        pipelineListeners.forEach(eventBus::subscribe);
        log.info("[EventBus] Subscribed {} pipeline listener(s)", pipelineListeners.size());
    }
}
