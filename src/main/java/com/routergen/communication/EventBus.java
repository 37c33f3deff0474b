package com.routergen.communication;

import com.routergen.core.event.Event;

public interface EventBus {

    void publish(Event event);

    void subscribe(PipelineEventListener listener);
}
