package com.routergen.communication;

import com.routergen.core.event.Event;

public interface PipelineEventListener {

    void onEvent(Event event);
}
