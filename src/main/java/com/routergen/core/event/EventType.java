package com.routergen.core.event;

public enum EventType {
    RUN_STARTED,
    EXAMPLE_PERSISTED,
    ATTEMPT_REJECTED,
    BACKEND_FAILED,
    TASK_EXHAUSTED,
    RUN_COMPLETED
}
