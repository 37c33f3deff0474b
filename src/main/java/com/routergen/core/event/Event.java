package com.routergen.core.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Something that happened during a generation run.
 *
 * Payload by type:
 *   RUN_STARTED       PipelineConfig
 *   EXAMPLE_PERSISTED Example
 *   ATTEMPT_REJECTED  ValidationOutcome
 *   BACKEND_FAILED    BackendError
 *   TASK_EXHAUSTED    last failure cause (String)
 *   RUN_COMPLETED     GenerationReport
 */
public class Event {

    private final String    eventId;
    private final EventType type;
    private final String    runId;
    private final Long      taskId;
    private final Object    payload;
    private final Instant   timestamp;

    private Event(EventType type, String runId, Long taskId, Object payload) {
        this.eventId   = UUID.randomUUID().toString();
        this.type      = type;
        this.runId     = runId;
        this.taskId    = taskId;
        this.payload   = payload;
        this.timestamp = Instant.now();
    }

    public static Event forRun(EventType type, String runId, Object payload) {
        return new Event(type, runId, null, payload);
    }

    public static Event forTask(EventType type, String runId, long taskId, Object payload) {
        return new Event(type, runId, taskId, payload);
    }

    public String    getEventId()   { return eventId; }
    public EventType getType()      { return type; }
    public String    getRunId()     { return runId; }
    public Long      getTaskId()    { return taskId; }
    public Object    getPayload()   { return payload; }
    public Instant   getTimestamp() { return timestamp; }

    /** Typed payload access; throws ClassCastException on a mismatched type. */
    public <T> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }

    @Override
    public String toString() {
        return type + "[run=" + runId + (taskId != null ? ", task=" + taskId : "") + "]";
    }
}
