package com.routergen.orchestrator;

import com.routergen.communication.PipelineEventListener;
import com.routergen.config.PipelineConfig;
import com.routergen.core.event.Event;
import com.routergen.core.event.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Logs a progress line every N persisted examples, and one line per exhausted
 * task at debug.
 */
@Component
public class ProgressLogListener implements PipelineEventListener {

    private static final Logger log = LoggerFactory.getLogger(ProgressLogListener.class);

    private final AtomicLong persisted = new AtomicLong();

    private volatile int  target;
    private volatile int  every = 1;
    private volatile long startedAt;

    @Override
    public void onEvent(Event event) {
        switch (event.getType()) {
            case RUN_STARTED -> {
                PipelineConfig config = event.payloadAs(PipelineConfig.class);
                target    = config.getTotalTarget();
                every     = Math.max(1, config.getProgressLogEvery());
                startedAt = event.getTimestamp().toEpochMilli();
                persisted.set(0);
            }
            case EXAMPLE_PERSISTED -> {
                long count = persisted.incrementAndGet();
                if (count % every == 0 || count == target) {
                    long elapsed = Math.max(1, event.getTimestamp().toEpochMilli() - startedAt);
                    log.info("[Progress] run={} {}/{} persisted ({} per minute)",
                            event.getRunId(), count, target, String.format("%.1f", count * 60_000.0 / elapsed));
                }
            }
            case TASK_EXHAUSTED -> log.debug("[Progress] run={} task {} exhausted: {}",
                    event.getRunId(), event.getTaskId(), event.getPayload());
            default -> { }
        }
    }

    long persistedCount() {
        return persisted.get();
    }
}
