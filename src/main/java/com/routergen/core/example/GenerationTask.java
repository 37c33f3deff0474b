package com.routergen.core.example;

import com.routergen.core.schema.ToolKind;

/**
 * One open quota slot to fill: which tool to target, in which domain, voiced
 * by which persona, phrased in which query style.
 *
 * The task id is stable across retries of the same slot.
 */
public final class GenerationTask {

    private final long     taskId;
    private final String   domain;
    private final String   persona;
    private final ToolKind targetKind;
    private final String   queryStyle;

    public GenerationTask(long taskId, String domain, String persona, ToolKind targetKind, String queryStyle) {
        this.taskId     = taskId;
        this.domain     = domain;
        this.persona    = persona;
        this.targetKind = targetKind;
        this.queryStyle = queryStyle;
    }

    public long     getTaskId()     { return taskId; }
    public String   getDomain()     { return domain; }
    public String   getPersona()    { return persona; }
    public ToolKind getTargetKind() { return targetKind; }
    public String   getQueryStyle() { return queryStyle; }

    public boolean requiresComplexReasoning() {
        return targetKind.requiresComplexReasoning();
    }

    @Override
    public String toString() {
        return "Task#" + taskId + "[" + targetKind.getTag() + ", " + domain + ", style=" + queryStyle + "]";
    }
}
