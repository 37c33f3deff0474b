package com.routergen.core.backend;

/**
 * Point-in-time health of one backend, for reports.
 */
public final class BackendStatus {

    private final String  id;
    private final int     rotationPosition;
    private final boolean disabled;
    private final boolean coolingDown;
    private final int     consecutiveFailures;
    private final long    successes;
    private final long    failures;

    BackendStatus(String id, int rotationPosition, boolean disabled, boolean coolingDown,
                  int consecutiveFailures, long successes, long failures) {
        this.id                  = id;
        this.rotationPosition    = rotationPosition;
        this.disabled            = disabled;
        this.coolingDown         = coolingDown;
        this.consecutiveFailures = consecutiveFailures;
        this.successes           = successes;
        this.failures            = failures;
    }

    public String  getId()                  { return id; }
    public int     getRotationPosition()    { return rotationPosition; }
    public boolean isDisabled()             { return disabled; }
    public boolean isCoolingDown()          { return coolingDown; }
    public int     getConsecutiveFailures() { return consecutiveFailures; }
    public long    getSuccesses()           { return successes; }
    public long    getFailures()            { return failures; }
}
