package com.umitunal.stepflow.model;

/**
 * Kinds of workflow steps and how each one reacts to subscriber schedules.
 */
public enum StepType {
    //        bypassesSchedule, extendsToSchedule, deferred
    TRIGGER(true, false, false),
    IN_APP(true, false, false),
    DELAY(true, true, true),
    DIGEST(true, true, true),
    EMAIL(false, false, false),
    SMS(false, false, false),
    PUSH(false, false, false),
    CHAT(false, false, false),
    CUSTOM(false, false, false);

    private final boolean bypassesSchedule;
    private final boolean extendsToSchedule;
    private final boolean deferred;

    StepType(boolean bypassesSchedule, boolean extendsToSchedule, boolean deferred) {
        this.bypassesSchedule = bypassesSchedule;
        this.extendsToSchedule = extendsToSchedule;
        this.deferred = deferred;
    }

    /**
     * Steps that run even when the subscriber is outside their schedule.
     */
    public boolean bypassesSchedule() { return bypassesSchedule; }

    /**
     * Steps that may be pushed to the next opening of the subscriber schedule.
     */
    public boolean extendsToSchedule() { return extendsToSchedule; }

    /**
     * Steps that park the chain and can be canceled while parked.
     */
    public boolean isDeferred() { return deferred; }
}
