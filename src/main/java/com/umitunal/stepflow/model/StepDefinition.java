package com.umitunal.stepflow.model;

/**
 * Static definition of a workflow step as seen by the runner.
 */
public final class StepDefinition {
    private final String stepId;
    private final StepType type;
    private final boolean shouldStopOnFail;

    public StepDefinition(String stepId, StepType type, boolean shouldStopOnFail) {
        this.stepId = stepId;
        this.type = type;
        this.shouldStopOnFail = shouldStopOnFail;
    }

    public static StepDefinition of(StepType type) {
        return new StepDefinition(null, type, false);
    }

    public static StepDefinition haltingOnFailure(StepType type) {
        return new StepDefinition(null, type, true);
    }

    public String getStepId() { return stepId; }
    public StepType getType() { return type; }

    /**
     * Whether a failure of this step cancels the rest of the chain.
     */
    public boolean shouldStopOnFail() { return shouldStopOnFail; }

    @Override
    public String toString() {
        return "StepDefinition{stepId='" + stepId + "', type=" + type + ", shouldStopOnFail=" + shouldStopOnFail + "}";
    }
}
