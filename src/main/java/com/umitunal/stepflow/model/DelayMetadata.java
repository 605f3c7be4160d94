package com.umitunal.stepflow.model;

/**
 * Configured pause of a DELAY step, or the snooze of an in-app step.
 */
public final class DelayMetadata {
    private final long amount;
    private final String unit;

    public DelayMetadata(long amount, String unit) {
        this.amount = amount;
        this.unit = unit;
    }

    public long getAmount() { return amount; }
    public String getUnit() { return unit; }
}
