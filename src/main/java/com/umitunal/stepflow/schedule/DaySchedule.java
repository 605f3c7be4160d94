package com.umitunal.stepflow.schedule;

import java.util.List;

/**
 * Availability for one weekday. A disabled day, or one without hours,
 * contributes no windows.
 */
public final class DaySchedule {
    private final boolean enabled;
    private final List<TimeRange> hours;

    public DaySchedule(boolean enabled, List<TimeRange> hours) {
        this.enabled = enabled;
        this.hours = hours == null ? null : List.copyOf(hours);
    }

    public static DaySchedule enabled(TimeRange... hours) {
        return new DaySchedule(true, List.of(hours));
    }

    public static DaySchedule disabled(TimeRange... hours) {
        return new DaySchedule(false, List.of(hours));
    }

    public boolean isEnabled() { return enabled; }

    /**
     * Ranges in declared order, or null when none were configured.
     */
    public List<TimeRange> getHours() { return hours; }

    boolean hasWindows() {
        return enabled && hours != null && !hours.isEmpty();
    }

    boolean hasOvernightWindow() {
        return hasWindows() && hours.stream().anyMatch(TimeRange::wrapsMidnight);
    }

    @Override
    public String toString() {
        return "DaySchedule{enabled=" + enabled + ", hours=" + hours + "}";
    }
}
