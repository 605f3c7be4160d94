package com.umitunal.stepflow.schedule;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A subscriber's weekly availability. Gating is opt-in: a schedule that is
 * disabled or has no weekly configuration never holds a step back.
 */
public final class Schedule {
    private final boolean enabled;
    private final Map<DayOfWeek, DaySchedule> weeklySchedule;

    private Schedule(Builder builder) {
        this.enabled = builder.enabled;
        this.weeklySchedule = builder.weeklySchedule == null
                ? null
                : Collections.unmodifiableMap(new EnumMap<>(builder.weeklySchedule));
    }

    public boolean isEnabled() { return enabled; }

    /**
     * Day configurations keyed by weekday, or null when not configured.
     */
    public Map<DayOfWeek, DaySchedule> getWeeklySchedule() { return weeklySchedule; }

    DaySchedule day(DayOfWeek day) {
        return weeklySchedule == null ? null : weeklySchedule.get(day);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "Schedule{enabled=" + enabled + ", weeklySchedule=" + weeklySchedule + "}";
    }

    public static class Builder {
        private boolean enabled = true;
        private EnumMap<DayOfWeek, DaySchedule> weeklySchedule;

        private Builder() {
        }

        public Builder withEnabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder withDay(DayOfWeek day, DaySchedule schedule) {
            if (weeklySchedule == null) {
                weeklySchedule = new EnumMap<>(DayOfWeek.class);
            }
            weeklySchedule.put(day, schedule);
            return this;
        }

        /**
         * Marks the weekly configuration as present even if no day is added.
         */
        public Builder withEmptyWeek() {
            if (weeklySchedule == null) {
                weeklySchedule = new EnumMap<>(DayOfWeek.class);
            }
            return this;
        }

        public Schedule build() {
            return new Schedule(this);
        }
    }
}
