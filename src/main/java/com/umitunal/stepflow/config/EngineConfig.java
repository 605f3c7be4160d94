package com.umitunal.stepflow.config;

import java.time.Clock;
import java.util.Objects;

/**
 * Tuning of the job runner.
 */
public class EngineConfig {
    public static final int DEFAULT_MAX_SCHEDULE_EXTENSIONS = 3;

    private final int maxScheduleExtensions;
    private final Clock clock;

    private EngineConfig(Builder builder) {
        this.maxScheduleExtensions = builder.maxScheduleExtensions;
        this.clock = builder.clock;
    }

    public int getMaxScheduleExtensions() { return maxScheduleExtensions; }
    public Clock getClock() { return clock; }

    public static EngineConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private int maxScheduleExtensions = DEFAULT_MAX_SCHEDULE_EXTENSIONS;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        /**
         * How many times a delay or digest step may be pushed to the
         * subscriber's next available time before it is sent anyway.
         * Default: 3
         */
        public Builder withMaxScheduleExtensions(int count) {
            if (count < 0) {
                throw new IllegalArgumentException("maxScheduleExtensions must not be negative");
            }
            this.maxScheduleExtensions = count;
            return this;
        }

        /**
         * Clock used for every schedule decision.
         * Default: system UTC clock
         */
        public Builder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
