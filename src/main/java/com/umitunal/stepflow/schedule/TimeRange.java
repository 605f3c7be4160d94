package com.umitunal.stepflow.schedule;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;

/**
 * A window of availability within a single day, expressed as 12-hour
 * clock strings such as {@code "09:00 AM"} and {@code "05:30 PM"}.
 * A range whose end lies before its start wraps past midnight.
 */
public final class TimeRange {
    private static final DateTimeFormatter CLOCK_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("h:mm a")
            .toFormatter(Locale.US);

    private final String start;
    private final String end;

    public TimeRange(String start, String end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
    }

    public static TimeRange of(String start, String end) {
        return new TimeRange(start, end);
    }

    public String getStart() { return start; }
    public String getEnd() { return end; }

    public LocalTime startTime() {
        return parseClock(start);
    }

    public LocalTime endTime() {
        return parseClock(end);
    }

    /**
     * True when the range ends on the following calendar day.
     */
    public boolean wrapsMidnight() {
        return minutesOfDay(endTime()) < minutesOfDay(startTime());
    }

    /**
     * Checks a minute-of-day against this range. Both bounds are inclusive.
     */
    public boolean containsMinute(int minuteOfDay) {
        int startMinutes = minutesOfDay(startTime());
        int endMinutes = minutesOfDay(endTime());

        if (endMinutes < startMinutes) {
            return minuteOfDay >= startMinutes || minuteOfDay <= endMinutes;
        }
        return minuteOfDay >= startMinutes && minuteOfDay <= endMinutes;
    }

    static int minutesOfDay(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }

    static LocalTime parseClock(String value) {
        try {
            return LocalTime.parse(value.trim(), CLOCK_FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid schedule time '" + value + "', expected hh:mm AM/PM", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeRange)) return false;
        TimeRange other = (TimeRange) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + " - " + end;
    }
}
