package com.umitunal.stepflow.schedule;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether an instant falls inside a subscriber's weekly schedule and
 * finds the next instant at which it does. Stateless; every method is a pure
 * function of its arguments.
 *
 * Without a timezone, wall-clock time is taken in UTC.
 */
public final class ScheduleEvaluator {

    private ScheduleEvaluator() {
    }

    /**
     * Check whether {@code now} is inside the schedule.
     *
     * @param schedule the subscriber schedule, may be null
     * @param now the instant to check
     * @param timezone IANA zone name of the subscriber, may be null
     * @return true if the schedule allows delivery at {@code now}
     */
    public static boolean isWithinSchedule(Schedule schedule, Instant now, String timezone) {
        if (!isGating(schedule)) {
            return true;
        }

        LocalDateTime wallClock = LocalDateTime.ofInstant(now, zoneOf(timezone));
        int minuteOfDay = TimeRange.minutesOfDay(wallClock.toLocalTime());

        List<DayOfWeek> daysToCheck = new ArrayList<>(2);
        daysToCheck.add(wallClock.getDayOfWeek());

        // An overnight window opened yesterday may still be running
        DayOfWeek previousDay = wallClock.getDayOfWeek().minus(1);
        DaySchedule previous = schedule.day(previousDay);
        if (previous != null && previous.hasOvernightWindow()) {
            daysToCheck.add(previousDay);
        }

        for (DayOfWeek day : daysToCheck) {
            DaySchedule daySchedule = schedule.day(day);
            if (daySchedule == null || !daySchedule.hasWindows()) {
                continue;
            }
            for (TimeRange range : daySchedule.getHours()) {
                if (range.containsMinute(minuteOfDay)) {
                    return true;
                }
            }
        }

        return false;
    }

    public static boolean isWithinSchedule(Schedule schedule, Instant now) {
        return isWithinSchedule(schedule, now, null);
    }

    /**
     * Find the earliest instant, at or after {@code from}, at which the schedule
     * allows delivery. Returns {@code from} itself when it is already inside a
     * window, and also when nothing opens within the next seven days.
     *
     * @param schedule the subscriber schedule, may be null
     * @param from the instant to start searching from
     * @param timezone IANA zone name of the subscriber, may be null
     * @return the next available instant
     */
    public static Instant calculateNextAvailableTime(Schedule schedule, Instant from, String timezone) {
        if (!isGating(schedule)) {
            return from;
        }

        ZoneId zone = zoneOf(timezone);
        LocalDateTime wallClock = LocalDateTime.ofInstant(from, zone);

        // Yesterday first, for overnight windows that are still open
        for (int dayOffset = -1; dayOffset <= 7; dayOffset++) {
            LocalDateTime candidateDay = wallClock.plusDays(dayOffset);
            DaySchedule daySchedule = schedule.day(candidateDay.getDayOfWeek());

            if (daySchedule == null || !daySchedule.isEnabled() || daySchedule.getHours() == null) {
                continue;
            }

            for (TimeRange range : daySchedule.getHours()) {
                LocalDateTime windowStart = candidateDay.toLocalDate().atTime(range.startTime());
                LocalDateTime windowEnd = candidateDay.toLocalDate().atTime(range.endTime());
                if (windowEnd.isBefore(windowStart)) {
                    windowEnd = windowEnd.plusDays(1);
                }

                if (dayOffset <= 0 && !wallClock.isBefore(windowStart) && !wallClock.isAfter(windowEnd)) {
                    return from;
                }

                if (dayOffset > 0 || windowStart.isAfter(wallClock)) {
                    return windowStart.atZone(zone).toInstant();
                }
            }
        }

        return from;
    }

    public static Instant calculateNextAvailableTime(Schedule schedule, Instant from) {
        return calculateNextAvailableTime(schedule, from, null);
    }

    private static boolean isGating(Schedule schedule) {
        return schedule != null && schedule.isEnabled() && schedule.getWeeklySchedule() != null;
    }

    private static ZoneId zoneOf(String timezone) {
        return timezone == null || timezone.isBlank() ? ZoneOffset.UTC : ZoneId.of(timezone);
    }
}
