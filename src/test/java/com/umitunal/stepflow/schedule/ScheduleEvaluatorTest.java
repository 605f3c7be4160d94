package com.umitunal.stepflow.schedule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class ScheduleEvaluatorTest {

    // 2024-06-10 is a Monday
    private static Instant monday(String time) {
        return Instant.parse("2024-06-10T" + time + ":00Z");
    }

    private static Instant tuesday(String time) {
        return Instant.parse("2024-06-11T" + time + ":00Z");
    }

    private static Schedule weekly(DayOfWeek day, DaySchedule daySchedule) {
        return Schedule.newBuilder().withDay(day, daySchedule).build();
    }

    private static final Schedule MONDAY_NINE_TO_FIVE =
            weekly(DayOfWeek.MONDAY, DaySchedule.enabled(TimeRange.of("09:00 AM", "05:00 PM")));

    private static final Schedule MONDAY_OVERNIGHT =
            weekly(DayOfWeek.MONDAY, DaySchedule.enabled(TimeRange.of("11:00 PM", "02:00 AM")));

    @Nested
    @DisplayName("isWithinSchedule")
    class IsWithinSchedule {

        @Test
        @DisplayName("Should allow every instant without an active schedule")
        void testNoGating() {
            Schedule disabled = Schedule.newBuilder().withEnabled(false).withEmptyWeek().build();
            Schedule noWeek = Schedule.newBuilder().build();

            assertThat(ScheduleEvaluator.isWithinSchedule(null, monday("03:00"))).isTrue();
            assertThat(ScheduleEvaluator.isWithinSchedule(disabled, monday("03:00"))).isTrue();
            assertThat(ScheduleEvaluator.isWithinSchedule(noWeek, monday("03:00"))).isTrue();
        }

        @Test
        @DisplayName("Should include both window bounds")
        void testInclusiveBounds() {
            assertThat(ScheduleEvaluator.isWithinSchedule(MONDAY_NINE_TO_FIVE, monday("09:00"))).isTrue();
            assertThat(ScheduleEvaluator.isWithinSchedule(MONDAY_NINE_TO_FIVE, monday("17:00"))).isTrue();
            assertThat(ScheduleEvaluator.isWithinSchedule(MONDAY_NINE_TO_FIVE, monday("08:59"))).isFalse();
            assertThat(ScheduleEvaluator.isWithinSchedule(MONDAY_NINE_TO_FIVE, monday("17:01"))).isFalse();
        }

        @Test
        @DisplayName("Should treat unconfigured, disabled and empty days as closed")
        void testClosedDays() {
            Schedule schedule = Schedule.newBuilder()
                    .withDay(DayOfWeek.MONDAY, DaySchedule.disabled(TimeRange.of("09:00 AM", "05:00 PM")))
                    .withDay(DayOfWeek.TUESDAY, DaySchedule.enabled())
                    .build();

            assertThat(ScheduleEvaluator.isWithinSchedule(schedule, monday("12:00"))).isFalse();
            assertThat(ScheduleEvaluator.isWithinSchedule(schedule, tuesday("12:00"))).isFalse();
            assertThat(ScheduleEvaluator.isWithinSchedule(schedule, Instant.parse("2024-06-12T12:00:00Z"))).isFalse();
        }

        @Test
        @DisplayName("Should treat the gap between two ranges as closed")
        void testDisjointRanges() {
            Schedule schedule = weekly(DayOfWeek.MONDAY, DaySchedule.enabled(
                    TimeRange.of("09:00 AM", "11:00 AM"),
                    TimeRange.of("02:00 PM", "05:00 PM")));

            assertThat(ScheduleEvaluator.isWithinSchedule(schedule, monday("10:00"))).isTrue();
            assertThat(ScheduleEvaluator.isWithinSchedule(schedule, monday("12:00"))).isFalse();
            assertThat(ScheduleEvaluator.isWithinSchedule(schedule, monday("15:00"))).isTrue();
        }

        @Test
        @DisplayName("Should keep an overnight window open into the next day")
        void testOvernightWindow() {
            assertThat(ScheduleEvaluator.isWithinSchedule(MONDAY_OVERNIGHT, monday("23:30"))).isTrue();
            assertThat(ScheduleEvaluator.isWithinSchedule(MONDAY_OVERNIGHT, tuesday("01:00"))).isTrue();
            assertThat(ScheduleEvaluator.isWithinSchedule(MONDAY_OVERNIGHT, tuesday("03:00"))).isFalse();
        }

        @Test
        @DisplayName("Should check every range of the previous day once it has an overnight window")
        void testPreviousDayRangesAreAllChecked() {
            Schedule schedule = weekly(DayOfWeek.MONDAY, DaySchedule.enabled(
                    TimeRange.of("09:00 AM", "05:00 PM"),
                    TimeRange.of("11:00 PM", "02:00 AM")));

            assertThat(ScheduleEvaluator.isWithinSchedule(schedule, tuesday("10:00"))).isTrue();
        }

        @Test
        @DisplayName("Should read wall-clock time in the subscriber timezone")
        void testTimezone() {
            Schedule schedule = weekly(DayOfWeek.MONDAY, DaySchedule.enabled(TimeRange.of("10:00 AM", "05:00 PM")));
            // 14:00 in New York, 18:00 in UTC
            Instant instant = monday("18:00");

            assertThat(ScheduleEvaluator.isWithinSchedule(schedule, instant, "America/New_York")).isTrue();
            assertThat(ScheduleEvaluator.isWithinSchedule(schedule, instant)).isFalse();
        }

        @Test
        @DisplayName("Should match the opening minute in the subscriber timezone")
        void testTimezoneOpening() {
            Schedule schedule = weekly(DayOfWeek.MONDAY, DaySchedule.enabled(TimeRange.of("10:00 AM", "05:00 PM")));

            assertThat(ScheduleEvaluator.isWithinSchedule(schedule, monday("14:00"), "America/New_York")).isTrue();
            assertThat(ScheduleEvaluator.isWithinSchedule(schedule, monday("13:59"), "America/New_York")).isFalse();
        }

        @Test
        @DisplayName("Should use the weekday of the subscriber timezone")
        void testTimezoneWeekday() {
            // Monday 02:00 UTC is still Sunday evening in New York
            Schedule sundayEvening = weekly(DayOfWeek.SUNDAY, DaySchedule.enabled(TimeRange.of("09:00 PM", "11:00 PM")));

            assertThat(ScheduleEvaluator.isWithinSchedule(sundayEvening, monday("02:00"), "America/New_York")).isTrue();
            assertThat(ScheduleEvaluator.isWithinSchedule(sundayEvening, monday("02:00"))).isFalse();
        }
    }

    @Nested
    @DisplayName("calculateNextAvailableTime")
    class CalculateNextAvailableTime {

        @Test
        @DisplayName("Should return the input without a schedule")
        void testNoSchedule() {
            Instant from = monday("08:00");

            assertThat(ScheduleEvaluator.calculateNextAvailableTime(null, from)).isEqualTo(from);
            assertThat(ScheduleEvaluator.calculateNextAvailableTime(
                    Schedule.newBuilder().withEnabled(false).withEmptyWeek().build(), from)).isEqualTo(from);
        }

        @Test
        @DisplayName("Should return the opening later the same day")
        void testSameDay() {
            assertThat(ScheduleEvaluator.calculateNextAvailableTime(MONDAY_NINE_TO_FIVE, monday("08:00")))
                    .isEqualTo(monday("09:00"));
        }

        @Test
        @DisplayName("Should move to the next day after closing time")
        void testNextDay() {
            Schedule schedule = Schedule.newBuilder()
                    .withDay(DayOfWeek.MONDAY, DaySchedule.enabled(TimeRange.of("09:00 AM", "05:00 PM")))
                    .withDay(DayOfWeek.TUESDAY, DaySchedule.enabled(TimeRange.of("09:00 AM", "05:00 PM")))
                    .build();

            assertThat(ScheduleEvaluator.calculateNextAvailableTime(schedule, monday("18:00")))
                    .isEqualTo(tuesday("09:00"));
        }

        @Test
        @DisplayName("Should skip disabled days")
        void testSkipsDisabledDay() {
            Schedule schedule = Schedule.newBuilder()
                    .withDay(DayOfWeek.MONDAY, DaySchedule.enabled(TimeRange.of("09:00 AM", "05:00 PM")))
                    .withDay(DayOfWeek.TUESDAY, DaySchedule.disabled(TimeRange.of("09:00 AM", "05:00 PM")))
                    .withDay(DayOfWeek.WEDNESDAY, DaySchedule.enabled(TimeRange.of("10:00 AM", "05:00 PM")))
                    .build();

            assertThat(ScheduleEvaluator.calculateNextAvailableTime(schedule, monday("18:00")))
                    .isEqualTo(Instant.parse("2024-06-12T10:00:00Z"));
        }

        @Test
        @DisplayName("Should return an instant that is already inside a window unchanged")
        void testAlreadyInside() {
            Instant from = Instant.parse("2024-06-10T12:34:56.789Z");

            assertThat(ScheduleEvaluator.calculateNextAvailableTime(MONDAY_NINE_TO_FIVE, from)).isEqualTo(from);
        }

        @Test
        @DisplayName("Should treat an overnight window begun yesterday as open")
        void testInsideOvernightWindow() {
            Instant from = tuesday("01:00");

            assertThat(ScheduleEvaluator.calculateNextAvailableTime(MONDAY_OVERNIGHT, from)).isEqualTo(from);
        }

        @Test
        @DisplayName("Should walk ranges in their declared order")
        void testDeclaredOrder() {
            Schedule schedule = weekly(DayOfWeek.MONDAY, DaySchedule.enabled(
                    TimeRange.of("02:00 PM", "05:00 PM"),
                    TimeRange.of("09:00 AM", "11:00 AM")));

            assertThat(ScheduleEvaluator.calculateNextAvailableTime(schedule, monday("08:00")))
                    .isEqualTo(monday("14:00"));
        }

        @Test
        @DisplayName("Should wrap around to the same weekday next week")
        void testNextWeek() {
            assertThat(ScheduleEvaluator.calculateNextAvailableTime(MONDAY_NINE_TO_FIVE, monday("18:00")))
                    .isEqualTo(Instant.parse("2024-06-17T09:00:00Z"));
        }

        @Test
        @DisplayName("Should return the input when nothing opens within a week")
        void testNothingOpens() {
            Schedule schedule = weekly(DayOfWeek.MONDAY, DaySchedule.disabled(TimeRange.of("09:00 AM", "05:00 PM")));
            Instant from = monday("18:00");

            assertThat(ScheduleEvaluator.calculateNextAvailableTime(schedule, from)).isEqualTo(from);
        }

        @Test
        @DisplayName("Should return the opening converted back from the subscriber timezone")
        void testTimezone() {
            Schedule schedule = Schedule.newBuilder()
                    .withDay(DayOfWeek.MONDAY, DaySchedule.enabled(TimeRange.of("09:00 AM", "05:00 PM")))
                    .withDay(DayOfWeek.TUESDAY, DaySchedule.enabled(TimeRange.of("09:00 AM", "05:00 PM")))
                    .build();
            // 19:00 in New York on Monday, so the next opening is Tuesday 09:00 EDT
            Instant from = Instant.parse("2024-06-10T23:00:00Z");

            assertThat(ScheduleEvaluator.calculateNextAvailableTime(schedule, from, "America/New_York"))
                    .isEqualTo(tuesday("13:00"));
        }
    }
}
