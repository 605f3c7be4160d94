package com.umitunal.stepflow.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.umitunal.stepflow.error.StepflowException;
import com.umitunal.stepflow.model.Job;
import com.umitunal.stepflow.schedule.Schedule;
import com.umitunal.stepflow.spi.ExecutionDetail;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds execution details with their raw JSON documents.
 */
class ExecutionDetailFactory {
    private static final DateTimeFormatter ZONED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss zzz");

    private final ObjectMapper mapper;

    ExecutionDetailFactory() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    ExecutionDetail outsideSchedule(Job job, Schedule schedule, String timezone) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("schedule", schedule);
        raw.put("timezone", timezone);
        return new ExecutionDetail(job, ExecutionDetail.Detail.SKIPPED_STEP_OUTSIDE_OF_THE_SCHEDULE,
                ExecutionDetail.Status.SUCCESS, toJson(raw));
    }

    ExecutionDetail maxExtensionsReached(Job job) {
        return new ExecutionDetail(job, ExecutionDetail.Detail.SKIPPED_STEP_MAX_EXTENSIONS_REACHED,
                ExecutionDetail.Status.SUCCESS, null);
    }

    ExecutionDetail extendedToSchedule(Job job, long delayMs, Instant nextAvailableTime, String timezone,
                                       Schedule schedule, int maxExtensions) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("delayMs", delayMs);
        raw.put("nextAvailableTime", timezone == null
                ? nextAvailableTime.toString()
                : ZONED_FORMAT.format(nextAvailableTime.atZone(ZoneId.of(timezone))));
        raw.put("timezone", timezone);
        raw.put("schedule", schedule);
        raw.put("scheduleExtensionsCount", job.getScheduleExtensionsCount());
        raw.put("maxScheduleExtensions", maxExtensions);
        return new ExecutionDetail(job, ExecutionDetail.Detail.STEP_EXTENDED_TO_SCHEDULE,
                ExecutionDetail.Status.PENDING, toJson(raw));
    }

    ExecutionDetail skippedByConditions(Job job) {
        return new ExecutionDetail(job, ExecutionDetail.Detail.SKIPPED_STEP_BY_CONDITIONS,
                ExecutionDetail.Status.SUCCESS, null);
    }

    private String toJson(Map<String, Object> raw) {
        try {
            return mapper.writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            throw new StepflowException("Failed to serialize execution detail", e);
        }
    }
}
