package com.umitunal.stepflow.spi;

import com.umitunal.stepflow.schedule.Schedule;

public interface SubscriberScheduleProvider {

    /**
     * @return the subscriber's schedule, or null if none is configured
     */
    Schedule getSchedule(String environmentId, String organizationId, String subscriberId) throws Exception;
}
