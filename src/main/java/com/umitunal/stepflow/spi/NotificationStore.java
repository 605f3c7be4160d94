package com.umitunal.stepflow.spi;

import com.umitunal.stepflow.model.Notification;

public interface NotificationStore {

    /**
     * @return the notification, or null if it does not exist
     */
    Notification find(String notificationId, String environmentId) throws Exception;
}
