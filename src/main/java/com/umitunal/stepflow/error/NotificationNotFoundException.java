package com.umitunal.stepflow.error;

public class NotificationNotFoundException extends StepflowException {
    private final String notificationId;

    public NotificationNotFoundException(String notificationId) {
        super("Notification with id " + notificationId + " not found");
        this.notificationId = notificationId;
    }

    public String getNotificationId() { return notificationId; }
}
