package com.learnguard.core.escalation.notification;

/**
 * Delivery route for teacher alerts (email, sms, in_app, push). Fire-and-forget:
 * a failure is logged by the dispatcher and never retried.
 */
public interface NotificationChannel {

    String name();

    void send(TeacherNotification notification);
}
