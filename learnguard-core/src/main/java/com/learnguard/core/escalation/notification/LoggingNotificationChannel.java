package com.learnguard.core.escalation.notification;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes the alert to the log. Stands in for the real delivery services, which live
 * outside this application.
 */
@Slf4j
public class LoggingNotificationChannel implements NotificationChannel {

    private final String name;

    public LoggingNotificationChannel(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void send(TeacherNotification notification) {
        log.info("[NOTIFY] Sent | channel={} | escalationId={} | teacherId={} | severity={} | subject={}",
            name, notification.getEscalationId(), notification.getTeacherId(),
            notification.getSeverity(), notification.getSubject());
        log.debug("[NOTIFY] Message body | channel={}\n{}", name, notification.getMessage());
    }
}
