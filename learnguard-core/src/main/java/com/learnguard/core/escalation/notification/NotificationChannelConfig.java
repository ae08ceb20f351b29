package com.learnguard.core.escalation.notification;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NotificationChannelConfig {

    @Bean
    public NotificationChannel emailChannel() {
        return new LoggingNotificationChannel("email");
    }

    @Bean
    public NotificationChannel smsChannel() {
        return new LoggingNotificationChannel("sms");
    }

    @Bean
    public NotificationChannel inAppChannel() {
        return new LoggingNotificationChannel("in_app");
    }

    @Bean
    public NotificationChannel pushChannel() {
        return new LoggingNotificationChannel("push");
    }
}
