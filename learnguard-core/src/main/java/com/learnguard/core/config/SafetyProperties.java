package com.learnguard.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "learnguard.safety")
@Getter
@Setter
public class SafetyProperties {

    private boolean profanityFilterEnabled = true;
    private boolean contentFilterEnabled = true;
    private boolean ageVerificationRequired = true;
    private boolean escalationEnabled = true;

    /** Failed checks at or above this confidence escalate at severity high. */
    private double escalationThreshold = 0.8;

    private Duration notificationTimeout = Duration.ofSeconds(10);
}
