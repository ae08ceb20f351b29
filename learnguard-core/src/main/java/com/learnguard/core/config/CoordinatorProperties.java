package com.learnguard.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "learnguard.coordinator")
@Getter
@Setter
public class CoordinatorProperties {

    private int workerThreads = 16;

    /** An inappropriate input is redirected when its verdict is at least this confident. */
    private double inputBlockConfidence = 0.8;
}
