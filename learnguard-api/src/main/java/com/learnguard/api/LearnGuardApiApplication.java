package com.learnguard.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.learnguard")
public class LearnGuardApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(LearnGuardApiApplication.class, args);
    }
}
