package com.profilescheduler.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProfileSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProfileSchedulerApplication.class, args);
    }
}
