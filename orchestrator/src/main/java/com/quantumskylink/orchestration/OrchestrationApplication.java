package com.quantumskylink.orchestration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
public class OrchestrationApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestrationApplication.class, args);
    }

    /** Source of every timestamp in the service; tests substitute a fixed clock. */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
