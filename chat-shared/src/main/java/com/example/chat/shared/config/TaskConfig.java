package com.example.chat.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

@Configuration
public class TaskConfig {

    /**
     * Single thread for the periodic typing and location-share sweeps, so a sweep never
     * runs concurrently with itself.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler sweepScheduler() {
        return Schedulers.newSingle("ephemeral-sweep");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
