package com.programmersdiary.taskdaemon.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    @Bean
    public Clock clock(SchedulingSettings settings) {
        return Clock.system(settings.zoneId());
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler(SchedulingSettings settings, Clock clock) {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(settings.poolSize());
        scheduler.setThreadNamePrefix("task-daemon-");
        scheduler.setClock(clock);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(t -> log.error("Unhandled error in scheduled job", t));
        return scheduler;
    }
}
