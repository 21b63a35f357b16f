package com.example.progress.shared.config;

import com.example.progress.shared.util.MonotonicClock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

@Configuration
public class TaskConfig {

    /**
     * Thread pool for @Scheduled housekeeping.
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Workflow pipelines are started here so a slow stage worker never runs on a Netty event
     * loop thread. Stage waits themselves are timers and do not hold a thread.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler workflowScheduler(AppProperties appProperties) {
        return Schedulers.newBoundedElastic(
                appProperties.getWorkflow().getSchedulerThreads(),
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE,
                "workflow-");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MonotonicClock monotonicClock(Clock clock) {
        return new MonotonicClock(clock);
    }
}
