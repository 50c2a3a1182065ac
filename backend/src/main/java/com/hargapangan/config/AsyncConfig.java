package com.hargapangan.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Background threads: the evidence cleanup pool used by @Async and the scheduler that drives the
 * @Scheduled jobs, one thread per job so a long sync never delays override expiry.
 */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

    public static final String EVIDENCE_EXECUTOR = "evidence-executor";
    public static final String JOB_SCHEDULER = "job-scheduler";

    /** PriceSyncJob and OverrideExpiryJob. */
    public static final List<String> SCHEDULED_JOBS = List.of("price-sync", "override-expiry");

    @Bean(name = EVIDENCE_EXECUTOR)
    public Executor evidenceExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setThreadNamePrefix("evidence-");
        e.initialize();
        return e;
    }

    @Bean(name = JOB_SCHEDULER)
    public ThreadPoolTaskScheduler jobScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(SCHEDULED_JOBS.size());
        s.setThreadNamePrefix("job-scheduler-");
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.setAwaitTerminationSeconds(30);
        s.initialize();
        return s;
    }
}
